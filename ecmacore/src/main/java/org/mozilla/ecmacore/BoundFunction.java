/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/** The class for results of the Function.bind() operation, ECMA 5 15.3.4.5 */
public class BoundFunction extends BaseFunction {
    private static final long serialVersionUID = 2118137342826470729L;

    private final Callable targetFunction;
    private final Object boundThis;
    private final Object[] boundArgs;
    private final int length;
    private final String boundName;

    public BoundFunction(
            Context cx, Callable targetFunction, Object boundThis, Object[] boundArgs) {
        super(
                targetFunction instanceof ScriptableObject
                        ? ((ScriptableObject) targetFunction).getPrototype()
                        : cx.getFunctionPrototype());
        this.targetFunction = targetFunction;
        this.boundThis = boundThis;
        this.boundArgs = boundArgs.clone();
        if (targetFunction instanceof BaseFunction) {
            length = Math.max(0, ((BaseFunction) targetFunction).getLength() - boundArgs.length);
        } else {
            length = 0;
        }

        // If the target's "name" is not a string the bound name is "bound ".
        String targetName = "";
        if (targetFunction instanceof ScriptableObject) {
            Object nameVal = ((ScriptableObject) targetFunction).get("name");
            if (nameVal instanceof CharSequence) {
                targetName = nameVal.toString();
            }
        }
        this.boundName = "bound " + targetName;

        createProperties();
        if (cx.hasFeature(Context.FEATURE_RESTRICTED_BOUND_FUNCTIONS)) {
            installRestrictedProperties(cx);
        }
    }

    @Override
    public Object call(Context cx, Object thisObj, Object[] extraArgs) {
        return targetFunction.call(cx, boundThis, concat(boundArgs, extraArgs));
    }

    @Override
    public ScriptableObject construct(Context cx, Object[] extraArgs, Object newTarget) {
        if (targetFunction instanceof Constructable && isConstructor()) {
            Object target = (newTarget == null || newTarget == this) ? targetFunction : newTarget;
            return ((Constructable) targetFunction)
                    .construct(cx, concat(boundArgs, extraArgs), target);
        }
        throw ScriptRuntime.typeErrorById("msg.not.ctor", boundName);
    }

    @Override
    public boolean isConstructor() {
        if (targetFunction instanceof Function) {
            return ((Function) targetFunction).isConstructor();
        }
        return false;
    }

    @Override
    public boolean hasInstance(Object instance) {
        if (targetFunction instanceof BaseFunction) {
            return ((BaseFunction) targetFunction).hasInstance(instance);
        }
        throw ScriptRuntime.typeErrorById("msg.not.ctor", boundName);
    }

    @Override
    public int getLength() {
        return length;
    }

    @Override
    public String getFunctionName() {
        return boundName;
    }

    private static Object[] concat(Object[] first, Object[] second) {
        Object[] args = new Object[first.length + second.length];
        System.arraycopy(first, 0, args, 0, first.length);
        System.arraycopy(second, 0, args, first.length, second.length);
        return args;
    }
}
