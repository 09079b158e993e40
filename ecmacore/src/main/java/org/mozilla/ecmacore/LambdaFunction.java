/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * This class implements a single JavaScript function that has the prototype of the built-in
 * Function class, and which is implemented using a single function that can easily be
 * implemented using a lambda expression.
 */
public class LambdaFunction extends BaseFunction {
    private static final long serialVersionUID = -8388132362854748293L;

    protected final Callable target;
    private final Constructable constructor;
    private final String name;
    private final int length;

    /**
     * Create a new function. The new object will have the Function prototype and no parent.
     *
     * @param functionPrototype the prototype of the new function
     * @param name the value of the "name" property
     * @param length the value of the "length" property
     * @param target an object that implements the function in Java
     */
    public LambdaFunction(
            ScriptableObject functionPrototype, String name, int length, Callable target) {
        this(functionPrototype, name, length, target, null);
    }

    public LambdaFunction(Context cx, String name, int length, Callable target) {
        this(cx.getFunctionPrototype(), name, length, target, null);
    }

    /**
     * Create a new function that may also be used with the new operator, in which case {@code
     * constructor} creates the new object.
     */
    public LambdaFunction(
            Context cx, String name, int length, Callable target, Constructable constructor) {
        this(cx.getFunctionPrototype(), name, length, target, constructor);
        if (constructor != null) {
            setupDefaultPrototype(cx);
        }
    }

    private LambdaFunction(
            ScriptableObject functionPrototype,
            String name,
            int length,
            Callable target,
            Constructable constructor) {
        super(functionPrototype);
        this.target = target;
        this.constructor = constructor;
        this.name = name;
        this.length = length;
        createProperties();
    }

    @Override
    public Object call(Context cx, Object thisObj, Object[] args) {
        return target.call(cx, thisObj, args);
    }

    @Override
    public ScriptableObject construct(Context cx, Object[] args, Object newTarget) {
        if (constructor == null) {
            throw ScriptRuntime.typeErrorById("msg.not.ctor", name);
        }
        return constructor.construct(cx, args, newTarget == null ? this : newTarget);
    }

    @Override
    public boolean isConstructor() {
        return constructor != null;
    }

    @Override
    public int getLength() {
        return length;
    }

    @Override
    public String getFunctionName() {
        return name;
    }
}
