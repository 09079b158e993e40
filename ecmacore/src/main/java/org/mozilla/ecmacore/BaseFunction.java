/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The base class for Function objects: "length" and "name", the default "prototype" object,
 * [[Construct]] and instanceof.
 *
 * <p>See ECMA 15.3.
 */
public class BaseFunction extends NativeObject implements Function {
    private static final long serialVersionUID = 5311394446546053859L;

    private static final String FUNCTION_CLASS = "Function";
    static final String PROTOTYPE_PROPERTY_NAME = "prototype";

    public BaseFunction(ScriptableObject functionPrototype) {
        super(functionPrototype);
    }

    /**
     * Defines "length" and "name" from {@link #getLength()} and {@link #getFunctionName()}.
     * Subclasses call this once their own fields are set.
     */
    protected void createProperties() {
        defineOwnProperty(
                "length", new PropertyDescriptor(false, false, true, getLength()), true);
        defineOwnProperty(
                "name", new PropertyDescriptor(false, false, true, getFunctionName()), true);
    }

    /**
     * Creates the "prototype" property, a fresh object whose "constructor" refers back to this
     * function. The "constructor" property lives in a {@link ConstructorSlotPropertyMap} slot.
     */
    protected void setupDefaultPrototype(Context cx) {
        NativeObject obj =
                new NativeObject(
                        new ConstructorSlotPropertyMap(new OrderedPropertyMap(), this),
                        cx.getObjectPrototype());
        defineOwnProperty(
                PROTOTYPE_PROPERTY_NAME, new PropertyDescriptor(false, true, false, obj), true);
    }

    /**
     * Installs the "caller" and "arguments" accessors of restricted functions, both of them
     * %ThrowTypeError% (ECMA 5 13.2 step 19).
     */
    protected void installRestrictedProperties(Context cx) {
        BaseFunction thrower = ScriptRuntime.typeErrorThrower(cx);
        defineAccessor("caller", thrower, thrower, DONTENUM | PERMANENT);
        defineAccessor("arguments", thrower, thrower, DONTENUM | PERMANENT);
    }

    @Override
    public String getClassName() {
        return FUNCTION_CLASS;
    }

    /**
     * Implements the instanceof operator, ECMA 5 15.3.5.3.
     *
     * @param instance The value that appeared on the LHS of the instanceof operator
     * @return true if the "prototype" property of "this" appears in value's prototype chain
     */
    public boolean hasInstance(Object instance) {
        if (!(instance instanceof ScriptableObject)) {
            return false;
        }
        Object protoProp = get(PROTOTYPE_PROPERTY_NAME);
        if (!(protoProp instanceof ScriptableObject)) {
            throw ScriptRuntime.typeErrorById(
                    "msg.instanceof.bad.prototype", getFunctionName());
        }
        for (ScriptableObject proto = ((ScriptableObject) instance).getPrototype();
                proto != null;
                proto = proto.getPrototype()) {
            if (proto == protoProp) {
                return true;
            }
        }
        return false;
    }

    /** Should be overridden. */
    @Override
    public Object call(Context cx, Object thisObj, Object[] args) {
        return Undefined.instance;
    }

    /**
     * [[Construct]], ECMA 5 13.2.2: allocates the new object with {@link #createObject} and calls
     * the function with it. An object returned by the call replaces the allocated object.
     */
    @Override
    public ScriptableObject construct(Context cx, Object[] args, Object newTarget) {
        if (!isConstructor()) {
            throw ScriptRuntime.typeErrorById("msg.not.ctor", getFunctionName());
        }
        ScriptableObject result = createObject(cx, newTarget == null ? this : newTarget);
        Object val = call(cx, result, args);
        if (val instanceof ScriptableObject) {
            result = (ScriptableObject) val;
        }
        return result;
    }

    /**
     * Creates new script object. The default implementation of {@link #construct} uses this method
     * to get the value for {@code thisObj} argument when invoking {@link #call}. Its prototype is
     * the "prototype" property of {@code newTarget} if that is an object, Object.prototype
     * otherwise.
     */
    public ScriptableObject createObject(Context cx, Object newTarget) {
        Object proto = Undefined.instance;
        if (newTarget instanceof ScriptableObject) {
            proto = ((ScriptableObject) newTarget).get(PROTOTYPE_PROPERTY_NAME);
        }
        if (proto instanceof ScriptableObject) {
            return new NativeObject((ScriptableObject) proto);
        }
        return new NativeObject(cx.getObjectPrototype());
    }

    public int getLength() {
        return 0;
    }

    public String getFunctionName() {
        return "";
    }

    @Override
    public boolean isConstructor() {
        return false;
    }
}
