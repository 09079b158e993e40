/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * An object environment record, ECMA 5 10.2.1.2: the bindings are the properties of a binding
 * object. The global environment is one of these over the {@link TopLevel} object.
 */
public class ObjectEnvironment extends Environment {
    private static final long serialVersionUID = 3906234812391092470L;

    private final ScriptableObject bindingObject;
    private final boolean withEnvironment;

    public ObjectEnvironment(
            ScriptableObject bindingObject, boolean withEnvironment, Environment outer) {
        super(outer);
        this.bindingObject = bindingObject;
        this.withEnvironment = withEnvironment;
    }

    public ScriptableObject getBindingObject() {
        return bindingObject;
    }

    @Override
    public boolean hasBinding(String name) {
        return bindingObject.hasProperty(name);
    }

    @Override
    public void createMutableBinding(String name, boolean deletable) {
        bindingObject.defineOwnProperty(
                name, new PropertyDescriptor(true, true, deletable, Undefined.instance), true);
    }

    @Override
    public void setMutableBinding(String name, Object value, boolean strict) {
        bindingObject.put(name, value, strict);
    }

    @Override
    public Object getBindingValue(String name, boolean strict) {
        if (!bindingObject.hasProperty(name)) {
            if (strict) {
                throw ScriptRuntime.referenceErrorById("msg.is.not.defined", name);
            }
            return Undefined.instance;
        }
        return bindingObject.get(name);
    }

    @Override
    public boolean deleteBinding(String name) {
        return bindingObject.delete(name, false);
    }

    @Override
    public Object implicitThisValue() {
        return withEnvironment ? bindingObject : Undefined.instance;
    }
}
