/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * This class implements the Object native object, and the static property APIs of the Object
 * constructor.
 *
 * <p>See ECMA 15.2.
 */
public class NativeObject extends ScriptableObject {
    private static final long serialVersionUID = -6345305608474346996L;

    public NativeObject() {}

    public NativeObject(ScriptableObject prototype) {
        super(prototype);
    }

    public NativeObject(PropertyMap map, ScriptableObject prototype) {
        super(map, prototype);
    }

    @Override
    public String getClassName() {
        return "Object";
    }

    /**
     * Object.defineProperty, ECMA 5 15.2.3.6.
     *
     * @return the object
     */
    public static ScriptableObject defineProperty(
            Context cx, Object obj, Object id, Object attributes) {
        ScriptableObject o = ensureScriptableObject(obj);
        Object key = toKey(id);
        PropertyDescriptor desc = PropertyDescriptor.fromObject(ensureScriptableObject(attributes));
        o.defineOwnProperty(key, desc, true);
        return o;
    }

    /**
     * Object.defineProperties, ECMA 5 15.2.3.7.
     *
     * @return the object
     */
    public static ScriptableObject defineProperties(Context cx, Object obj, Object properties) {
        ScriptableObject o = ensureScriptableObject(obj);
        o.defineOwnProperties(cx, ScriptRuntime.toObject(cx, properties));
        return o;
    }

    /**
     * Object.getOwnPropertyDescriptor, ECMA 5 15.2.3.3.
     *
     * @return a descriptor object, or undefined if there is no such own property
     */
    public static Object getOwnPropertyDescriptor(Context cx, Object obj, Object id) {
        ScriptableObject o = ensureScriptableObject(obj);
        PropertyDescriptor desc = o.getOwnProperty(id);
        return desc == null ? Undefined.instance : desc.toObject(cx);
    }

    /** Object.create, ECMA 5 15.2.3.5. */
    public static ScriptableObject create(Context cx, Object prototype, Object properties) {
        if (prototype != null && !(prototype instanceof ScriptableObject)) {
            throw ScriptRuntime.typeErrorById(
                    "msg.arg.not.object", ScriptRuntime.typeof(prototype));
        }
        NativeObject obj = new NativeObject((ScriptableObject) prototype);
        if (!Undefined.isUndefined(properties)) {
            obj.defineOwnProperties(cx, ScriptRuntime.toObject(cx, properties));
        }
        return obj;
    }
}
