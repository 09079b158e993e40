/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Global code. Function declarations and vars of the script become properties of the global
 * object, and the body runs with the global object as this.
 *
 * <p>See ECMA 5 10.4.1 and 10.5.
 */
public class JSScript {

    private final JSDescriptor descriptor;

    public JSScript(JSDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public JSDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Execute the script.
     *
     * @param cx the Context associated with the current thread
     * @return the value of the completion of the body, undefined if it has none
     */
    public Object exec(Context cx) {
        boolean strict = descriptor.isStrict();
        ObjectEnvironment env = cx.getGlobalEnvironment();
        for (JSDescriptor fd : descriptor.getFunctionDeclarations()) {
            JSFunction fn = new JSFunction(cx, fd, env);
            String name = fd.getName();
            if (!env.hasBinding(name)) {
                env.createMutableBinding(name, false);
            } else {
                redeclareGlobal(env.getBindingObject(), name);
            }
            env.setMutableBinding(name, fn, strict);
        }
        for (String name : descriptor.getVarNames()) {
            if (!env.hasBinding(name)) {
                env.createMutableBinding(name, false);
            }
        }

        Completion completion;
        try (ExecutionContext frame =
                cx.enterExecutionContext(env, env, env.getBindingObject(), null, strict)) {
            completion = descriptor.getCode().execute(cx, frame);
        }
        if (completion == null) {
            throw Kit.codeBug("script body returned no completion");
        }
        switch (completion.getType()) {
            case THROW:
                throw new JavaScriptException(completion.getValue());
            case NORMAL:
            case RETURN:
                return completion.getValue();
            default:
                throw Kit.codeBug("unresolved " + completion + " in script body");
        }
    }

    /**
     * ECMA 5 10.5 step 5.e: a function declaration may replace a configurable global, which
     * becomes a non-configurable data property, or a writable and enumerable data property.
     * Anything else is a TypeError.
     */
    private static void redeclareGlobal(ScriptableObject global, String name) {
        PropertyDescriptor existing = null;
        for (ScriptableObject o = global; o != null && existing == null; o = o.getPrototype()) {
            existing = o.getOwnProperty(name);
        }
        if (existing == null) {
            return;
        }
        if (existing.isConfigurable()) {
            global.defineOwnProperty(
                    name, new PropertyDescriptor(true, true, false, Undefined.instance), true);
        } else if (existing.isAccessorDescriptor()
                || !(existing.isWritable() && existing.isEnumerable())) {
            throw ScriptRuntime.typeErrorById("msg.modify.readonly", name);
        }
    }
}
