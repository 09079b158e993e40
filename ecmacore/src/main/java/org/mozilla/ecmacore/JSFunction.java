/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Represents a JavaScript function built upon a {@link JSDescriptor}. All the immutable metadata
 * associated with the function is stored on the descriptor, with only the closure environment and
 * mutable properties held on the function object itself.
 */
public class JSFunction extends BaseFunction {
    private static final long serialVersionUID = 3920764541187218425L;

    private final JSDescriptor descriptor;
    private final Environment closure;

    public JSFunction(Context cx, JSDescriptor descriptor, Environment closure) {
        super(cx.getFunctionPrototype());
        this.descriptor = descriptor;
        this.closure = closure;
        createProperties();
        setupDefaultPrototype(cx);
        if (descriptor.isStrict()) {
            installRestrictedProperties(cx);
        }
    }

    public JSDescriptor getDescriptor() {
        return descriptor;
    }

    public Environment getClosure() {
        return closure;
    }

    public boolean isStrict() {
        return descriptor.isStrict();
    }

    @Override
    public int getLength() {
        return descriptor.getParamCount();
    }

    @Override
    public String getFunctionName() {
        return descriptor.getName();
    }

    @Override
    public boolean isConstructor() {
        return true;
    }

    /**
     * Runs the function and returns how its body completed: NORMAL, RETURN or THROW. The
     * execution context of the call has already been left when this returns.
     */
    public Completion invoke(Context cx, Object thisObj, Object[] args) {
        boolean strict = descriptor.isStrict();
        Object thisBinding = ScriptRuntime.computeThisBinding(cx, thisObj, strict);
        NativeCall activation = new NativeCall(this, args, closure);
        Completion completion;
        try (ExecutionContext frame =
                cx.enterExecutionContext(activation, activation, thisBinding, this, strict)) {
            activation.instantiateDeclarations(cx);
            completion = descriptor.getCode().execute(cx, frame);
        }
        if (completion == null) {
            throw Kit.codeBug("body of " + getFunctionName() + " returned no completion");
        }
        switch (completion.getType()) {
            case BREAK:
            case CONTINUE:
                throw Kit.codeBug(
                        "unresolved " + completion + " in body of " + getFunctionName());
            default:
                return completion;
        }
    }

    @Override
    public Object call(Context cx, Object thisObj, Object[] args) {
        Completion completion = invoke(cx, thisObj, args);
        switch (completion.getType()) {
            case THROW:
                throw new JavaScriptException(completion.getValue());
            case RETURN:
                return completion.getValue();
            default:
                return Undefined.instance;
        }
    }
}
