/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.List;

/**
 * This class implements the activation of a function call: the declarative environment holding
 * its parameters, its "arguments" object, its nested functions and its vars.
 *
 * <p>See ECMA 5 10.5.
 *
 * @see Arguments
 */
public final class NativeCall extends DeclarativeEnvironment {
    private static final long serialVersionUID = -7471457301304454454L;

    private static final String ARGUMENTS = "arguments";

    final JSFunction function;
    final Object[] originalArgs;
    final boolean isStrict;

    private Arguments arguments;

    NativeCall(JSFunction function, Object[] args, Environment outer) {
        super(outer);
        this.function = function;
        this.originalArgs = (args == null) ? ScriptRuntime.emptyArgs : args;
        this.isStrict = function.getDescriptor().isStrict();
    }

    /**
     * Declaration binding instantiation. Runs once, after the execution context of the call has
     * been entered and before the body.
     *
     * @return the arguments object, or null if a parameter is named "arguments"
     */
    Arguments instantiateDeclarations(Context cx) {
        JSDescriptor desc = function.getDescriptor();

        // parameters, a repeated name ends up bound to its last position
        for (int i = 0; i < desc.getParamCount(); ++i) {
            Object val = i < originalArgs.length ? originalArgs[i] : Undefined.instance;
            bind(desc.getParamName(i), val);
        }

        if (!desc.hasParam(ARGUMENTS)) {
            arguments = new Arguments(this, cx);
            if (isStrict) {
                createImmutableBinding(ARGUMENTS, false);
            } else {
                createMutableBinding(ARGUMENTS, false);
            }
            initializeBinding(ARGUMENTS, arguments);
        }

        List<JSDescriptor> functions = desc.getFunctionDeclarations();
        for (JSDescriptor fd : functions) {
            bind(fd.getName(), new JSFunction(cx, fd, this));
        }

        for (String name : desc.getVarNames()) {
            if (!hasBinding(name)) {
                createMutableBinding(name, false);
                initializeBinding(name, Undefined.instance);
            }
        }
        return arguments;
    }

    private void bind(String name, Object value) {
        if (hasBinding(name)) {
            setMutableBinding(name, value, false);
        } else {
            createMutableBinding(name, false);
            initializeBinding(name, value);
        }
    }

    public JSFunction getFunction() {
        return function;
    }

    /** The arguments object of this activation, null before instantiation. */
    public ScriptableObject getArguments() {
        return arguments;
    }
}
