/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * An entry of the execution context stack, ECMA 5 10.3. Created by {@link
 * Context#enterExecutionContext}; closing it pops it, so it is meant to be used with
 * try-with-resources.
 */
public final class ExecutionContext implements AutoCloseable {

    private final Context context;
    private final Environment variableEnvironment;
    private Environment lexicalEnvironment;
    private final Object thisBinding;
    private final BaseFunction function;
    private final boolean strict;
    private boolean closed;

    ExecutionContext(
            Context context,
            Environment lexicalEnvironment,
            Environment variableEnvironment,
            Object thisBinding,
            BaseFunction function,
            boolean strict) {
        this.context = context;
        this.lexicalEnvironment = lexicalEnvironment;
        this.variableEnvironment = variableEnvironment;
        this.thisBinding = thisBinding;
        this.function = function;
        this.strict = strict;
    }

    public Environment getLexicalEnvironment() {
        return lexicalEnvironment;
    }

    /** Replaces the lexical environment, as block and with statements do. */
    public void setLexicalEnvironment(Environment env) {
        this.lexicalEnvironment = env;
    }

    public Environment getVariableEnvironment() {
        return variableEnvironment;
    }

    public Object getThisBinding() {
        return thisBinding;
    }

    /** The running function, null for global code. */
    public BaseFunction getFunction() {
        return function;
    }

    public boolean isStrict() {
        return strict;
    }

    /** Pops this context. Closing twice has no further effect. */
    @Override
    public void close() {
        if (!closed) {
            context.leaveExecutionContext(this);
            closed = true;
        }
    }
}
