/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The class of exceptions raised by the engine as described in ECMA edition 3. See section 15.11.6
 * in particular.
 *
 * <p>The core raises TypeError, ReferenceError and RangeError instances of this class; use {@link
 * ScriptRuntime#typeErrorById} and friends to create them.
 */
public class EcmaError extends EcmaException {
    private static final long serialVersionUID = -6261226256957286699L;

    private final String errorName;
    private final String errorMessage;

    /**
     * Create an exception with the specified detail message.
     *
     * <p>Errors internal to the engine will simply throw a RuntimeException.
     *
     * @param errorName the error name, e.g. "TypeError"
     * @param errorMessage the error message
     */
    EcmaError(String errorName, String errorMessage) {
        super(errorName);
        this.errorName = errorName;
        this.errorMessage = errorMessage;
    }

    @Override
    public String details() {
        return errorName + ": " + errorMessage;
    }

    /**
     * Gets the name of the error.
     *
     * <p>ECMA edition 3 defines the following errors: EvalError, RangeError, ReferenceError,
     * SyntaxError, TypeError, and URIError. Additional error names may be added in the future.
     *
     * <p>See ECMA edition 3, 15.11.7.9.
     *
     * @return the name of the error.
     */
    public String getName() {
        return errorName;
    }

    /**
     * Gets the message corresponding to the error.
     *
     * <p>See ECMA edition 3, 15.11.7.10.
     *
     * @return an implementation-defined string describing the error.
     */
    public String getErrorMessage() {
        return errorMessage;
    }
}
