/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The class of exceptions thrown by the runtime core when script-visible errors happen.
 *
 * @see EcmaError
 * @see JavaScriptException
 */
public abstract class EcmaException extends RuntimeException {
    private static final long serialVersionUID = 1883500631321581169L;

    EcmaException(String message) {
        super(message);
    }

    /**
     * Details of the error: the message an uncaught script error would show, without any
     * decoration added by the Java exception.
     */
    public abstract String details();

    @Override
    public final String getMessage() {
        return details();
    }
}
