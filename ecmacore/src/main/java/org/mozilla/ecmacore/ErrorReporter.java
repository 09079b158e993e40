/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * This is interface defines a protocol for the reporting of warnings during script execution.
 *
 * @see ContextFactory#setErrorReporter(ErrorReporter)
 */
public interface ErrorReporter {

    /**
     * Report a warning.
     *
     * <p>The implementing class may choose to ignore the warning if it desires.
     *
     * @param message a String describing the warning
     */
    void warning(String message);
}
