/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.PrintStream;

/** This is the default error reporter for JavaScript. */
class DefaultErrorReporter implements ErrorReporter {
    static final DefaultErrorReporter instance = new DefaultErrorReporter(System.err);

    private final PrintStream out;

    DefaultErrorReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void warning(String message) {
        out.println("warning: " + message);
    }
}
