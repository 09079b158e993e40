/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Executable body of a function or script. Bodies are produced outside of the runtime core; the
 * core only runs them inside the execution context it has set up.
 */
@FunctionalInterface
public interface JSCode {

    /**
     * Runs the body.
     *
     * @param cx the current Context
     * @param frame the running execution context, its lexical environment resolves names and its
     *     this binding is the body's this
     * @return how the body finished, never null
     */
    Completion execute(Context cx, ExecutionContext frame);
}
