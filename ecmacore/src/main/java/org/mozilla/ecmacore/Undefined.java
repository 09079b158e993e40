/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * This class implements the Undefined value.
 *
 * <p>Java {@code null} stands for the JavaScript {@code null} value, so undefined needs a value of
 * its own.
 */
public final class Undefined {

    public static final Undefined instance = new Undefined();

    private Undefined() {}

    public static boolean isUndefined(Object obj) {
        return obj == instance;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
