/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/** This is interface that all functions in JavaScript must implement. */
public interface Function extends Callable, Constructable {

    /** Whether the function has a [[Construct]] internal method. */
    boolean isConstructor();
}
