/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/** An object that can be called with the new operator. */
public interface Constructable {
    /**
     * Call the function as a constructor.
     *
     * <p>This method is invoked by the runtime in order to satisfy a use of the JavaScript
     * <code>new</code> operator. This method is expected to create a new object and return it.
     *
     * @param cx the current Context for this thread
     * @param args the array of arguments
     * @param newTarget the constructor the new operator was applied to, its "prototype" property
     *     becomes the prototype of the new object
     * @return the allocated object
     */
    ScriptableObject construct(Context cx, Object[] args, Object newTarget);
}
