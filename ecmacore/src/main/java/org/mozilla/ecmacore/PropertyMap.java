/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.List;

/**
 * Storage of the own properties of a {@link ScriptableObject}. Keys are canonical property keys:
 * a {@link String} or a {@link SymbolKey}.
 */
public interface PropertyMap {

    /** Returns the descriptor stored for the key, or null. */
    PropertyDescriptor get(Object key);

    /** Stores a complete descriptor, keeping the key's position when it is already present. */
    void put(Object key, PropertyDescriptor desc);

    boolean has(Object key);

    /** Removes the key. Returns false if it was not present. */
    boolean remove(Object key);

    /**
     * The keys in enumeration order: array indices ascending, then other strings in insertion
     * order, then symbols in insertion order.
     */
    List<Object> keys();

    int size();
}
