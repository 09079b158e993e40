/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;
import java.util.List;

/**
 * A {@link PropertyMap} decorator that keeps the "constructor" property of a function's default
 * prototype object in a dedicated slot. The slot reads as an ordinary data property {writable,
 * !enumerable, configurable} whose value is the function, and it enumerates in the position a
 * property created first would have. Once the slot is removed, "constructor" is an ordinary key
 * of the backing map.
 *
 * @see BaseFunction#setupDefaultPrototype(Context)
 */
public class ConstructorSlotPropertyMap implements PropertyMap, Serializable {
    private static final long serialVersionUID = -3168402953417640932L;

    static final String CONSTRUCTOR = "constructor";

    private final PropertyMap backing;
    private PropertyDescriptor slot;

    public ConstructorSlotPropertyMap(PropertyMap backing, Object constructor) {
        this.backing = backing;
        this.slot = new PropertyDescriptor(false, true, true, constructor);
    }

    private boolean isSlot(Object key) {
        return slot != null && CONSTRUCTOR.equals(key);
    }

    @Override
    public PropertyDescriptor get(Object key) {
        return isSlot(key) ? slot : backing.get(key);
    }

    @Override
    public void put(Object key, PropertyDescriptor desc) {
        if (isSlot(key)) {
            slot = desc;
        } else {
            backing.put(key, desc);
        }
    }

    @Override
    public boolean has(Object key) {
        return isSlot(key) || backing.has(key);
    }

    @Override
    public boolean remove(Object key) {
        if (isSlot(key)) {
            slot = null;
            return true;
        }
        return backing.remove(key);
    }

    @Override
    public List<Object> keys() {
        List<Object> keys = backing.keys();
        if (slot != null) {
            int pos = 0;
            while (pos < keys.size() && ScriptRuntime.indexFromKey(keys.get(pos)) >= 0) {
                pos++;
            }
            keys.add(pos, CONSTRUCTOR);
        }
        return keys;
    }

    @Override
    public int size() {
        return backing.size() + (slot != null ? 1 : 0);
    }
}
