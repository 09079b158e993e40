/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The default {@link PropertyMap}. Array index keys live in a sorted map so that they enumerate
 * in ascending numeric order; all other keys keep their insertion order.
 */
public class OrderedPropertyMap implements PropertyMap, Serializable {
    private static final long serialVersionUID = 2389467290571409543L;

    private final TreeMap<Long, PropertyDescriptor> indexed = new TreeMap<>();
    private final LinkedHashMap<Object, PropertyDescriptor> named = new LinkedHashMap<>();

    @Override
    public PropertyDescriptor get(Object key) {
        long index = ScriptRuntime.indexFromKey(key);
        if (index >= 0) {
            return indexed.get(Long.valueOf(index));
        }
        return named.get(key);
    }

    @Override
    public void put(Object key, PropertyDescriptor desc) {
        long index = ScriptRuntime.indexFromKey(key);
        if (index >= 0) {
            indexed.put(Long.valueOf(index), desc);
        } else {
            named.put(key, desc);
        }
    }

    @Override
    public boolean has(Object key) {
        long index = ScriptRuntime.indexFromKey(key);
        if (index >= 0) {
            return indexed.containsKey(Long.valueOf(index));
        }
        return named.containsKey(key);
    }

    @Override
    public boolean remove(Object key) {
        long index = ScriptRuntime.indexFromKey(key);
        if (index >= 0) {
            return indexed.remove(Long.valueOf(index)) != null;
        }
        return named.remove(key) != null;
    }

    @Override
    public List<Object> keys() {
        List<Object> keys = new ArrayList<>(size());
        for (Long index : indexed.keySet()) {
            keys.add(index.toString());
        }
        List<Object> symbols = null;
        for (Map.Entry<Object, PropertyDescriptor> e : named.entrySet()) {
            Object key = e.getKey();
            if (key instanceof SymbolKey) {
                if (symbols == null) {
                    symbols = new ArrayList<>();
                }
                symbols.add(key);
            } else {
                keys.add(key);
            }
        }
        if (symbols != null) {
            keys.addAll(symbols);
        }
        return keys;
    }

    @Override
    public int size() {
        return indexed.size() + named.size();
    }
}
