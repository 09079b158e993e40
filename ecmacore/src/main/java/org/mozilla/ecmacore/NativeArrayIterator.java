/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/** Iterator over the keys, values or entries of an array-like object, ECMA 2015 22.1.5. */
public final class NativeArrayIterator extends ES6Iterator {
    private static final long serialVersionUID = 1L;

    public enum ArrayIteratorType {
        ENTRIES,
        KEYS,
        VALUES,
    }

    private final ScriptableObject arrayLike;
    private final ArrayIteratorType type;
    private long index;

    public NativeArrayIterator(Context cx, ScriptableObject arrayLike, ArrayIteratorType type) {
        super(cx.getTopLevel().getBuiltinPrototype(TopLevel.Builtins.ArrayIterator));
        this.arrayLike = arrayLike;
        this.type = type;
        this.index = 0;
    }

    @Override
    public String getClassName() {
        return "Array Iterator";
    }

    @Override
    protected boolean isDone(Context cx) {
        return index >= ScriptRuntime.toLength(arrayLike.get("length"));
    }

    @Override
    protected Object nextValue(Context cx) {
        Number key = ScriptRuntime.wrapIndex(index++);
        if (type == ArrayIteratorType.KEYS) {
            return key;
        }
        Object value = arrayLike.get(key);
        if (type == ArrayIteratorType.ENTRIES) {
            return cx.newArray(key, value);
        }
        return value;
    }
}
