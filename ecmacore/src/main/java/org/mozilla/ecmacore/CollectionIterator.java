/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.Iterator;
import java.util.Map;

/**
 * Script iterator over a Java {@link Iterator}. Map entries are produced as [key, value]
 * arrays.
 */
public final class CollectionIterator extends ES6Iterator {
    private static final long serialVersionUID = 7613297434263213740L;

    private final transient Iterator<?> iterator;

    public CollectionIterator(Context cx, Iterator<?> iterator) {
        super(cx.getTopLevel().getBuiltinPrototype(TopLevel.Builtins.CollectionIterator));
        this.iterator = iterator;
    }

    @Override
    public String getClassName() {
        return "Collection Iterator";
    }

    @Override
    protected boolean isDone(Context cx) {
        return !iterator.hasNext();
    }

    @Override
    protected Object nextValue(Context cx) {
        Object next = iterator.next();
        if (next instanceof Map.Entry) {
            Map.Entry<?, ?> entry = (Map.Entry<?, ?>) next;
            return cx.newArray(entry.getKey(), entry.getValue());
        }
        return next;
    }
}
