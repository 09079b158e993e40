/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Base class of the iterators created by the runtime. Subclasses supply {@link #isDone} and
 * {@link #nextValue}; once an iterator has reported done it stays done.
 */
public abstract class ES6Iterator extends NativeObject {
    private static final long serialVersionUID = 2438373029140003950L;

    public static final String NEXT_METHOD = "next";
    public static final String DONE_PROPERTY = "done";
    public static final String VALUE_PROPERTY = "value";

    private boolean exhausted = false;

    protected ES6Iterator(ScriptableObject prototype) {
        super(prototype);
    }

    protected abstract boolean isDone(Context cx);

    protected abstract Object nextValue(Context cx);

    /** Advances the iterator and returns an iterator result object. */
    public final ScriptableObject next(Context cx) {
        Object value = Undefined.instance;
        boolean done = exhausted || isDone(cx);
        if (done) {
            exhausted = true;
        } else {
            value = nextValue(cx);
        }
        return makeIteratorResult(cx, done, value);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /** CreateIterResultObject, ECMA 2015 7.4.7. */
    public static ScriptableObject makeIteratorResult(Context cx, boolean done, Object value) {
        ScriptableObject iteratorResult = cx.newObject();
        iteratorResult.defineProperty(VALUE_PROPERTY, value, ScriptableObject.EMPTY);
        iteratorResult.defineProperty(DONE_PROPERTY, Boolean.valueOf(done), ScriptableObject.EMPTY);
        return iteratorResult;
    }
}
