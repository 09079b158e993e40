/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The prototype shared by the iterators of one kind, such as %ArrayIteratorPrototype%. It
 * provides "next" and, when the kind has a tag, {@code @@toStringTag}. Its own prototype is
 * %IteratorPrototype%, whose {@code @@iterator} returns this.
 */
public final class IteratorPrototype extends NativeObject {
    private static final long serialVersionUID = -1254587210634518396L;

    private IteratorPrototype(ScriptableObject prototype) {
        super(prototype);
    }

    /**
     * Creates a prototype for one iterator kind.
     *
     * @param functionPrototype the prototype of the "next" function
     * @param parent %IteratorPrototype%
     * @param tag the value of {@code @@toStringTag}, or null for none
     */
    public IteratorPrototype(
            ScriptableObject functionPrototype, ScriptableObject parent, String tag) {
        super(parent);
        defineProperty(
                ES6Iterator.NEXT_METHOD,
                new LambdaFunction(
                        functionPrototype, ES6Iterator.NEXT_METHOD, 0, IteratorPrototype::js_next),
                DONTENUM);
        if (tag != null) {
            defineProperty(SymbolKey.TO_STRING_TAG, tag, READONLY | DONTENUM);
        }
    }

    /** Creates %IteratorPrototype%, ECMA 2015 25.1.2. */
    static IteratorPrototype createBase(
            ScriptableObject objectPrototype, ScriptableObject functionPrototype) {
        IteratorPrototype base = new IteratorPrototype(objectPrototype);
        base.defineProperty(
                SymbolKey.ITERATOR,
                new LambdaFunction(
                        functionPrototype, "[Symbol.iterator]", 0, (cx, thisObj, args) -> thisObj),
                DONTENUM);
        return base;
    }

    private static Object js_next(Context cx, Object thisObj, Object[] args) {
        if (!(thisObj instanceof ES6Iterator)) {
            throw ScriptRuntime.typeErrorById(
                    "msg.incompat.call", ES6Iterator.NEXT_METHOD);
        }
        return ((ES6Iterator) thisObj).next(cx);
    }
}
