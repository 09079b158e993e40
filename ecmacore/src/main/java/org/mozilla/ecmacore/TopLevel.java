/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.EnumMap;

/**
 * The global object. It owns the prototypes of the built-in object kinds so that objects
 * created by the runtime can find them without going through script-visible properties.
 */
public class TopLevel extends NativeObject {
    private static final long serialVersionUID = -4648046356662472260L;

    /** An enumeration of built-in prototypes. */
    public enum Builtins {
        /** The built-in Object type. */
        Object,
        /** The built-in Array type. */
        Array,
        /** The built-in Function type. */
        Function,
        /** The built-in String type. */
        String,
        /** The built-in Number type. */
        Number,
        /** The built-in Boolean type. */
        Boolean,
        /** The built-in Symbol type. */
        Symbol,
        /** %IteratorPrototype% */
        Iterator,
        /** %ArrayIteratorPrototype% */
        ArrayIterator,
        /** The prototype of iterators over host collections. */
        CollectionIterator
    }

    private final EnumMap<Builtins, ScriptableObject> prototypes = new EnumMap<>(Builtins.class);

    public TopLevel() {
        NativeObject objectPrototype = new NativeObject();
        setPrototype(objectPrototype);
        prototypes.put(Builtins.Object, objectPrototype);

        LambdaFunction functionPrototype =
                new LambdaFunction(objectPrototype, "", 0, (cx, thisObj, args) -> Undefined.instance);
        prototypes.put(Builtins.Function, functionPrototype);

        prototypes.put(Builtins.String, new NativeObject(objectPrototype));
        prototypes.put(Builtins.Number, new NativeObject(objectPrototype));
        prototypes.put(Builtins.Boolean, new NativeObject(objectPrototype));
        prototypes.put(Builtins.Symbol, new NativeObject(objectPrototype));

        IteratorPrototype iteratorPrototype =
                IteratorPrototype.createBase(objectPrototype, functionPrototype);
        prototypes.put(Builtins.Iterator, iteratorPrototype);
        prototypes.put(
                Builtins.ArrayIterator,
                new IteratorPrototype(functionPrototype, iteratorPrototype, "Array Iterator"));
        prototypes.put(
                Builtins.CollectionIterator,
                new IteratorPrototype(functionPrototype, iteratorPrototype, null));

        NativeArray arrayPrototype = new NativeArray(objectPrototype);
        LambdaFunction values =
                new LambdaFunction(
                        functionPrototype,
                        "values",
                        0,
                        (cx, thisObj, args) ->
                                new NativeArrayIterator(
                                        cx,
                                        ScriptRuntime.toObject(cx, thisObj),
                                        NativeArrayIterator.ArrayIteratorType.VALUES));
        arrayPrototype.defineProperty("values", values, DONTENUM);
        arrayPrototype.defineProperty(SymbolKey.ITERATOR, values, DONTENUM);
        prototypes.put(Builtins.Array, arrayPrototype);

        defineProperty("undefined", Undefined.instance, READONLY | DONTENUM | PERMANENT);
        defineProperty("NaN", ScriptRuntime.NaNobj, READONLY | DONTENUM | PERMANENT);
        defineProperty(
                "Infinity",
                Double.valueOf(Double.POSITIVE_INFINITY),
                READONLY | DONTENUM | PERMANENT);
        defineProperty("globalThis", this, DONTENUM);
    }

    @Override
    public String getClassName() {
        return "global";
    }

    /**
     * Get the cached built-in object prototype from this scope with the given {@code type}.
     *
     * @param type the built-in type
     * @return the built-in prototype
     */
    public ScriptableObject getBuiltinPrototype(Builtins type) {
        return prototypes.get(type);
    }
}
