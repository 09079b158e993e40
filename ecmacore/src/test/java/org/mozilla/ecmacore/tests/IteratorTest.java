/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore.tests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.ecmacore.Callable;
import org.mozilla.ecmacore.CollectionIterator;
import org.mozilla.ecmacore.Context;
import org.mozilla.ecmacore.ES6Iterator;
import org.mozilla.ecmacore.EcmaError;
import org.mozilla.ecmacore.NativeArray;
import org.mozilla.ecmacore.NativeArrayIterator;
import org.mozilla.ecmacore.NativeArrayIterator.ArrayIteratorType;
import org.mozilla.ecmacore.PropertyDescriptor;
import org.mozilla.ecmacore.ScriptableObject;
import org.mozilla.ecmacore.SymbolKey;
import org.mozilla.ecmacore.TopLevel;
import org.mozilla.ecmacore.Undefined;

/** Tests for the iterator protocol objects. */
public class IteratorTest {

    private Context cx;

    @BeforeEach
    public void enter() {
        cx = Context.enter();
    }

    @AfterEach
    public void exit() {
        cx.close();
    }

    private Object callNext(Object thisObj) {
        ScriptableObject proto =
                cx.getTopLevel().getBuiltinPrototype(TopLevel.Builtins.ArrayIterator);
        return ((Callable) proto.get(ES6Iterator.NEXT_METHOD))
                .call(cx, thisObj, new Object[0]);
    }

    @Test
    public void arrayValuesInOrder() {
        NativeArray array = cx.newArray("a", "b");
        NativeArrayIterator it = new NativeArrayIterator(cx, array, ArrayIteratorType.VALUES);

        ScriptableObject first = (ScriptableObject) callNext(it);
        assertEquals("a", first.get(ES6Iterator.VALUE_PROPERTY));
        assertEquals(Boolean.FALSE, first.get(ES6Iterator.DONE_PROPERTY));
        assertEquals(Arrays.asList("value", "done"), first.getOwnPropertyKeys());
        assertSame(cx.getObjectPrototype(), first.getPrototype());

        assertEquals("b", it.next(cx).get("value"));
        ScriptableObject last = it.next(cx);
        assertEquals(Boolean.TRUE, last.get("done"));
        assertSame(Undefined.instance, last.get("value"));
        assertTrue(it.isExhausted());
    }

    @Test
    public void exhaustedIteratorStaysDone() {
        NativeArray array = cx.newArray("a");
        NativeArrayIterator it = new NativeArrayIterator(cx, array, ArrayIteratorType.VALUES);
        it.next(cx);
        assertEquals(Boolean.TRUE, it.next(cx).get("done"));

        array.put(1, "late", true);
        assertEquals(Boolean.TRUE, it.next(cx).get("done"));
    }

    @Test
    public void lengthIsReadOnEveryStep() {
        NativeArray array = cx.newArray("a");
        NativeArrayIterator it = new NativeArrayIterator(cx, array, ArrayIteratorType.VALUES);
        assertEquals("a", it.next(cx).get("value"));
        array.put(1, "appended", true);
        assertEquals("appended", it.next(cx).get("value"));
    }

    @Test
    public void keysAndEntries() {
        NativeArray array = cx.newArray("a", "b");
        NativeArrayIterator keys = new NativeArrayIterator(cx, array, ArrayIteratorType.KEYS);
        assertEquals(0, keys.next(cx).get("value"));
        assertEquals(1, keys.next(cx).get("value"));

        NativeArrayIterator entries =
                new NativeArrayIterator(cx, array, ArrayIteratorType.ENTRIES);
        ScriptableObject entry = (ScriptableObject) entries.next(cx).get("value");
        assertEquals(0, entry.get(0));
        assertEquals("a", entry.get(1));
    }

    @Test
    public void nextRequiresAnIterator() {
        EcmaError e = assertThrows(EcmaError.class, () -> callNext(cx.newObject()));
        assertEquals("TypeError", e.getName());
        e = assertThrows(EcmaError.class, () -> callNext(Undefined.instance));
        assertEquals("TypeError", e.getName());
    }

    @Test
    public void prototypeChainAndToStringTag() {
        TopLevel scope = cx.getTopLevel();
        ScriptableObject base = scope.getBuiltinPrototype(TopLevel.Builtins.Iterator);
        ScriptableObject arrayIteratorProto =
                scope.getBuiltinPrototype(TopLevel.Builtins.ArrayIterator);
        assertSame(base, arrayIteratorProto.getPrototype());
        assertSame(cx.getObjectPrototype(), base.getPrototype());

        PropertyDescriptor tag = arrayIteratorProto.getOwnProperty(SymbolKey.TO_STRING_TAG);
        assertEquals("Array Iterator", tag.getValue());
        assertFalse(tag.isWritable());
        assertFalse(tag.isEnumerable());
        assertTrue(tag.isConfigurable());

        PropertyDescriptor next = arrayIteratorProto.getOwnProperty(ES6Iterator.NEXT_METHOD);
        assertFalse(next.isEnumerable());
        assertTrue(next.isWritable());

        ScriptableObject collectionProto =
                scope.getBuiltinPrototype(TopLevel.Builtins.CollectionIterator);
        assertFalse(collectionProto.hasOwnProperty(SymbolKey.TO_STRING_TAG));
    }

    @Test
    public void iteratorsAreTheirOwnIterables() {
        NativeArrayIterator it =
                new NativeArrayIterator(cx, cx.newArray(), ArrayIteratorType.VALUES);
        Object self = ((Callable) it.get(SymbolKey.ITERATOR)).call(cx, it, new Object[0]);
        assertSame(it, self);
    }

    @Test
    public void arrayPrototypeIteratorIsValues() {
        ScriptableObject arrayProto = cx.getTopLevel().getBuiltinPrototype(TopLevel.Builtins.Array);
        assertSame(arrayProto.get("values"), arrayProto.get(SymbolKey.ITERATOR));

        ScriptableObject arrayLike = cx.newObject();
        arrayLike.put("length", 1, true);
        arrayLike.put("0", "only", true);
        Object it = ((Callable) arrayProto.get("values")).call(cx, arrayLike, new Object[0]);
        assertEquals("only", ((ES6Iterator) it).next(cx).get("value"));

        EcmaError e =
                assertThrows(
                        EcmaError.class,
                        () ->
                                ((Callable) arrayProto.get("values"))
                                        .call(cx, Undefined.instance, new Object[0]));
        assertEquals("TypeError", e.getName());
    }

    @Test
    public void collectionIteratorTurnsEntriesIntoPairs() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("one", 1);
        map.put("two", 2);
        CollectionIterator it = new CollectionIterator(cx, map.entrySet().iterator());
        ScriptableObject pair = (ScriptableObject) it.next(cx).get("value");
        assertEquals("one", pair.get(0));
        assertEquals(1, pair.get(1));
        it.next(cx);
        assertEquals(Boolean.TRUE, it.next(cx).get("done"));

        CollectionIterator plain = new CollectionIterator(cx, Arrays.asList("x").iterator());
        assertEquals("x", plain.next(cx).get("value"));
        assertEquals("[object Collection Iterator]", plain.toString());
    }
}
