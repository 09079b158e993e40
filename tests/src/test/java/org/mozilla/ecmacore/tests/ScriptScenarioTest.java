/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore.tests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mozilla.ecmacore.Callable;
import org.mozilla.ecmacore.Completion;
import org.mozilla.ecmacore.Context;
import org.mozilla.ecmacore.ES6Iterator;
import org.mozilla.ecmacore.EcmaError;
import org.mozilla.ecmacore.JSDescriptor;
import org.mozilla.ecmacore.JSFunction;
import org.mozilla.ecmacore.JSScript;
import org.mozilla.ecmacore.JavaScriptException;
import org.mozilla.ecmacore.ScriptRuntime;
import org.mozilla.ecmacore.ScriptableObject;
import org.mozilla.ecmacore.SymbolKey;
import org.mozilla.ecmacore.Undefined;

/**
 * Runs small programs built from descriptors against a fresh global, the way an interpreter
 * drives the runtime.
 */
public class ScriptScenarioTest {

    private static Object call(Context cx, Object fn, Object thisObj, Object... args) {
        return ((Callable) fn).call(cx, thisObj, args);
    }

    /** Drains an iterable the way for-of does. */
    private static List<Object> iterate(Context cx, ScriptableObject iterable) {
        Object iterator = call(cx, iterable.get(SymbolKey.ITERATOR), iterable);
        ScriptableObject it = ScriptableObject.ensureScriptableObject(iterator);
        List<Object> values = new ArrayList<>();
        for (; ; ) {
            ScriptableObject result =
                    ScriptableObject.ensureScriptableObject(
                            call(cx, it.get(ES6Iterator.NEXT_METHOD), it));
            if (ScriptRuntime.toBoolean(result.get(ES6Iterator.DONE_PROPERTY))) {
                return values;
            }
            values.add(result.get(ES6Iterator.VALUE_PROPERTY));
        }
    }

    @Test
    public void sumOverArguments() {
        // function sum() { var total = 0; for (var v of arguments) total += v; return total; }
        // var result = sum(1, 2, 3);
        JSDescriptor sum =
                JSDescriptor.builder()
                        .name("sum")
                        .vars("total")
                        .code(
                                (c, frame) -> {
                                    c.setName("total", 0);
                                    ScriptableObject args =
                                            (ScriptableObject) c.getName("arguments");
                                    for (Object v : iterate(c, args)) {
                                        double total = ScriptRuntime.toNumber(c.getName("total"));
                                        c.setName("total", total + ScriptRuntime.toNumber(v));
                                    }
                                    return Completion.returnValue(c.getName("total"));
                                })
                        .build();
        JSScript script =
                new JSScript(
                        JSDescriptor.builder()
                                .functionDeclaration(sum)
                                .vars("result")
                                .code(
                                        (c, frame) -> {
                                            c.setName(
                                                    "result",
                                                    call(c, c.getName("sum"), Undefined.instance,
                                                            1, 2, 3));
                                            return Completion.normal(c.getName("result"));
                                        })
                                .build());
        try (Context cx = Context.enter()) {
            assertEquals(Double.valueOf(6.0), script.exec(cx));
            assertEquals(Double.valueOf(6.0), cx.getTopLevel().get("result"));
        }
    }

    @Test
    public void methodCallThroughPrototype() {
        // function Counter(start) { this.count = start; }
        // Counter.prototype.increment = function () { return ++this.count; };
        // var c = new Counter(41); c.increment();
        JSDescriptor counter =
                JSDescriptor.builder()
                        .name("Counter")
                        .params("start")
                        .code(
                                (c, frame) -> {
                                    ((ScriptableObject) frame.getThisBinding())
                                            .put("count", c.getName("start"), true);
                                    return Completion.normal();
                                })
                        .build();
        JSDescriptor increment =
                JSDescriptor.builder()
                        .strict(true)
                        .code(
                                (c, frame) -> {
                                    ScriptableObject self =
                                            (ScriptableObject) frame.getThisBinding();
                                    double next = ScriptRuntime.toNumber(self.get("count")) + 1;
                                    self.put("count", next, true);
                                    return Completion.returnValue(next);
                                })
                        .build();
        JSScript script =
                new JSScript(
                        JSDescriptor.builder()
                                .functionDeclaration(counter)
                                .code(
                                        (c, frame) -> {
                                            ScriptableObject ctor =
                                                    (ScriptableObject) c.getName("Counter");
                                            ((ScriptableObject) ctor.get("prototype"))
                                                    .put("increment", c.newFunction(increment),
                                                            true);
                                            ScriptableObject instance =
                                                    ((JSFunction) ctor)
                                                            .construct(c, new Object[] {41}, null);
                                            return Completion.normal(
                                                    call(c, instance.get("increment"), instance));
                                        })
                                .build());
        try (Context cx = Context.enter()) {
            assertEquals(Double.valueOf(42.0), script.exec(cx));
        }
    }

    @Test
    public void strictCodeErrorsSurfaceAsExceptions() {
        // "use strict"; var frozen = Object.freeze({x: 0}); frozen.x = 1;
        JSScript script =
                new JSScript(
                        JSDescriptor.builder()
                                .strict(true)
                                .code(
                                        (c, frame) -> {
                                            ScriptableObject frozen = c.newObject();
                                            frozen.defineProperty(
                                                    "x", 0,
                                                    ScriptableObject.READONLY
                                                            | ScriptableObject.PERMANENT);
                                            frozen.preventExtensions();
                                            frozen.put("x", 1, c.isStrictMode());
                                            return Completion.normal();
                                        })
                                .build());
        try (Context cx = Context.enter()) {
            EcmaError e = assertThrows(EcmaError.class, () -> script.exec(cx));
            assertEquals("TypeError", e.getName());
            assertEquals(0, cx.getExecutionContextDepth());
        }
    }

    @Test
    public void thrownValuesCrossFunctionBoundaries() {
        // function inner() { throw "bad"; }
        // function outer() { try { inner(); } catch (e) { return "caught " + e; } }
        JSDescriptor inner =
                JSDescriptor.builder()
                        .name("inner")
                        .code((c, frame) -> Completion.throwValue("bad"))
                        .build();
        JSDescriptor outer =
                JSDescriptor.builder()
                        .name("outer")
                        .code(
                                (c, frame) -> {
                                    try {
                                        call(c, c.getName("inner"), Undefined.instance);
                                        return Completion.normal();
                                    } catch (JavaScriptException e) {
                                        return Completion.returnValue(
                                                "caught " + ScriptRuntime.toString(e.getValue()));
                                    }
                                })
                        .build();
        JSScript script =
                new JSScript(
                        JSDescriptor.builder()
                                .functionDeclaration(inner)
                                .functionDeclaration(outer)
                                .code(
                                        (c, frame) ->
                                                Completion.normal(
                                                        call(c, c.getName("outer"),
                                                                Undefined.instance)))
                                .build());
        try (Context cx = Context.enter()) {
            assertEquals("caught bad", script.exec(cx));
        }
    }

    @Test
    public void boundCallbackKeepsReceiver() {
        JSDescriptor describe =
                JSDescriptor.builder()
                        .strict(true)
                        .params("suffix")
                        .code(
                                (c, frame) -> {
                                    ScriptableObject self =
                                            (ScriptableObject) frame.getThisBinding();
                                    String label = ScriptRuntime.toString(self.get("label"));
                                    return Completion.returnValue(label + c.getName("suffix"));
                                })
                        .build();
        try (Context cx = Context.enter()) {
            ScriptableObject receiver = cx.newObject();
            receiver.put("label", "bound", true);
            Object bound = cx.bind(cx.newFunction(describe), receiver, "!");
            assertEquals("bound!", call(cx, bound, cx.newObject()));
            assertTrue(bound instanceof ScriptableObject);
            assertSame(cx.getFunctionPrototype(), ((ScriptableObject) bound).getPrototype());
        }
    }
}
