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
import org.junit.jupiter.api.Test;
import org.mozilla.ecmacore.BoundFunction;
import org.mozilla.ecmacore.Completion;
import org.mozilla.ecmacore.Context;
import org.mozilla.ecmacore.ContextFactory;
import org.mozilla.ecmacore.EcmaError;
import org.mozilla.ecmacore.JSDescriptor;
import org.mozilla.ecmacore.JSFunction;
import org.mozilla.ecmacore.LambdaFunction;
import org.mozilla.ecmacore.PropertyDescriptor;
import org.mozilla.ecmacore.ScriptableObject;
import org.mozilla.ecmacore.Undefined;

/** Tests for functions created by Function.prototype.bind. */
public class BoundFunctionTest {

    private static JSFunction collector(Context cx) {
        return cx.newFunction(
                JSDescriptor.builder()
                        .name("collect")
                        .params("a", "b", "c")
                        .strict(true)
                        .code(
                                (c, frame) ->
                                        Completion.returnValue(
                                                c.newArray(
                                                        frame.getThisBinding(),
                                                        c.getName("a"),
                                                        c.getName("b"),
                                                        c.getName("c"))))
                        .build());
    }

    @Test
    public void boundThisAndArguments() {
        try (Context cx = Context.enter()) {
            ScriptableObject self = cx.newObject();
            BoundFunction bound = cx.bind(collector(cx), self, 1);

            ScriptableObject result =
                    (ScriptableObject) bound.call(cx, "ignored this", new Object[] {2, 3, 4});
            assertSame(self, result.get(0));
            assertEquals(1, result.get(1));
            assertEquals(2, result.get(2));
            assertEquals(3, result.get(3));
        }
    }

    @Test
    public void boundArgumentsAreCopied() {
        try (Context cx = Context.enter()) {
            Object[] args = {"first", "second"};
            BoundFunction bound = cx.bind(collector(cx), null, args);
            args[0] = "changed";

            ScriptableObject result =
                    (ScriptableObject) bound.call(cx, Undefined.instance, new Object[0]);
            assertEquals("first", result.get(1));
            assertEquals("second", result.get(2));
        }
    }

    @Test
    public void lengthAndName() {
        try (Context cx = Context.enter()) {
            JSFunction target = collector(cx);
            assertEquals(2, cx.bind(target, null, 1).get("length"));
            assertEquals(0, cx.bind(target, null, 1, 2, 3, 4).get("length"));
            BoundFunction bound = cx.bind(target, null);
            assertEquals(3, bound.get("length"));
            assertEquals("bound collect", bound.get("name"));
            assertEquals("bound bound collect", cx.bind(bound, null).get("name"));

            PropertyDescriptor name = bound.getOwnProperty("name");
            assertFalse(name.isWritable());
            assertTrue(name.isConfigurable());
            assertFalse(bound.hasOwnProperty("prototype"));
            assertSame(target.getPrototype(), bound.getPrototype());
        }
    }

    @Test
    public void constructUsesTargetPrototype() {
        try (Context cx = Context.enter()) {
            JSFunction target =
                    cx.newFunction(
                            JSDescriptor.builder()
                                    .name("Point")
                                    .params("x", "y")
                                    .code(
                                            (c, frame) -> {
                                                ScriptableObject self =
                                                        (ScriptableObject) frame.getThisBinding();
                                                self.put("x", c.getName("x"), true);
                                                self.put("y", c.getName("y"), true);
                                                return Completion.normal();
                                            })
                                    .build());
            BoundFunction bound = cx.bind(target, "ignored", 1);
            assertTrue(bound.isConstructor());

            ScriptableObject p = bound.construct(cx, new Object[] {2}, null);
            assertEquals(1, p.get("x"));
            assertEquals(2, p.get("y"));
            assertSame(target.get("prototype"), p.getPrototype());
            assertTrue(bound.hasInstance(p));
        }
    }

    @Test
    public void boundNonConstructorRefusesConstruct() {
        try (Context cx = Context.enter()) {
            LambdaFunction plain =
                    new LambdaFunction(cx, "plain", 0, (c, thisObj, args) -> Undefined.instance);
            BoundFunction bound = cx.bind(plain, null);
            assertFalse(bound.isConstructor());
            EcmaError e =
                    assertThrows(EcmaError.class, () -> bound.construct(cx, new Object[0], null));
            assertEquals("TypeError", e.getName());
        }
    }

    @Test
    public void bindRequiresCallable() {
        try (Context cx = Context.enter()) {
            EcmaError e = assertThrows(EcmaError.class, () -> cx.bind(cx.newObject(), null));
            assertEquals("TypeError", e.getName());
        }
    }

    @Test
    public void restrictedPropertiesByDefault() {
        try (Context cx = Context.enter()) {
            BoundFunction bound = cx.bind(collector(cx), null);
            for (String name : Arrays.asList("caller", "arguments")) {
                PropertyDescriptor desc = bound.getOwnProperty(name);
                assertTrue(desc.isAccessorDescriptor());
                assertFalse(desc.isConfigurable());
                EcmaError e = assertThrows(EcmaError.class, () -> bound.get(name));
                assertEquals("TypeError", e.getName());
            }
        }
    }

    @Test
    public void restrictedPropertiesCanBeTurnedOff() {
        ContextFactory factory =
                new ContextFactory() {
                    @Override
                    protected boolean hasFeature(Context cx, int featureIndex) {
                        if (featureIndex == Context.FEATURE_RESTRICTED_BOUND_FUNCTIONS) {
                            return false;
                        }
                        return super.hasFeature(cx, featureIndex);
                    }
                };
        try (Context cx = factory.enterContext()) {
            LambdaFunction plain =
                    new LambdaFunction(cx, "plain", 0, (c, thisObj, args) -> Undefined.instance);
            BoundFunction bound = cx.bind(plain, null);
            assertFalse(bound.hasOwnProperty("caller"));
            assertFalse(bound.hasOwnProperty("arguments"));
        }
    }
}
