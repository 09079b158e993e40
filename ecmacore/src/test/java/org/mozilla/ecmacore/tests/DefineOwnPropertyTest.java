/* This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore.tests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.ecmacore.Context;
import org.mozilla.ecmacore.EcmaError;
import org.mozilla.ecmacore.LambdaFunction;
import org.mozilla.ecmacore.PropertyDescriptor;
import org.mozilla.ecmacore.ScriptRuntime;
import org.mozilla.ecmacore.ScriptableObject;
import org.mozilla.ecmacore.Undefined;
import org.mozilla.ecmacore.UniqueTag;

/** Tests for [[DefineOwnProperty]] validation and merging, ECMA 5 8.12.9. */
public class DefineOwnPropertyTest {

    private static final Object ABSENT = UniqueTag.NOT_FOUND;

    private Context cx;
    private ScriptableObject obj;

    @BeforeEach
    public void enter() {
        cx = Context.enter();
        obj = cx.newObject();
    }

    @AfterEach
    public void exit() {
        cx.close();
    }

    private static PropertyDescriptor value(Object v) {
        return new PropertyDescriptor(ABSENT, ABSENT, ABSENT, ABSENT, ABSENT, v);
    }

    private static PropertyDescriptor generic(Object enumerable, Object configurable) {
        return new PropertyDescriptor(enumerable, ABSENT, configurable, ABSENT, ABSENT, ABSENT);
    }

    private LambdaFunction constant(Object v) {
        return new LambdaFunction(cx, "get", 0, (lcx, thisObj, args) -> v);
    }

    @Test
    public void newPropertyDefaultsToFalseAndUndefined() {
        assertTrue(obj.defineOwnProperty("foo", generic(ABSENT, ABSENT), true));
        PropertyDescriptor desc = obj.getOwnProperty("foo");
        assertTrue(desc.isDataDescriptor());
        assertSame(Undefined.instance, desc.getValue());
        assertFalse(desc.isWritable());
        assertFalse(desc.isEnumerable());
        assertFalse(desc.isConfigurable());
    }

    @Test
    public void newAccessorKeepsMissingHalfUndefined() {
        LambdaFunction getter = constant(1);
        PropertyDescriptor request =
                new PropertyDescriptor(ABSENT, ABSENT, Boolean.TRUE, getter, ABSENT, ABSENT);
        assertTrue(obj.defineOwnProperty("foo", request, true));
        PropertyDescriptor desc = obj.getOwnProperty("foo");
        assertTrue(desc.isAccessorDescriptor());
        assertSame(getter, desc.getGetter());
        assertSame(Undefined.instance, desc.getSetter());
        assertEquals(1, obj.get("foo"));
    }

    @Test
    public void nonExtensibleRejectsNewProperty() {
        obj.preventExtensions();
        assertFalse(obj.defineOwnProperty("foo", value(1), false));
        assertNull(obj.getOwnProperty("foo"));
        EcmaError e =
                assertThrows(EcmaError.class, () -> obj.defineOwnProperty("foo", value(1), true));
        assertEquals("TypeError", e.getName());
    }

    @Test
    public void assignedPropertyRedefinedWithValueKeepsAttributes() {
        obj.put("foo", 100, false);
        assertTrue(obj.defineOwnProperty("foo", value(200), true));
        PropertyDescriptor desc = obj.getOwnProperty("foo");
        assertEquals(200, desc.getValue());
        assertTrue(desc.isWritable());
        assertTrue(desc.isEnumerable());
        assertTrue(desc.isConfigurable());
    }

    @Test
    public void emptyAndIdenticalRequestsSucceedOnFrozenProperty() {
        obj.defineProperty("foo", 1, ScriptableObject.READONLY | ScriptableObject.PERMANENT);
        assertTrue(obj.defineOwnProperty("foo", generic(ABSENT, ABSENT), false));
        assertTrue(obj.defineOwnProperty("foo", value(1), false));
        assertTrue(
                obj.defineOwnProperty(
                        "foo", new PropertyDescriptor(true, false, false, 1), false));
    }

    @Test
    public void nonConfigurableCannotBecomeConfigurable() {
        obj.defineProperty("foo", 1, ScriptableObject.PERMANENT);
        assertFalse(obj.defineOwnProperty("foo", generic(ABSENT, Boolean.TRUE), false));
        EcmaError e =
                assertThrows(
                        EcmaError.class,
                        () -> obj.defineOwnProperty("foo", generic(ABSENT, Boolean.TRUE), true));
        assertEquals("TypeError", e.getName());
        assertFalse(obj.getOwnProperty("foo").isConfigurable());
    }

    @Test
    public void nonConfigurableCannotChangeEnumerable() {
        obj.defineProperty("foo", 1, ScriptableObject.PERMANENT);
        assertFalse(obj.defineOwnProperty("foo", generic(Boolean.FALSE, ABSENT), false));
        assertTrue(obj.defineOwnProperty("foo", generic(Boolean.TRUE, ABSENT), false));
    }

    @Test
    public void nonConfigurableWritableValueMayChange() {
        obj.defineProperty("foo", 1, ScriptableObject.PERMANENT);
        assertTrue(obj.defineOwnProperty("foo", value(2), false));
        assertEquals(2, obj.get("foo"));
    }

    @Test
    public void nonConfigurableNonWritableValueIsFixed() {
        obj.defineProperty("foo", 1, ScriptableObject.PERMANENT | ScriptableObject.READONLY);
        assertFalse(obj.defineOwnProperty("foo", value(2), false));
        assertEquals(1, obj.get("foo"));
        assertTrue(obj.defineOwnProperty("foo", value(1.0), false));
    }

    @Test
    public void nonConfigurableWritableMayOnlyTurnReadOnly() {
        obj.defineProperty("foo", 1, ScriptableObject.PERMANENT);
        PropertyDescriptor readOnly =
                new PropertyDescriptor(ABSENT, Boolean.FALSE, ABSENT, ABSENT, ABSENT, ABSENT);
        PropertyDescriptor writable =
                new PropertyDescriptor(ABSENT, Boolean.TRUE, ABSENT, ABSENT, ABSENT, ABSENT);
        assertTrue(obj.defineOwnProperty("foo", readOnly, false));
        assertFalse(obj.defineOwnProperty("foo", writable, false));
        assertFalse(obj.getOwnProperty("foo").isWritable());
    }

    @Test
    public void nonWritableValueComparedWithSameValue() {
        obj.defineProperty("nan", Double.NaN, ScriptableObject.PERMANENT | ScriptableObject.READONLY);
        assertTrue(obj.defineOwnProperty("nan", value(Double.NaN), false));

        obj.defineProperty("zero", 0.0, ScriptableObject.PERMANENT | ScriptableObject.READONLY);
        assertFalse(obj.defineOwnProperty("zero", value(-0.0), false));
    }

    @Test
    public void nonConfigurableCannotSwitchKind() {
        obj.defineProperty("data", 1, ScriptableObject.PERMANENT);
        PropertyDescriptor toAccessor =
                new PropertyDescriptor(ABSENT, ABSENT, ABSENT, constant(1), ABSENT, ABSENT);
        assertFalse(obj.defineOwnProperty("data", toAccessor, false));

        obj.defineAccessor("acc", constant(2), null, ScriptableObject.PERMANENT);
        assertFalse(obj.defineOwnProperty("acc", value(3), false));
        assertTrue(obj.getOwnProperty("acc").isAccessorDescriptor());
    }

    @Test
    public void configurableSwitchToAccessorKeepsFlagsAndClearsData() {
        obj.defineProperty("foo", 1, ScriptableObject.DONTENUM);
        LambdaFunction getter = constant(5);
        PropertyDescriptor toAccessor =
                new PropertyDescriptor(ABSENT, ABSENT, ABSENT, getter, ABSENT, ABSENT);
        assertTrue(obj.defineOwnProperty("foo", toAccessor, true));
        PropertyDescriptor desc = obj.getOwnProperty("foo");
        assertTrue(desc.isAccessorDescriptor());
        assertFalse(desc.isDataDescriptor());
        assertFalse(desc.hasValue());
        assertFalse(desc.hasWritable());
        assertFalse(desc.isEnumerable());
        assertTrue(desc.isConfigurable());
        assertSame(Undefined.instance, desc.getSetter());
    }

    @Test
    public void configurableSwitchToDataDefaultsWritableFalse() {
        obj.defineAccessor("foo", constant(5), null, ScriptableObject.EMPTY);
        assertTrue(obj.defineOwnProperty("foo", value(7), true));
        PropertyDescriptor desc = obj.getOwnProperty("foo");
        assertTrue(desc.isDataDescriptor());
        assertEquals(7, desc.getValue());
        assertFalse(desc.isWritable());
        assertTrue(desc.isEnumerable());
        assertTrue(desc.isConfigurable());
        assertFalse(desc.hasGetter());
    }

    @Test
    public void nonConfigurableAccessorHalvesAreFixed() {
        LambdaFunction getter = constant(1);
        obj.defineAccessor("foo", getter, null, ScriptableObject.PERMANENT);
        PropertyDescriptor sameGetter =
                new PropertyDescriptor(ABSENT, ABSENT, ABSENT, getter, ABSENT, ABSENT);
        PropertyDescriptor otherGetter =
                new PropertyDescriptor(ABSENT, ABSENT, ABSENT, constant(1), ABSENT, ABSENT);
        PropertyDescriptor newSetter =
                new PropertyDescriptor(ABSENT, ABSENT, ABSENT, ABSENT, constant(1), ABSENT);
        assertTrue(obj.defineOwnProperty("foo", sameGetter, false));
        assertFalse(obj.defineOwnProperty("foo", otherGetter, false));
        assertFalse(obj.defineOwnProperty("foo", newSetter, false));
    }

    @Test
    public void storedDescriptorIsNotAliasedByCaller() {
        PropertyDescriptor request = new PropertyDescriptor(true, true, true, 1);
        obj.defineOwnProperty("foo", request, true);
        obj.defineOwnProperty("foo", value(2), true);
        assertEquals(1, request.getValue());
        assertEquals(2, obj.getOwnProperty("foo").getValue());
    }

    @Test
    public void numericKeysUseCanonicalString() {
        obj.defineProperty("0.000001", 1, ScriptableObject.EMPTY);
        assertEquals(1, obj.getOwnProperty(0.000001).getValue());
        obj.defineProperty(1, "one", ScriptableObject.EMPTY);
        assertTrue(obj.hasOwnProperty("1"));
        assertTrue(obj.hasOwnProperty(1.0));
    }

    @Test
    public void largeNumericKeysUseShortestDigits() {
        obj.defineProperty("1.23e+22", 1, ScriptableObject.EMPTY);
        assertEquals(1, obj.getOwnProperty(1.23e22).getValue());
        assertTrue(obj.hasOwnProperty(123e20));
        assertEquals("1.23e+22", ScriptRuntime.toPropertyKey(1.23e22));
    }
}
