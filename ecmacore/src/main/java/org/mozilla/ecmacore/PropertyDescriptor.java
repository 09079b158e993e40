/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import static org.mozilla.ecmacore.UniqueTag.NOT_FOUND;

/**
 * The Property Descriptor specification type, ECMA 5 8.10.
 *
 * <p>A descriptor is either a data descriptor ({@code value}, {@code writable}) or an accessor
 * descriptor ({@code get}, {@code set}), plus {@code enumerable} and {@code configurable}. Any field
 * holding {@link UniqueTag#NOT_FOUND} is absent; a descriptor with no data and no accessor field is
 * a generic descriptor. Descriptors passed to {@link ScriptableObject#defineOwnProperty} may leave
 * fields absent, descriptors stored on objects are always complete.
 *
 * <p>Instances are immutable.
 */
public final class PropertyDescriptor {

    final Object enumerable;
    final Object writable;
    final Object configurable;
    final Object getter;
    final Object setter;
    final Object value;

    public PropertyDescriptor(
            Object enumerable,
            Object writable,
            Object configurable,
            Object getter,
            Object setter,
            Object value) {
        this.enumerable = enumerable;
        this.writable = writable;
        this.configurable = configurable;
        this.getter = getter;
        this.setter = setter;
        this.value = value;
    }

    /** Creates a complete data descriptor. */
    public PropertyDescriptor(
            boolean enumerable, boolean writable, boolean configurable, Object value) {
        this(
                Boolean.valueOf(enumerable),
                Boolean.valueOf(writable),
                Boolean.valueOf(configurable),
                NOT_FOUND,
                NOT_FOUND,
                value);
    }

    /** Creates a complete data descriptor from {@link ScriptableObject} attribute flags. */
    public static PropertyDescriptor data(Object value, int attributes) {
        return new PropertyDescriptor(
                (attributes & ScriptableObject.DONTENUM) == 0,
                (attributes & ScriptableObject.READONLY) == 0,
                (attributes & ScriptableObject.PERMANENT) == 0,
                value);
    }

    /**
     * Creates a complete accessor descriptor from {@link ScriptableObject} attribute flags. A
     * missing getter or setter is given as {@code undefined}.
     */
    public static PropertyDescriptor accessor(Object getter, Object setter, int attributes) {
        return new PropertyDescriptor(
                Boolean.valueOf((attributes & ScriptableObject.DONTENUM) == 0),
                NOT_FOUND,
                Boolean.valueOf((attributes & ScriptableObject.PERMANENT) == 0),
                getter == null ? Undefined.instance : getter,
                setter == null ? Undefined.instance : setter,
                NOT_FOUND);
    }

    /**
     * ToPropertyDescriptor, ECMA 5 8.10.5. Reads the descriptor fields of a property descriptor
     * object, including inherited ones.
     */
    public static PropertyDescriptor fromObject(ScriptableObject desc) {
        Object enumerable = booleanField(desc, "enumerable");
        Object configurable = booleanField(desc, "configurable");
        Object value = desc.hasProperty("value") ? desc.get("value") : NOT_FOUND;
        Object writable = booleanField(desc, "writable");
        Object getter = desc.hasProperty("get") ? desc.get("get") : NOT_FOUND;
        if (getter != NOT_FOUND
                && !Undefined.isUndefined(getter)
                && !(getter instanceof Callable)) {
            throw ScriptRuntime.notFunctionError(getter, "getter");
        }
        Object setter = desc.hasProperty("set") ? desc.get("set") : NOT_FOUND;
        if (setter != NOT_FOUND
                && !Undefined.isUndefined(setter)
                && !(setter instanceof Callable)) {
            throw ScriptRuntime.notFunctionError(setter, "setter");
        }
        if ((getter != NOT_FOUND || setter != NOT_FOUND)
                && (value != NOT_FOUND || writable != NOT_FOUND)) {
            throw ScriptRuntime.typeErrorById("msg.both.data.and.accessor.desc");
        }
        return new PropertyDescriptor(enumerable, writable, configurable, getter, setter, value);
    }

    private static Object booleanField(ScriptableObject desc, String name) {
        if (!desc.hasProperty(name)) {
            return NOT_FOUND;
        }
        return Boolean.valueOf(ScriptRuntime.toBoolean(desc.get(name)));
    }

    /** FromPropertyDescriptor, ECMA 5 8.10.4. */
    public ScriptableObject toObject(Context cx) {
        ScriptableObject obj = cx.newObject();
        if (isDataDescriptor()) {
            obj.defineProperty("value", getValue(), ScriptableObject.EMPTY);
            obj.defineProperty("writable", Boolean.valueOf(isWritable()), ScriptableObject.EMPTY);
        } else {
            obj.defineProperty("get", getGetter(), ScriptableObject.EMPTY);
            obj.defineProperty("set", getSetter(), ScriptableObject.EMPTY);
        }
        obj.defineProperty("enumerable", Boolean.valueOf(isEnumerable()), ScriptableObject.EMPTY);
        obj.defineProperty(
                "configurable", Boolean.valueOf(isConfigurable()), ScriptableObject.EMPTY);
        return obj;
    }

    public boolean isDataDescriptor() {
        return value != NOT_FOUND || writable != NOT_FOUND;
    }

    public boolean isAccessorDescriptor() {
        return getter != NOT_FOUND || setter != NOT_FOUND;
    }

    public boolean isGenericDescriptor() {
        return !isDataDescriptor() && !isAccessorDescriptor();
    }

    /** True when every field is absent. */
    public boolean isEmpty() {
        return isGenericDescriptor() && enumerable == NOT_FOUND && configurable == NOT_FOUND;
    }

    public boolean hasEnumerable() {
        return enumerable != NOT_FOUND;
    }

    public boolean hasWritable() {
        return writable != NOT_FOUND;
    }

    public boolean hasConfigurable() {
        return configurable != NOT_FOUND;
    }

    public boolean hasValue() {
        return value != NOT_FOUND;
    }

    public boolean hasGetter() {
        return getter != NOT_FOUND;
    }

    public boolean hasSetter() {
        return setter != NOT_FOUND;
    }

    public boolean isEnumerable() {
        return enumerable == Boolean.TRUE;
    }

    public boolean isWritable() {
        return writable == Boolean.TRUE;
    }

    public boolean isConfigurable() {
        return configurable == Boolean.TRUE;
    }

    /** The value, or undefined when absent. */
    public Object getValue() {
        return value == NOT_FOUND ? Undefined.instance : value;
    }

    /** The getter, or undefined when absent. */
    public Object getGetter() {
        return getter == NOT_FOUND ? Undefined.instance : getter;
    }

    /** The setter, or undefined when absent. */
    public Object getSetter() {
        return setter == NOT_FOUND ? Undefined.instance : setter;
    }

    public PropertyDescriptor withValue(Object newValue) {
        return new PropertyDescriptor(
                enumerable, writable, configurable, getter, setter, newValue);
    }

    public PropertyDescriptor withWritable(boolean newWritable) {
        return new PropertyDescriptor(
                enumerable, Boolean.valueOf(newWritable), configurable, getter, setter, value);
    }

    /**
     * Completes a definition request for a property that does not exist yet: absent attributes
     * become false and absent values undefined. Generic descriptors produce data properties.
     */
    PropertyDescriptor complete() {
        Object e = enumerable == NOT_FOUND ? Boolean.FALSE : enumerable;
        Object c = configurable == NOT_FOUND ? Boolean.FALSE : configurable;
        if (isAccessorDescriptor()) {
            return new PropertyDescriptor(e, NOT_FOUND, c, getGetter(), getSetter(), NOT_FOUND);
        }
        Object w = writable == NOT_FOUND ? Boolean.FALSE : writable;
        return new PropertyDescriptor(e, w, c, NOT_FOUND, NOT_FOUND, getValue());
    }

    /**
     * Converts a complete descriptor to the other kind, keeping configurable and enumerable and
     * setting the other fields to their defaults (ECMA 5 8.12.9 step 9).
     */
    PropertyDescriptor switchKind() {
        if (isDataDescriptor()) {
            return new PropertyDescriptor(
                    enumerable,
                    NOT_FOUND,
                    configurable,
                    Undefined.instance,
                    Undefined.instance,
                    NOT_FOUND);
        }
        return new PropertyDescriptor(
                enumerable, Boolean.FALSE, configurable, NOT_FOUND, NOT_FOUND, Undefined.instance);
    }

    /**
     * True when every field present in this descriptor is also present in {@code current} with
     * the same value (ECMA 5 8.12.9 step 6).
     */
    boolean isSubsetOf(PropertyDescriptor current) {
        return sameField(enumerable, current.enumerable)
                && sameField(writable, current.writable)
                && sameField(configurable, current.configurable)
                && sameField(getter, current.getter)
                && sameField(setter, current.setter)
                && sameField(value, current.value);
    }

    private static boolean sameField(Object requested, Object current) {
        return requested == NOT_FOUND
                || (current != NOT_FOUND && ScriptRuntime.same(requested, current));
    }

    /**
     * Overwrites the fields of this complete descriptor with the fields present in {@code desc}
     * (ECMA 5 8.12.9 step 12).
     */
    PropertyDescriptor merge(PropertyDescriptor desc) {
        return new PropertyDescriptor(
                desc.enumerable != NOT_FOUND ? desc.enumerable : enumerable,
                desc.writable != NOT_FOUND ? desc.writable : writable,
                desc.configurable != NOT_FOUND ? desc.configurable : configurable,
                desc.getter != NOT_FOUND ? desc.getter : getter,
                desc.setter != NOT_FOUND ? desc.setter : setter,
                desc.value != NOT_FOUND ? desc.value : value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        appendField(sb, "value", value);
        appendField(sb, "writable", writable);
        appendField(sb, "get", getter);
        appendField(sb, "set", setter);
        appendField(sb, "enumerable", enumerable);
        appendField(sb, "configurable", configurable);
        return sb.append('}').toString();
    }

    private static void appendField(StringBuilder sb, String name, Object field) {
        if (field == NOT_FOUND) {
            return;
        }
        if (sb.length() > 1) {
            sb.append(", ");
        }
        sb.append(name).append(": ").append(ScriptRuntime.toDisplayString(field));
    }
}
