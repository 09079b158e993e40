/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * This is the base class of all script objects. It holds the own properties of an object as
 * {@link PropertyDescriptor}s in a {@link PropertyMap}, the prototype reference and the
 * extensible flag, and implements the ordinary object internal methods.
 *
 * <p>Subclasses with exotic behavior (arrays, arguments objects) override {@link
 * #getOwnProperty}, {@link #defineOwnProperty} and {@link #delete}; every other operation is
 * expressed in terms of those three, so the overrides apply everywhere.
 *
 * <p>All public methods taking a property id accept any value and convert it with {@link
 * ScriptRuntime#toPropertyKey(Object)} first. Overriding methods must do the same before
 * looking at the key.
 */
public abstract class ScriptableObject implements Serializable {
    private static final long serialVersionUID = 2829861078851942586L;

    /**
     * The empty property attribute.
     *
     * <p>Used by {@link #defineProperty(Object, Object, int)}.
     *
     * @see #READONLY
     * @see #DONTENUM
     * @see #PERMANENT
     */
    public static final int EMPTY = 0x00;

    /**
     * Property attribute indicating assignment to this property is ignored.
     *
     * @see #EMPTY
     * @see #DONTENUM
     * @see #PERMANENT
     */
    public static final int READONLY = 0x01;

    /**
     * Property attribute indicating property is not enumerated.
     *
     * <p>Only enumerated properties will be returned by for-in and Object.keys.
     *
     * @see #EMPTY
     * @see #READONLY
     * @see #PERMANENT
     */
    public static final int DONTENUM = 0x02;

    /**
     * Property attribute indicating property cannot be deleted or reconfigured.
     *
     * @see #EMPTY
     * @see #READONLY
     * @see #DONTENUM
     */
    public static final int PERMANENT = 0x04;

    /** Value returned by lookups that find nothing, also the tag of absent descriptor fields. */
    public static final Object NOT_FOUND = UniqueTag.NOT_FOUND;

    private final PropertyMap map;

    /** The prototype of this object. */
    private ScriptableObject prototypeObject;

    private boolean isExtensible = true;

    protected ScriptableObject() {
        this(new OrderedPropertyMap(), null);
    }

    protected ScriptableObject(ScriptableObject prototype) {
        this(new OrderedPropertyMap(), prototype);
    }

    protected ScriptableObject(PropertyMap map, ScriptableObject prototype) {
        this.map = map;
        this.prototypeObject = prototype;
    }

    /**
     * Return the name of the class.
     *
     * <p>This is typically the same name as the constructor. Classes extending ScriptableObject
     * must implement this abstract method.
     */
    public abstract String getClassName();

    protected static Object toKey(Object id) {
        return ScriptRuntime.toPropertyKey(id);
    }

    protected final PropertyMap getPropertyMap() {
        return map;
    }

    /**
     * Returns the own property with the given id, or null. Stored descriptors are immutable, so
     * the result never writes through to the object.
     */
    public PropertyDescriptor getOwnProperty(Object id) {
        return map.get(toKey(id));
    }

    public boolean hasOwnProperty(Object id) {
        return getOwnProperty(id) != null;
    }

    /**
     * Defines or redefines an own property, ECMA 5 8.12.9 [[DefineOwnProperty]].
     *
     * @param id the property id
     * @param desc the requested fields, absent fields are left as they are
     * @param throwOnFailure whether a rejected request throws a TypeError or returns false
     * @return true if the property now has the requested fields
     */
    public boolean defineOwnProperty(Object id, PropertyDescriptor desc, boolean throwOnFailure) {
        Object key = toKey(id);
        PropertyDescriptor current = getOwnProperty(key);
        if (current == null) {
            if (!isExtensible()) {
                return reject(throwOnFailure, "msg.not.extensible", key);
            }
            map.put(key, desc.complete());
            return true;
        }
        if (desc.isSubsetOf(current)) {
            return true;
        }

        if (!current.isConfigurable()) {
            if (desc.isConfigurable()) {
                return reject(throwOnFailure, "msg.change.configurable.false.to.true", key);
            }
            if (desc.hasEnumerable() && desc.isEnumerable() != current.isEnumerable()) {
                return reject(
                        throwOnFailure, "msg.change.enumerable.with.configurable.false", key);
            }
        }

        PropertyDescriptor base = current;
        if (desc.isGenericDescriptor()) {
            // only enumerable and configurable change
        } else if (current.isDataDescriptor() != desc.isDataDescriptor()) {
            if (!current.isConfigurable()) {
                return reject(
                        throwOnFailure,
                        current.isDataDescriptor()
                                ? "msg.change.property.data.to.accessor.with.configurable.false"
                                : "msg.change.property.accessor.to.data.with.configurable.false",
                        key);
            }
            base = current.switchKind();
        } else if (current.isDataDescriptor()) {
            if (!current.isConfigurable() && !current.isWritable()) {
                if (desc.isWritable()) {
                    return reject(
                            throwOnFailure,
                            "msg.change.writable.false.to.true.with.configurable.false",
                            key);
                }
                if (desc.hasValue() && !ScriptRuntime.same(desc.value, current.value)) {
                    return reject(throwOnFailure, "msg.change.value.with.writable.false", key);
                }
            }
        } else if (!current.isConfigurable()) {
            if (desc.hasGetter() && !ScriptRuntime.same(desc.getter, current.getter)) {
                return reject(throwOnFailure, "msg.change.getter.with.configurable.false", key);
            }
            if (desc.hasSetter() && !ScriptRuntime.same(desc.setter, current.setter)) {
                return reject(throwOnFailure, "msg.change.setter.with.configurable.false", key);
            }
        }

        map.put(key, base.merge(desc));
        return true;
    }

    /** Returns false, or throws a TypeError with the given message when asked to. */
    protected static boolean reject(boolean throwOnFailure, String messageId, Object key) {
        if (throwOnFailure) {
            throw ScriptRuntime.typeErrorById(messageId, ScriptRuntime.toDisplayString(key));
        }
        return false;
    }

    /**
     * Define a JavaScript data property with the given attributes, throwing a TypeError if the
     * property cannot be defined.
     *
     * @param id the property id, a name or a {@link SymbolKey}
     * @param value the initial value of the property
     * @param attributes the attributes of the JavaScript property
     */
    public void defineProperty(Object id, Object value, int attributes) {
        defineOwnProperty(id, PropertyDescriptor.data(value, attributes), true);
    }

    /**
     * Define a JavaScript accessor property. A null getter or setter leaves that half undefined.
     */
    public void defineAccessor(Object id, Callable getter, Callable setter, int attributes) {
        defineOwnProperty(id, PropertyDescriptor.accessor(getter, setter, attributes), true);
    }

    /**
     * Defines the properties described by the own enumerable properties of {@code props}, ECMA 5
     * 15.2.3.7. All descriptors are read and validated before the first one is applied; the
     * definitions then run in order and the first rejection throws.
     */
    public void defineOwnProperties(Context cx, ScriptableObject props) {
        List<Object> ids = new ArrayList<>();
        List<PropertyDescriptor> descs = new ArrayList<>();
        for (Object key : props.getOwnPropertyKeys()) {
            PropertyDescriptor prop = props.getOwnProperty(key);
            if (prop == null || !prop.isEnumerable()) {
                continue;
            }
            Object descObj = props.get(key);
            ids.add(key);
            descs.add(PropertyDescriptor.fromObject(ensureScriptableObject(descObj)));
        }
        for (int i = 0; i < ids.size(); i++) {
            defineOwnProperty(ids.get(i), descs.get(i), true);
        }
    }

    /** Returns true if the property is found on this object or its prototype chain. */
    public boolean hasProperty(Object id) {
        Object key = toKey(id);
        for (ScriptableObject obj = this; obj != null; obj = obj.getPrototype()) {
            if (obj.getOwnProperty(key) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the value of the property found on this object or its prototype chain, or {@code
     * undefined}. A getter is called with {@code receiver} as this.
     */
    public Object get(Object id, Object receiver) {
        Object key = toKey(id);
        PropertyDescriptor desc = getOwnProperty(key);
        if (desc == null) {
            ScriptableObject parent = getPrototype();
            return parent == null ? Undefined.instance : parent.get(key, receiver);
        }
        if (desc.isDataDescriptor()) {
            return desc.getValue();
        }
        Object getter = desc.getGetter();
        if (Undefined.isUndefined(getter)) {
            return Undefined.instance;
        }
        return ((Callable) getter).call(Context.getContext(), receiver, ScriptRuntime.emptyArgs);
    }

    public Object get(Object id) {
        return get(id, this);
    }

    /**
     * Ordinary [[Set]], ECMA 2015 9.1.9.1. Returns false when the assignment is not allowed:
     * non-writable data properties (own or inherited), accessors without a setter, and objects
     * that are not extensible.
     */
    public boolean set(Object id, Object value, Object receiver) {
        Object key = toKey(id);
        PropertyDescriptor ownDesc = getOwnProperty(key);
        if (ownDesc == null) {
            ScriptableObject parent = getPrototype();
            if (parent != null) {
                return parent.set(key, value, receiver);
            }
            ownDesc = new PropertyDescriptor(true, true, true, Undefined.instance);
        }
        if (ownDesc.isDataDescriptor()) {
            if (!ownDesc.isWritable()) {
                return false;
            }
            if (!(receiver instanceof ScriptableObject)) {
                return false;
            }
            ScriptableObject target = (ScriptableObject) receiver;
            PropertyDescriptor existing = target.getOwnProperty(key);
            if (existing != null) {
                if (existing.isAccessorDescriptor() || !existing.isWritable()) {
                    return false;
                }
                return target.defineOwnProperty(
                        key,
                        new PropertyDescriptor(
                                NOT_FOUND, NOT_FOUND, NOT_FOUND, NOT_FOUND, NOT_FOUND, value),
                        false);
            }
            return target.defineOwnProperty(
                    key, new PropertyDescriptor(true, true, true, value), false);
        }
        Object setter = ownDesc.getSetter();
        if (Undefined.isUndefined(setter)) {
            return false;
        }
        ((Callable) setter).call(Context.getContext(), receiver, new Object[] {value});
        return true;
    }

    /**
     * Assigns a property with this object as the receiver.
     *
     * @param throwOnFailure true for strict mode code, where a refused assignment is a TypeError
     * @return false if the assignment was refused in lenient mode
     */
    public boolean put(Object id, Object value, boolean throwOnFailure) {
        Object key = toKey(id);
        if (set(key, value, this)) {
            return true;
        }
        if (!throwOnFailure) {
            return false;
        }
        PropertyDescriptor desc = null;
        for (ScriptableObject obj = this; obj != null && desc == null; obj = obj.getPrototype()) {
            desc = obj.getOwnProperty(key);
        }
        if (desc == null) {
            throw ScriptRuntime.typeErrorById(
                    "msg.not.extensible", ScriptRuntime.toDisplayString(key));
        }
        if (desc.isAccessorDescriptor()) {
            throw ScriptRuntime.typeErrorById(
                    "msg.set.prop.no.setter", ScriptRuntime.toDisplayString(key));
        }
        throw ScriptRuntime.typeErrorById(
                "msg.modify.readonly", ScriptRuntime.toDisplayString(key));
    }

    /**
     * Removes an own property, ECMA 5 8.12.7. Absent properties count as removed.
     *
     * @return false if the property is not configurable and throwOnFailure is false
     */
    public boolean delete(Object id, boolean throwOnFailure) {
        Object key = toKey(id);
        PropertyDescriptor desc = getOwnProperty(key);
        if (desc == null) {
            return true;
        }
        if (desc.isConfigurable()) {
            map.remove(key);
            return true;
        }
        return reject(throwOnFailure, "msg.delete.property.with.configurable.false", key);
    }

    /**
     * Returns the own property keys: array indices in ascending order, then the other strings in
     * the order they were created, then symbols in the order they were created.
     */
    public List<Object> getOwnPropertyKeys() {
        return map.keys();
    }

    /** Returns the prototype of the object, or null. */
    public ScriptableObject getPrototype() {
        return prototypeObject;
    }

    /**
     * Sets the prototype of the object, ECMA 2015 9.1.2.
     *
     * @return false if the object is not extensible or the new prototype would make the
     *     prototype chain circular
     */
    public boolean setPrototype(ScriptableObject prototype) {
        if (prototype == prototypeObject) {
            return true;
        }
        if (!isExtensible) {
            return false;
        }
        for (ScriptableObject p = prototype; p != null; p = p.getPrototype()) {
            if (p == this) {
                return false;
            }
        }
        prototypeObject = prototype;
        return true;
    }

    public boolean isExtensible() {
        return isExtensible;
    }

    public boolean preventExtensions() {
        isExtensible = false;
        return true;
    }

    /**
     * Ensures the argument is an object and returns it, throwing a TypeError otherwise.
     *
     * @param arg the value to check
     */
    public static ScriptableObject ensureScriptableObject(Object arg) {
        if (!(arg instanceof ScriptableObject)) {
            throw ScriptRuntime.typeErrorById(
                    "msg.arg.not.object", ScriptRuntime.typeof(arg));
        }
        return (ScriptableObject) arg;
    }

    @Override
    public String toString() {
        return "[object " + getClassName() + ']';
    }
}
