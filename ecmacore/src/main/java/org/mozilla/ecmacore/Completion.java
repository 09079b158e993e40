/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The Completion specification type, ECMA 5 8.9: how a statement or function body finished.
 * Only RETURN and THROW cross a function call boundary; BREAK and CONTINUE must be consumed by
 * the statement they target.
 */
public final class Completion {

    public enum Type {
        NORMAL,
        RETURN,
        THROW,
        BREAK,
        CONTINUE
    }

    /** The value of a completion that carries none. */
    public static final Object EMPTY = UniqueTag.EMPTY;

    private static final Completion NORMAL_EMPTY = new Completion(Type.NORMAL, EMPTY, null);

    private final Type type;
    private final Object value;
    private final String target;

    private Completion(Type type, Object value, String target) {
        this.type = type;
        this.value = value;
        this.target = target;
    }

    public static Completion normal() {
        return NORMAL_EMPTY;
    }

    public static Completion normal(Object value) {
        return new Completion(Type.NORMAL, value, null);
    }

    public static Completion returnValue(Object value) {
        return new Completion(Type.RETURN, value, null);
    }

    public static Completion throwValue(Object value) {
        return new Completion(Type.THROW, value, null);
    }

    /**
     * @param target the label, or null for an unlabelled break
     */
    public static Completion breakCompletion(String target) {
        return new Completion(Type.BREAK, EMPTY, target);
    }

    /**
     * @param target the label, or null for an unlabelled continue
     */
    public static Completion continueCompletion(String target) {
        return new Completion(Type.CONTINUE, EMPTY, target);
    }

    public Type getType() {
        return type;
    }

    /** The carried value, undefined for an empty completion. */
    public Object getValue() {
        return value == EMPTY ? Undefined.instance : value;
    }

    public boolean hasValue() {
        return value != EMPTY;
    }

    public String getTarget() {
        return target;
    }

    public boolean isAbrupt() {
        return type != Type.NORMAL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (hasValue()) {
            sb.append('(').append(ScriptRuntime.toDisplayString(value)).append(')');
        }
        if (target != null) {
            sb.append(' ').append(target);
        }
        return sb.toString();
    }
}
