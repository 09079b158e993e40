/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * The wrapper object of a primitive value, as created by ToObject (ECMA 9.9). String wrappers
 * expose the characters as read-only index properties and a read-only "length".
 */
public class NativePrimitive extends NativeObject {
    private static final long serialVersionUID = 4521308429172630918L;

    private final Object primitiveValue;
    private final TopLevel.Builtins type;

    public NativePrimitive(Context cx, Object value) {
        super(cx.getTopLevel().getBuiltinPrototype(typeOf(value)));
        this.primitiveValue = value;
        this.type = typeOf(value);
        if (value instanceof CharSequence) {
            String s = value.toString();
            for (int i = 0; i < s.length(); i++) {
                getPropertyMap()
                        .put(
                                Integer.toString(i),
                                new PropertyDescriptor(
                                        true, false, false, String.valueOf(s.charAt(i))));
            }
            getPropertyMap()
                    .put("length", new PropertyDescriptor(false, false, false, s.length()));
        }
    }

    private static TopLevel.Builtins typeOf(Object value) {
        if (value instanceof CharSequence) {
            return TopLevel.Builtins.String;
        }
        if (value instanceof Number) {
            return TopLevel.Builtins.Number;
        }
        if (value instanceof Boolean) {
            return TopLevel.Builtins.Boolean;
        }
        if (value instanceof SymbolKey) {
            return TopLevel.Builtins.Symbol;
        }
        throw ScriptRuntime.typeErrorById("msg.invalid.type", value.getClass().getName());
    }

    @Override
    public String getClassName() {
        return type.name();
    }

    public Object getPrimitiveValue() {
        return primitiveValue;
    }
}
