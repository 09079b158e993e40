/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Java reflection of JavaScript exceptions. Instances of this class are thrown by the JavaScript
 * 'throw' keyword, that is, whenever a function body completes with a throw completion.
 *
 * <p>The thrown value may be any value, not only an error object; it is carried unchanged.
 */
public class JavaScriptException extends EcmaException {
    private static final long serialVersionUID = -7666130513694669293L;

    private final Object value;

    /**
     * Create a JavaScript exception wrapping the given JavaScript value
     *
     * @param value the JavaScript value thrown.
     */
    public JavaScriptException(Object value) {
        super("uncaught JavaScript throw");
        this.value = value;
    }

    @Override
    public String details() {
        if (value == null) {
            return "null";
        }
        if (value instanceof ScriptableObject) {
            return "[object " + ((ScriptableObject) value).getClassName() + ']';
        }
        return ScriptRuntime.toDisplayString(value);
    }

    /**
     * @return the value wrapped by this exception
     */
    public Object getValue() {
        return value;
    }
}
