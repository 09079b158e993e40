/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.math.BigInteger;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.regex.Pattern;

/**
 * This is the class that implements the runtime: type conversions, property keys, the errors
 * raised by the core and the %ThrowTypeError% intrinsic.
 */
public class ScriptRuntime {

    /** No instances should be created. */
    protected ScriptRuntime() {}

    public static final Object[] emptyArgs = new Object[0];

    public static final Integer zeroObj = Integer.valueOf(0);
    public static final Double NaNobj = Double.valueOf(Double.NaN);
    public static final double negativeZero = Double.longBitsToDouble(0x8000000000000000L);

    private static final String MESSAGES_BUNDLE = "org.mozilla.ecmacore.resources.Messages";

    private static final Pattern DECIMAL_LITERAL =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    /** Returns representation of the [[ThrowTypeError]] object. See ECMA 5, 13.2.3 */
    public static BaseFunction typeErrorThrower(Context cx) {
        if (cx.typeErrorThrower == null) {
            cx.typeErrorThrower = new ThrowTypeError(cx.getFunctionPrototype());
        }
        return cx.typeErrorThrower;
    }

    private static final class ThrowTypeError extends BaseFunction {
        private static final long serialVersionUID = -5891740962154902286L;

        ThrowTypeError(ScriptableObject functionPrototype) {
            super(functionPrototype);
            createProperties();
            // ECMA 5 13.2.3: length is neither writable nor configurable
            defineOwnProperty(
                    "length",
                    new PropertyDescriptor(
                            NOT_FOUND, NOT_FOUND, Boolean.FALSE, NOT_FOUND, NOT_FOUND, NOT_FOUND),
                    true);
            preventExtensions();
        }

        @Override
        public Object call(Context cx, Object thisObj, Object[] args) {
            throw typeErrorById("msg.op.not.allowed");
        }
    }

    /**
     * Convert the value to a boolean.
     *
     * <p>See ECMA 9.2.
     */
    public static boolean toBoolean(Object val) {
        if (val instanceof Boolean) {
            return ((Boolean) val).booleanValue();
        }
        if (val == null || Undefined.isUndefined(val)) {
            return false;
        }
        if (val instanceof CharSequence) {
            return ((CharSequence) val).length() != 0;
        }
        if (val instanceof Number) {
            double d = ((Number) val).doubleValue();
            return (!Double.isNaN(d) && d != 0.0);
        }
        // Objects and symbols
        return true;
    }

    /**
     * Convert the value to a number.
     *
     * <p>See ECMA 9.3.
     */
    public static double toNumber(Object val) {
        for (; ; ) {
            if (val instanceof Number) {
                return ((Number) val).doubleValue();
            }
            if (val == null) {
                return +0.0;
            }
            if (Undefined.isUndefined(val)) {
                return Double.NaN;
            }
            if (val instanceof CharSequence) {
                return toNumber(val.toString());
            }
            if (val instanceof Boolean) {
                return ((Boolean) val).booleanValue() ? 1 : +0.0;
            }
            if (val instanceof SymbolKey) {
                throw typeErrorById("msg.symbol.to.number");
            }
            if (val instanceof ScriptableObject) {
                val = toPrimitive(val, NUMBER_HINT);
                continue;
            }
            throw typeErrorById("msg.invalid.type", val.getClass().getName());
        }
    }

    /**
     * ToNumber applied to the String type
     *
     * <p>See ECMA 9.3.1
     */
    public static double toNumber(String s) {
        String str = trimJSWhitespace(s);
        if (str.isEmpty()) {
            return +0.0;
        }
        switch (str) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (str.length() > 2 && str.charAt(0) == '0') {
            char c = Character.toLowerCase(str.charAt(1));
            int radix = c == 'x' ? 16 : c == 'o' ? 8 : c == 'b' ? 2 : -1;
            if (radix != -1) {
                try {
                    return new BigInteger(str.substring(2), radix).doubleValue();
                } catch (NumberFormatException e) {
                    return Double.NaN;
                }
            }
        }
        if (!DECIMAL_LITERAL.matcher(str).matches()) {
            return Double.NaN;
        }
        return Double.parseDouble(str);
    }

    private static String trimJSWhitespace(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && isJSWhitespaceOrLineTerminator(s.charAt(start))) {
            start++;
        }
        while (end > start && isJSWhitespaceOrLineTerminator(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    public static boolean isJSWhitespaceOrLineTerminator(int c) {
        switch (c) {
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case ' ':
            case '\u00A0':
            case '\u1680':
            case '\u2028':
            case '\u2029':
            case '\uFEFF':
                return true;
            default:
                return Character.getType(c) == Character.SPACE_SEPARATOR;
        }
    }

    public static long toUint32(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return 0;
        }
        double t = Math.signum(d) * Math.floor(Math.abs(d));
        double m = t % 4294967296.0;
        if (m < 0) {
            m += 4294967296.0;
        }
        return (long) m;
    }

    public static long toUint32(Object val) {
        return toUint32(toNumber(val));
    }

    /** ES6 7.1.15 ToLength, clamped to 2^53-1. */
    public static long toLength(Object value) {
        double len = toNumber(value);
        if (Double.isNaN(len) || len <= 0.0) {
            return 0;
        }
        len = Math.floor(len);
        return (long) Math.min(len, 9007199254740991.0);
    }

    /**
     * Wrap an array index or length as a number value, using Integer where it fits so that common
     * values compare equal to integer literals.
     */
    public static Number wrapIndex(long index) {
        if (index <= Integer.MAX_VALUE) {
            return Integer.valueOf((int) index);
        }
        return Double.valueOf(index);
    }

    /**
     * Convert the value to a string.
     *
     * <p>See ECMA 9.8.
     */
    public static String toString(Object val) {
        for (; ; ) {
            if (val == null) {
                return "null";
            }
            if (Undefined.isUndefined(val)) {
                return "undefined";
            }
            if (val instanceof String) {
                return (String) val;
            }
            if (val instanceof CharSequence) {
                return val.toString();
            }
            if (val instanceof Integer) {
                return val.toString();
            }
            if (val instanceof Number) {
                return numberToString(((Number) val).doubleValue());
            }
            if (val instanceof Boolean) {
                return val.toString();
            }
            if (val instanceof SymbolKey) {
                throw typeErrorById("msg.not.a.string");
            }
            if (val instanceof ScriptableObject) {
                val = toPrimitive(val, STRING_HINT);
                continue;
            }
            return val.toString();
        }
    }

    /**
     * Converts a value to a string for messages. Unlike {@link #toString(Object)} this never
     * calls into script code and never throws.
     */
    public static String toDisplayString(Object val) {
        if (val instanceof SymbolKey) {
            return val.toString();
        }
        if (val instanceof ScriptableObject) {
            return "[object " + ((ScriptableObject) val).getClassName() + ']';
        }
        return toString(val);
    }

    /** Number::toString for radix 10, see ECMA 9.8.1. */
    public static String numberToString(double d) {
        return DoubleFormatter.toString(d);
    }

    static final String STRING_HINT = "string";
    static final String NUMBER_HINT = "number";

    /**
     * ES5 9.1 ToPrimitive. Objects are converted through their "valueOf" and "toString" methods
     * in the order the hint asks for; wrapper objects without such methods yield their primitive.
     */
    public static Object toPrimitive(Object val, String hint) {
        if (!(val instanceof ScriptableObject)) {
            return val;
        }
        ScriptableObject obj = (ScriptableObject) val;
        String[] methods =
                STRING_HINT.equals(hint)
                        ? new String[] {"toString", "valueOf"}
                        : new String[] {"valueOf", "toString"};
        for (String name : methods) {
            Object method = obj.get(name, obj);
            if (method instanceof Callable) {
                Object result = ((Callable) method).call(Context.getContext(), obj, emptyArgs);
                if (!(result instanceof ScriptableObject)) {
                    return result;
                }
            }
        }
        if (obj instanceof NativePrimitive) {
            return ((NativePrimitive) obj).getPrimitiveValue();
        }
        throw typeErrorById("msg.default.value");
    }

    /**
     * ToPropertyKey abstract operation, ECMA 262 7.1.19. Numbers are converted to their canonical
     * string form so that, for example, the number {@code 0.000001} names the key {@code
     * "0.000001"}.
     *
     * @see <a href="https://tc39.es/ecma262/#sec-topropertykey">ToPropertyKey</a>
     */
    public static Object toPropertyKey(Object argument) {
        if (argument instanceof String || argument instanceof SymbolKey) {
            return argument;
        }
        // 1. Let key be ? ToPrimitive(argument, string).
        Object key = toPrimitive(argument, STRING_HINT);
        // 2. If key is a Symbol, return key.
        if (key instanceof SymbolKey) {
            return key;
        }
        // 3. Return ! ToString(key).
        return toString(key);
    }

    /**
     * If the key is the canonical decimal string of an array index (a uint32 below 2^32 - 1),
     * return it as long. Otherwise return -1L.
     */
    public static long indexFromKey(Object key) {
        if (!(key instanceof String)) {
            return -1L;
        }
        long index = testUint32String((String) key);
        return index == 0xFFFFFFFFL ? -1L : index;
    }

    /** If str is a decimal presentation of Uint32 value, return it as long. Othewise return -1L; */
    public static long testUint32String(String str) {
        // The length of the decimal string representation of
        //  UINT32_MAX_VALUE, 4294967296
        final int MAX_VALUE_LENGTH = 10;

        int len = str.length();
        if (1 <= len && len <= MAX_VALUE_LENGTH) {
            int c = str.charAt(0);
            c -= '0';
            if (c == 0) {
                // Note that 00,01 etc. are not valid Uint32 presentations
                return (len == 1) ? 0L : -1L;
            }
            if (1 <= c && c <= 9) {
                long v = c;
                for (int i = 1; i != len; ++i) {
                    c = str.charAt(i) - '0';
                    if (!(0 <= c && c <= 9)) {
                        return -1;
                    }
                    v = 10 * v + c;
                }
                // Check for overflow
                if ((v >>> 32) == 0) {
                    return v;
                }
            }
        }
        return -1;
    }

    /**
     * Convert the value to an object.
     *
     * <p>See ECMA 9.9.
     */
    public static ScriptableObject toObject(Context cx, Object val) {
        if (val == null) {
            throw typeErrorById("msg.null.to.object");
        }
        if (Undefined.isUndefined(val)) {
            throw typeErrorById("msg.undef.to.object");
        }
        if (val instanceof ScriptableObject) {
            return (ScriptableObject) val;
        }
        if (val instanceof CharSequence
                || val instanceof Number
                || val instanceof Boolean
                || val instanceof SymbolKey) {
            return new NativePrimitive(cx, val);
        }
        throw typeErrorById("msg.invalid.type", val.getClass().getName());
    }

    /**
     * Computes the this-binding of a function invocation, ECMA 5 10.4.3. Strict code gets the
     * value as passed; other code gets the global object for null and undefined and a wrapper
     * object for other primitives.
     */
    public static Object computeThisBinding(Context cx, Object thisArg, boolean isStrict) {
        if (isStrict) {
            return thisArg;
        }
        if (isNullOrUndefined(thisArg)) {
            return cx.getTopLevel();
        }
        if (!(thisArg instanceof ScriptableObject)) {
            return toObject(cx, thisArg);
        }
        return thisArg;
    }

    public static boolean isNullOrUndefined(Object val) {
        return val == null || Undefined.isUndefined(val);
    }

    public static boolean isObject(Object value) {
        return value instanceof ScriptableObject;
    }

    public static boolean isCallable(Object value) {
        return value instanceof Callable;
    }

    /** The typeof operator, ECMA 11.4.3. */
    public static String typeof(Object value) {
        if (value == null) {
            return "object";
        }
        if (Undefined.isUndefined(value)) {
            return "undefined";
        }
        if (value instanceof ScriptableObject) {
            return (value instanceof Callable) ? "function" : "object";
        }
        if (value instanceof CharSequence) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof SymbolKey) {
            return "symbol";
        }
        throw typeErrorById("msg.invalid.type", value.getClass().getName());
    }

    /** Implements the SameValue algorithm, ECMA 5 9.12. */
    public static boolean same(Object x, Object y) {
        if (x == y) {
            return true;
        }
        if (x instanceof Number && y instanceof Number) {
            double dx = ((Number) x).doubleValue();
            double dy = ((Number) y).doubleValue();
            // NaN is the same as NaN, +0 is not the same as -0
            return Double.compare(dx, dy) == 0;
        }
        if (x instanceof CharSequence && y instanceof CharSequence) {
            return x.toString().equals(y.toString());
        }
        if (x instanceof Boolean && y instanceof Boolean) {
            return x.equals(y);
        }
        return false;
    }

    public static EcmaError constructError(String error, String message) {
        return new EcmaError(error, message);
    }

    public static EcmaError typeError(String message) {
        return constructError("TypeError", message);
    }

    public static EcmaError typeErrorById(String messageId, Object... args) {
        String msg = getMessageById(messageId, args);
        return typeError(msg);
    }

    public static EcmaError referenceErrorById(String messageId, Object... args) {
        return constructError("ReferenceError", getMessageById(messageId, args));
    }

    public static EcmaError rangeErrorById(String messageId, Object... args) {
        return constructError("RangeError", getMessageById(messageId, args));
    }

    public static EcmaError notFunctionError(Object value, String name) {
        return typeErrorById("msg.isnt.function", name, typeof(value));
    }

    /**
     * Look up the message with the given id in the message bundle and format it with the
     * arguments.
     */
    public static String getMessageById(String messageId, Object... arguments) {
        String formatString;
        try {
            ResourceBundle rb = ResourceBundle.getBundle(MESSAGES_BUNDLE, Locale.getDefault());
            formatString = rb.getString(messageId);
        } catch (MissingResourceException mre) {
            throw new RuntimeException("no message resource found for message property " + messageId);
        }
        MessageFormat formatter = new MessageFormat(formatString, Locale.ROOT);
        return formatter.format(arguments);
    }
}
