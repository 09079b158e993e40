/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * This class implements the "arguments" object.
 *
 * <p>See ECMA 5 10.6. For non-strict functions with distinct parameter names, the indices below
 * the parameter count are mapped: reading them reads the parameter binding in the activation and
 * writing them writes it. A mapping ends when its index is deleted, redefined as an accessor or
 * made read-only. It outlives the call.
 *
 * @see NativeCall
 */
final class Arguments extends NativeObject {
    private static final long serialVersionUID = 4275508002492040609L;

    private static final String CLASS_NAME = "Arguments";

    private final NativeCall activation;

    // Parameter name per mapped index, null where the index is not (or no longer) mapped.
    private final String[] mappedNames;

    Arguments(NativeCall activation, Context cx) {
        super(cx.getObjectPrototype());
        this.activation = activation;

        Object[] args = activation.originalArgs;
        mappedNames = new String[args.length];
        for (int i = 0; i < args.length; i++) {
            defineProperty(Integer.toString(i), args[i], EMPTY);
        }
        defineProperty("length", Integer.valueOf(args.length), DONTENUM);
        defineProperty(
                SymbolKey.ITERATOR,
                cx.getTopLevel().getBuiltinPrototype(TopLevel.Builtins.Array).get("values"),
                DONTENUM);

        JSDescriptor desc = activation.function.getDescriptor();
        if (activation.isStrict) {
            // ECMA 5 10.6 step 14: callee and caller are poisoned in strict mode
            BaseFunction thrower = ScriptRuntime.typeErrorThrower(cx);
            defineAccessor("caller", thrower, thrower, DONTENUM | PERMANENT);
            defineAccessor("callee", thrower, thrower, DONTENUM | PERMANENT);
        } else {
            defineProperty("callee", activation.function, DONTENUM);
            if (!desc.hasDuplicateParams()) {
                int mapped = Math.min(args.length, desc.getParamCount());
                for (int i = 0; i < mapped; i++) {
                    mappedNames[i] = desc.getParamName(i);
                }
            }
        }
    }

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    private int mappedIndex(Object key) {
        long index = ScriptRuntime.indexFromKey(key);
        if (index < 0 || index >= mappedNames.length || mappedNames[(int) index] == null) {
            return -1;
        }
        return (int) index;
    }

    @Override
    public PropertyDescriptor getOwnProperty(Object id) {
        Object key = toKey(id);
        PropertyDescriptor desc = super.getOwnProperty(key);
        int index = mappedIndex(key);
        if (desc == null || index < 0) {
            return desc;
        }
        return desc.withValue(activation.getBindingValue(mappedNames[index], false));
    }

    @Override
    public boolean defineOwnProperty(Object id, PropertyDescriptor desc, boolean throwOnFailure) {
        Object key = toKey(id);
        int index = mappedIndex(key);
        if (!super.defineOwnProperty(key, desc, throwOnFailure)) {
            return false;
        }
        if (index >= 0) {
            if (desc.isAccessorDescriptor()) {
                mappedNames[index] = null;
            } else {
                if (desc.hasValue()) {
                    activation.setMutableBinding(mappedNames[index], desc.getValue(), false);
                }
                if (desc.hasWritable() && !desc.isWritable()) {
                    mappedNames[index] = null;
                }
            }
        }
        return true;
    }

    @Override
    public boolean delete(Object id, boolean throwOnFailure) {
        Object key = toKey(id);
        int index = mappedIndex(key);
        boolean result = super.delete(key, throwOnFailure);
        if (result && index >= 0) {
            mappedNames[index] = null;
        }
        return result;
    }
}
