/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declarative environment record, ECMA 2015 8.1.1.1. Bindings are created uninitialized and
 * cannot be read or assigned until {@link #initializeBinding} runs.
 */
public class DeclarativeEnvironment extends Environment {
    private static final long serialVersionUID = -2630129478260817593L;

    private static final class Binding implements Serializable {
        private static final long serialVersionUID = 4207314571958244081L;

        Object value = Undefined.instance;
        final boolean mutable;
        final boolean deletable;
        final boolean strict;
        boolean initialized;

        Binding(boolean mutable, boolean deletable, boolean strict) {
            this.mutable = mutable;
            this.deletable = deletable;
            this.strict = strict;
        }
    }

    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public DeclarativeEnvironment(Environment outer) {
        super(outer);
    }

    @Override
    public boolean hasBinding(String name) {
        return bindings.containsKey(name);
    }

    @Override
    public void createMutableBinding(String name, boolean deletable) {
        addBinding(name, new Binding(true, deletable, false));
    }

    /**
     * Creates an immutable binding.
     *
     * @param strict if true, assignments throw a TypeError even from non-strict code
     */
    public void createImmutableBinding(String name, boolean strict) {
        addBinding(name, new Binding(false, false, strict));
    }

    private void addBinding(String name, Binding binding) {
        if (bindings.containsKey(name)) {
            throw Kit.codeBug("binding " + name + " already exists");
        }
        bindings.put(name, binding);
    }

    public void initializeBinding(String name, Object value) {
        Binding b = existing(name);
        if (b.initialized) {
            throw Kit.codeBug("binding " + name + " already initialized");
        }
        b.value = value;
        b.initialized = true;
    }

    @Override
    public void setMutableBinding(String name, Object value, boolean strict) {
        Binding b = existing(name);
        if (!b.initialized) {
            throw ScriptRuntime.referenceErrorById("msg.uninitialized.binding", name);
        }
        if (b.mutable) {
            b.value = value;
        } else if (strict || b.strict) {
            throw ScriptRuntime.typeErrorById("msg.assign.to.const", name);
        }
    }

    @Override
    public Object getBindingValue(String name, boolean strict) {
        Binding b = existing(name);
        if (!b.initialized) {
            throw ScriptRuntime.referenceErrorById("msg.uninitialized.binding", name);
        }
        return b.value;
    }

    @Override
    public boolean deleteBinding(String name) {
        Binding b = bindings.get(name);
        if (b == null) {
            return true;
        }
        if (!b.deletable) {
            return false;
        }
        bindings.remove(name);
        return true;
    }

    @Override
    public Object implicitThisValue() {
        return Undefined.instance;
    }

    private Binding existing(String name) {
        Binding b = bindings.get(name);
        if (b == null) {
            throw Kit.codeBug("no binding for " + name);
        }
        return b;
    }
}
