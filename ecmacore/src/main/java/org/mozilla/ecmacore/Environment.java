/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;

/**
 * An environment record, ECMA 5 10.2.1. Environments form a chain through their outer reference
 * that ends at the global environment.
 *
 * @see DeclarativeEnvironment
 * @see ObjectEnvironment
 */
public abstract class Environment implements Serializable {
    private static final long serialVersionUID = 6118471830127694235L;

    private final Environment outer;

    protected Environment(Environment outer) {
        this.outer = outer;
    }

    /** The enclosing environment, null for the global environment. */
    public Environment getOuter() {
        return outer;
    }

    public abstract boolean hasBinding(String name);

    public abstract void createMutableBinding(String name, boolean deletable);

    /**
     * Assigns a binding that exists in this environment.
     *
     * @param strict true for strict mode code, where refused assignments throw
     */
    public abstract void setMutableBinding(String name, Object value, boolean strict);

    public abstract Object getBindingValue(String name, boolean strict);

    /** Returns false if the binding exists and cannot be deleted. */
    public abstract boolean deleteBinding(String name);

    /** The this value for calls of functions found through this environment. */
    public abstract Object implicitThisValue();

    /**
     * Walks the chain starting at {@code env} and returns the first environment that has a
     * binding for {@code name}, or null.
     */
    public static Environment resolve(Environment env, String name) {
        for (Environment e = env; e != null; e = e.outer) {
            if (e.hasBinding(name)) {
                return e;
            }
        }
        return null;
    }
}
