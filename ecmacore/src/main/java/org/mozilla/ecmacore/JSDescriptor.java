/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The immutable description of a function or script: its name, parameter names, strictness,
 * body, nested function declarations and var names. Many {@link JSFunction} objects may share
 * one descriptor.
 */
public final class JSDescriptor implements Serializable {
    private static final long serialVersionUID = -1439216843176530846L;

    private final String name;
    private final String[] paramNames;
    private final boolean strict;
    private final transient JSCode code;
    private final List<JSDescriptor> functionDeclarations;
    private final List<String> varNames;

    private JSDescriptor(Builder builder) {
        this.name = builder.name;
        this.paramNames = builder.paramNames.toArray(new String[0]);
        this.strict = builder.strict;
        this.code = builder.code;
        this.functionDeclarations =
                Collections.unmodifiableList(new ArrayList<>(builder.functionDeclarations));
        this.varNames = Collections.unmodifiableList(new ArrayList<>(builder.varNames));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public int getParamCount() {
        return paramNames.length;
    }

    public String getParamName(int index) {
        return paramNames[index];
    }

    public boolean hasParam(String param) {
        for (String p : paramNames) {
            if (p.equals(param)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasDuplicateParams() {
        Set<String> seen = new HashSet<>();
        for (String p : paramNames) {
            if (!seen.add(p)) {
                return true;
            }
        }
        return false;
    }

    public boolean isStrict() {
        return strict;
    }

    public JSCode getCode() {
        return code;
    }

    public List<JSDescriptor> getFunctionDeclarations() {
        return functionDeclarations;
    }

    public List<String> getVarNames() {
        return varNames;
    }

    public static final class Builder {
        private String name = "";
        private final List<String> paramNames = new ArrayList<>();
        private boolean strict;
        private JSCode code = (cx, frame) -> Completion.normal();
        private final List<JSDescriptor> functionDeclarations = new ArrayList<>();
        private final List<String> varNames = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder params(String... names) {
            Collections.addAll(paramNames, names);
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder code(JSCode code) {
            this.code = code;
            return this;
        }

        /** Adds a nested function declaration; it must have a name. */
        public Builder functionDeclaration(JSDescriptor function) {
            if (function.getName().isEmpty()) {
                throw new IllegalArgumentException("function declarations must be named");
            }
            functionDeclarations.add(function);
            return this;
        }

        public Builder vars(String... names) {
            Collections.addAll(varNames, names);
            return this;
        }

        public JSDescriptor build() {
            return new JSDescriptor(this);
        }
    }
}
