/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

/**
 * Factory class that creates {@link Context} instances and holds the engine configuration.
 *
 * <p>To customize the feature set, subclass and override {@link #hasFeature(Context, int)}:
 *
 * <pre>
 * class StrictVarsFactory extends ContextFactory {
 *     protected boolean hasFeature(Context cx, int featureIndex) {
 *         if (featureIndex == Context.FEATURE_STRICT_VARS) {
 *             return true;
 *         }
 *         return super.hasFeature(cx, featureIndex);
 *     }
 * }
 * </pre>
 */
public class ContextFactory {

    /** The maximum number of execution contexts on the stack, unless configured otherwise. */
    public static final int DEFAULT_MAXIMUM_STACK_DEPTH = 1000;

    private static final ContextFactory global = new ContextFactory();

    private volatile boolean sealed;
    private int maximumStackDepth = DEFAULT_MAXIMUM_STACK_DEPTH;
    private ErrorReporter errorReporter = DefaultErrorReporter.instance;

    /** Get global ContextFactory. */
    public static ContextFactory getGlobal() {
        return global;
    }

    /** Create new {@link Context} instance to be associated with the current thread. */
    protected Context makeContext() {
        return new Context(this);
    }

    /**
     * Implementation of {@link Context#hasFeature(int featureIndex)}. This can be used to
     * customize {@link Context} without introducing additional subclasses.
     */
    protected boolean hasFeature(Context cx, int featureIndex) {
        switch (featureIndex) {
            case Context.FEATURE_STRICT_VARS:
                return false;
            case Context.FEATURE_RESTRICTED_BOUND_FUNCTIONS:
                return true;
        }
        // It is a bug to call the method with unknown featureIndex
        throw new IllegalArgumentException(String.valueOf(featureIndex));
    }

    /**
     * Get a context associated with the current thread, creating one if need be. The Context
     * stores the execution state of the engine, so it is required that the context be entered
     * before execution may begin.
     *
     * @return a Context associated with the current thread
     */
    public Context enterContext() {
        return Context.enter(this);
    }

    public final int getMaximumStackDepth() {
        return maximumStackDepth;
    }

    /**
     * Sets the maximum number of nested execution contexts. Entering one more raises a
     * RangeError.
     */
    public final void setMaximumStackDepth(int max) {
        checkNotSealed();
        if (max < 1) {
            throw new IllegalArgumentException("Maximum stack depth must be positive: " + max);
        }
        this.maximumStackDepth = max;
    }

    public final ErrorReporter getErrorReporter() {
        return errorReporter;
    }

    public final void setErrorReporter(ErrorReporter reporter) {
        checkNotSealed();
        if (reporter == null) {
            throw new IllegalArgumentException();
        }
        this.errorReporter = reporter;
    }

    /** Checks if this is a sealed ContextFactory. */
    public final boolean isSealed() {
        return sealed;
    }

    /** Seal this ContextFactory so any attempt to modify it will cause an exception. */
    public final void seal() {
        checkNotSealed();
        sealed = true;
    }

    protected final void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException();
        }
    }
}
