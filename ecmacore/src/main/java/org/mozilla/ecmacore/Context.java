/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.ecmacore;

import java.util.ArrayDeque;

/**
 * This class represents the runtime context of an executing script.
 *
 * <p>Before executing a script, an instance of Context must be created and associated with the
 * thread that will be executing the script. The Context will be used to store information about
 * the executing of the script such as the global object and the execution context stack. Note
 * that the Context and the thread it is associated with have a 1-1 mapping.
 *
 * <pre>
 *      try (Context cx = Context.enter()) {
 *          ...
 *      }
 * </pre>
 */
public class Context implements AutoCloseable {

    /**
     * Enables warnings when a script assigns to an undeclared variable outside of strict mode.
     *
     * <p>By default {@link #hasFeature(int)} returns false.
     */
    public static final int FEATURE_STRICT_VARS = 11;

    /**
     * Gives bound functions their own "caller" and "arguments" accessors throwing a TypeError, as
     * ECMA 5 15.3.4.5 step 20 requires.
     *
     * <p>By default {@link #hasFeature(int)} returns true.
     */
    public static final int FEATURE_RESTRICTED_BOUND_FUNCTIONS = 23;

    private static final ThreadLocal<Context> currentContext = new ThreadLocal<>();

    private final ContextFactory factory;
    private int enterCount;

    private TopLevel topLevel;
    private ObjectEnvironment globalEnvironment;
    private final ArrayDeque<ExecutionContext> executionContexts = new ArrayDeque<>();

    // %ThrowTypeError% of this context, see ScriptRuntime.typeErrorThrower
    BaseFunction typeErrorThrower;

    /**
     * Creates a new context. Contexts are made by {@link ContextFactory#makeContext()}.
     *
     * @param factory the context factory that will own this context
     */
    protected Context(ContextFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory == null");
        }
        this.factory = factory;
    }

    /**
     * Get a context associated with the current thread, creating one if need be.
     *
     * <p>Calling <code>enter()</code> will return either the Context currently associated with the
     * thread, or will create a new context and associate it with the current thread. Each call to
     * <code>enter()</code> must have a matching call to {@link #close()}.
     *
     * @return a Context associated with the current thread
     * @see ContextFactory#enterContext()
     */
    public static Context enter() {
        return ContextFactory.getGlobal().enterContext();
    }

    static Context enter(ContextFactory factory) {
        Context cx = currentContext.get();
        if (cx == null) {
            cx = factory.makeContext();
            currentContext.set(cx);
        }
        ++cx.enterCount;
        return cx;
    }

    /**
     * Exit a block of code requiring a Context. The association between the current thread and its
     * Context is removed by the exit matching the outermost enter.
     */
    public static void exit() {
        Context cx = currentContext.get();
        if (cx == null) {
            throw new IllegalStateException("Calling Context.exit without previous Context.enter");
        }
        if (--cx.enterCount == 0) {
            currentContext.remove();
        }
    }

    @Override
    public void close() {
        exit();
    }

    /**
     * Get the current Context.
     *
     * @return the Context associated with the current thread, or null if no context is associated
     *     with the current thread.
     */
    public static Context getCurrentContext() {
        return currentContext.get();
    }

    /**
     * Get the current Context, failing if there is none.
     *
     * @throws RuntimeException if the current thread is not associated with a Context
     */
    public static Context getContext() {
        Context cx = getCurrentContext();
        if (cx == null) {
            throw new RuntimeException("No Context associated with current Thread");
        }
        return cx;
    }

    public final ContextFactory getFactory() {
        return factory;
    }

    /**
     * Creates the global object with the built-in prototypes and the global environment, unless
     * they already exist.
     *
     * @return the global object
     */
    public TopLevel initStandardObjects() {
        if (topLevel == null) {
            topLevel = new TopLevel();
            globalEnvironment = new ObjectEnvironment(topLevel, false, null);
        }
        return topLevel;
    }

    public TopLevel getTopLevel() {
        return initStandardObjects();
    }

    public ObjectEnvironment getGlobalEnvironment() {
        initStandardObjects();
        return globalEnvironment;
    }

    public ScriptableObject getObjectPrototype() {
        return getTopLevel().getBuiltinPrototype(TopLevel.Builtins.Object);
    }

    public ScriptableObject getFunctionPrototype() {
        return getTopLevel().getBuiltinPrototype(TopLevel.Builtins.Function);
    }

    /**
     * Pushes a new execution context.
     *
     * @throws EcmaError a RangeError if the stack already holds the maximum number of contexts
     * @see ContextFactory#setMaximumStackDepth(int)
     */
    public ExecutionContext enterExecutionContext(
            Environment lexicalEnvironment,
            Environment variableEnvironment,
            Object thisBinding,
            BaseFunction function,
            boolean strict) {
        if (executionContexts.size() >= factory.getMaximumStackDepth()) {
            throw ScriptRuntime.rangeErrorById("msg.stack.depth");
        }
        ExecutionContext ec =
                new ExecutionContext(
                        this, lexicalEnvironment, variableEnvironment, thisBinding, function,
                        strict);
        executionContexts.push(ec);
        return ec;
    }

    void leaveExecutionContext(ExecutionContext ec) {
        if (executionContexts.peek() != ec) {
            throw Kit.codeBug("execution context left out of order");
        }
        executionContexts.pop();
    }

    /** The running execution context, null when no code runs. */
    public ExecutionContext getExecutionContext() {
        return executionContexts.peek();
    }

    public int getExecutionContextDepth() {
        return executionContexts.size();
    }

    /** Whether the running code is strict. */
    public boolean isStrictMode() {
        ExecutionContext ec = executionContexts.peek();
        return ec != null && ec.isStrict();
    }

    private Environment currentLexicalEnvironment() {
        ExecutionContext ec = executionContexts.peek();
        return ec == null ? getGlobalEnvironment() : ec.getLexicalEnvironment();
    }

    /**
     * Resolves and reads an identifier from the running execution context.
     *
     * @throws EcmaError a ReferenceError if the name cannot be resolved
     */
    public Object getName(String name) {
        Environment env = Environment.resolve(currentLexicalEnvironment(), name);
        if (env == null) {
            throw ScriptRuntime.referenceErrorById("msg.is.not.defined", name);
        }
        return env.getBindingValue(name, isStrictMode());
    }

    /**
     * Resolves and assigns an identifier from the running execution context. An unresolvable
     * name is a ReferenceError in strict code and becomes a property of the global object
     * otherwise.
     */
    public void setName(String name, Object value) {
        boolean strict = isStrictMode();
        Environment env = Environment.resolve(currentLexicalEnvironment(), name);
        if (env == null) {
            if (strict) {
                throw ScriptRuntime.referenceErrorById("msg.is.not.defined", name);
            }
            if (hasFeature(FEATURE_STRICT_VARS)) {
                reportWarning(ScriptRuntime.getMessageById("msg.assn.create.strict", name));
            }
            getTopLevel().put(name, value, false);
            return;
        }
        env.setMutableBinding(name, value, strict);
    }

    /** Create a new plain object with Object.prototype as prototype. */
    public ScriptableObject newObject() {
        return new NativeObject(getObjectPrototype());
    }

    /**
     * Create an array with the given elements.
     *
     * @param elements the initial elements, at indices 0 to length - 1
     */
    public NativeArray newArray(Object... elements) {
        NativeArray array =
                new NativeArray(getTopLevel().getBuiltinPrototype(TopLevel.Builtins.Array));
        for (int i = 0; i < elements.length; i++) {
            array.defineProperty(Integer.toString(i), elements[i], ScriptableObject.EMPTY);
        }
        return array;
    }

    /** Create a function closed over the global environment. */
    public JSFunction newFunction(JSDescriptor descriptor) {
        return new JSFunction(this, descriptor, getGlobalEnvironment());
    }

    /** Function.prototype.bind, ECMA 5 15.3.4.5. */
    public BoundFunction bind(Object target, Object boundThis, Object... boundArgs) {
        if (!(target instanceof Callable)) {
            throw ScriptRuntime.notFunctionError(target, "bind target");
        }
        return new BoundFunction(this, (Callable) target, boundThis, boundArgs);
    }

    /**
     * Report a warning using the error reporter of the context factory.
     *
     * @param message the warning message to report
     * @see ErrorReporter
     */
    public void reportWarning(String message) {
        factory.getErrorReporter().warning(message);
    }

    /**
     * Controls certain aspects of script semantics. Delegates to {@link
     * ContextFactory#hasFeature(Context, int)}.
     *
     * @param featureIndex feature index to check
     * @return true if the <code>featureIndex</code> feature is turned on
     * @see #FEATURE_STRICT_VARS
     * @see #FEATURE_RESTRICTED_BOUND_FUNCTIONS
     */
    public boolean hasFeature(int featureIndex) {
        return factory.hasFeature(this, featureIndex);
    }
}
