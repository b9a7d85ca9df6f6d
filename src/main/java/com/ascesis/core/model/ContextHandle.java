/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.model;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Guarded access to a {@link CompilationContext}.
 *
 * Every access is a scoped acquisition: the lock is held for the duration of
 * the given action only. Actions must not call back into the compiler while
 * holding the context.
 */
public final class ContextHandle {

    private final CompilationContext context;
    private final ReentrantLock lock = new ReentrantLock();

    public ContextHandle(CompilationContext context) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }

    public static ContextHandle create(String name) {
        return new ContextHandle(new CompilationContext(name));
    }

    public <T> T withContext(Function<CompilationContext, T> action) {
        lock.lock();
        try {
            return action.apply(context);
        } finally {
            lock.unlock();
        }
    }

    public void useContext(Consumer<CompilationContext> action) {
        lock.lock();
        try {
            action.accept(context);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return context.getName();
    }
}
