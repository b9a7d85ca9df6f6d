/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

/**
 * Exception thrown when compilation of a rule expression or a definitions
 * file fails.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the algebra and tree code. The {@link Reason} tells callers
 * whether the failure is a user mistake, a missing dependency that may be
 * resolved by compiling other definitions first, or a broken internal
 * invariant.
 */
public class CompilationException extends RuntimeException {

    public enum Reason {
        NOT_AN_IDENTIFIER_LIST(Category.STRUCTURAL),
        LITERAL_MISMATCH(Category.STRUCTURAL),
        INVALID_OPERATOR(Category.STRUCTURAL),
        INVALID_DEFINITION(Category.STRUCTURAL),
        DUPLICATE_DEFINITION(Category.STRUCTURAL),
        ROOT_UNSET(Category.STRUCTURAL),
        ROOT_MISSING(Category.STRUCTURAL),
        ROOT_REDEFINED(Category.STRUCTURAL),
        UNRESOLVED_DEPENDENCY(Category.DEPENDENCY),
        INVALID_AST(Category.INVARIANT),
        FAT_LEAK(Category.INVARIANT);

        private final Category category;

        Reason(Category category) {
            this.category = category;
        }

        public Category category() {
            return category;
        }
    }

    public enum Category {
        /** Malformed input; not correctable by retrying. */
        STRUCTURAL,
        /** A referenced structure has not been compiled yet. */
        DEPENDENCY,
        /** A bug in tree construction or normalization. */
        INVARIANT
    }

    private final Reason reason;

    public CompilationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CompilationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static CompilationException invalidAst(String message) {
        return new CompilationException(Reason.INVALID_AST, "Invalid AST: " + message);
    }

    public static CompilationException fatLeak(int index) {
        return new CompilationException(Reason.FAT_LEAK,
                "Fat arrow rule leaked through FIT transformation at node " + index);
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason.category() == Category.DEPENDENCY;
    }

    public boolean isInvariantViolation() {
        return reason.category() == Category.INVARIANT;
    }
}
