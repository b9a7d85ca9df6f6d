/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import com.ascesis.core.compiler.CompilationException;

import java.util.Objects;

/**
 * A literal value of a definitions file: either a size or a quoted name.
 */
public sealed interface Literal permits Literal.Size, Literal.Name {

    record Size(long value) implements Literal {
        public Size {
            if (value < 0) {
                throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                        "Size literal cannot be negative: " + value);
            }
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Name(String value) implements Literal {
        public Name {
            Objects.requireNonNull(value, "Name literal cannot be null");
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    static Literal size(long value) {
        return new Size(value);
    }

    static Literal name(String value) {
        return new Name(value);
    }

    /**
     * Parses a size literal written as decimal digits.
     */
    static Literal fromDigits(String digits) {
        try {
            return new Size(Long.parseLong(digits.trim()));
        } catch (NumberFormatException e) {
            throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                    "Not a size literal: '" + digits + "'", e);
        }
    }

    /**
     * Parses a name literal enclosed in single or double quotes. Backslash
     * escapes {@code \\}, {@code \"}, {@code \'}, {@code \n} and {@code \t}
     * are resolved.
     */
    static Literal fromQuotedString(String quoted) {
        String text = quoted.trim();
        if (text.length() < 2) {
            throw notQuoted(quoted);
        }
        char quote = text.charAt(0);
        if ((quote != '"' && quote != '\'') || text.charAt(text.length() - 1) != quote) {
            throw notQuoted(quoted);
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 1; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (++i >= text.length() - 1) {
                throw notQuoted(quoted);
            }
            char escaped = text.charAt(i);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case '\\', '"', '\'' -> sb.append(escaped);
                default -> throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                        "Unknown escape '\\" + escaped + "' in " + quoted);
            }
        }
        return new Name(sb.toString());
    }

    private static CompilationException notQuoted(String quoted) {
        return new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                "Not a quoted name literal: " + quoted);
    }

    /**
     * @throws CompilationException if this is not a size literal
     */
    default long asSize() {
        if (this instanceof Size size) {
            return size.value();
        }
        throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                "Expected a size literal, got " + this);
    }

    /**
     * @throws CompilationException if this is not a name literal
     */
    default String asName() {
        if (this instanceof Name name) {
            return name.value();
        }
        throw new CompilationException(CompilationException.Reason.LITERAL_MISMATCH,
                "Expected a name literal, got " + this);
    }
}
