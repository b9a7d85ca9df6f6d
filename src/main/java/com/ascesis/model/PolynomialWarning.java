/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import java.util.Objects;

/**
 * A diagnostic recorded when polynomial arithmetic absorbs a redundant term.
 * Warnings never block compilation.
 *
 * @param kind    which operation produced the warning
 * @param subject the shared monomial for sums, a one-element list holding
 *                the overlapping identifier for products
 */
public record PolynomialWarning(Kind kind, IdentifierList subject) {

    public enum Kind {
        /** Both addends already contained the same monomial. */
        SUM_IDEMPOTENCY,
        /** Two multiplied monomials shared an identifier. */
        PRODUCT_IDEMPOTENCY
    }

    public PolynomialWarning {
        Objects.requireNonNull(kind, "Warning kind cannot be null");
        Objects.requireNonNull(subject, "Warning subject cannot be null");
    }

    public static PolynomialWarning sumIdempotency(IdentifierList monomial) {
        return new PolynomialWarning(Kind.SUM_IDEMPOTENCY, monomial);
    }

    public static PolynomialWarning productIdempotency(Identifier identifier) {
        return new PolynomialWarning(Kind.PRODUCT_IDEMPOTENCY, IdentifierList.of(identifier));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUM_IDEMPOTENCY -> "Idempotent sum of '" + subject + "'";
            case PRODUCT_IDEMPOTENCY -> "Idempotent product of '" + subject + "'";
        };
    }
}
