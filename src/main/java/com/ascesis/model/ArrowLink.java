/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import java.util.Objects;

/**
 * One link of an arrow chain: the operator and the polynomial following it.
 */
public record ArrowLink(ArrowOperator operator, Polynomial polynomial) {

    public ArrowLink {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(polynomial, "Polynomial cannot be null");
    }

    public static ArrowLink of(ArrowOperator operator, Polynomial polynomial) {
        return new ArrowLink(operator, polynomial);
    }
}
