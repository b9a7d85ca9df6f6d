/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import java.util.Objects;

/**
 * A node (dot) name used as a variable of a causal structure.
 * Identifiers compare by value, lexicographically.
 */
public record Identifier(String name) implements Comparable<Identifier> {

    public Identifier {
        Objects.requireNonNull(name, "Identifier name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Identifier name cannot be blank");
        }
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }

    @Override
    public int compareTo(Identifier other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
