/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.rex.Rex;

import java.util.Objects;

/**
 * A named structure, {@code ces Name { rex }}.
 */
public record ImmediateDefinition(String name, Rex rex) implements CesFileBlock {

    public ImmediateDefinition {
        Objects.requireNonNull(name, "Definition name cannot be null");
        Objects.requireNonNull(rex, "Definition body cannot be null");
    }
}
