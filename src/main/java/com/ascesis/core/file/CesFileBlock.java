/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

/**
 * A top-level block of a definitions file.
 */
public sealed interface CesFileBlock permits ImmediateDefinition, ContextBlock, PropertyBlock {
}
