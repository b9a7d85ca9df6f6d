/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.model.ContextHandle;

/**
 * A block that declares node properties directly in the compilation context,
 * independent of any structure definition.
 */
public sealed interface ContextBlock extends CesFileBlock
        permits CapacityBlock, MultiplicityBlock, InhibitorBlock {

    void compile(ContextHandle ctx);
}
