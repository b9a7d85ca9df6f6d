/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.compiler.CompilationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed definitions file: its blocks in source order and the name of the
 * structure chosen as root.
 */
public final class CesFile {

    private final List<CesFileBlock> blocks;
    private String rootName;

    public CesFile(List<CesFileBlock> blocks) {
        this.blocks = List.copyOf(blocks);
    }

    /**
     * Chooses the root structure. Setting the same name again is allowed.
     *
     * @throws CompilationException with reason ROOT_REDEFINED if another root is already set
     */
    public void setRootName(String name) {
        Objects.requireNonNull(name, "Root name cannot be null");
        if (rootName != null && !rootName.equals(name)) {
            throw new CompilationException(CompilationException.Reason.ROOT_REDEFINED,
                    "Redefined root structure '" + name + "' (already '" + rootName + "')");
        }
        rootName = name;
    }

    public Optional<String> getRootName() {
        return Optional.ofNullable(rootName);
    }

    /**
     * The name literal stored under {@code key} in the first {@code vis}
     * block that has one.
     */
    public Optional<String> getVisName(String key) {
        for (PropertyBlock block : getPropertyBlocks()) {
            if (block.getSelector().orElse(null) == PropertyBlock.Selector.VIS) {
                Optional<String> name = block.getName(key);
                if (name.isPresent()) {
                    return name;
                }
            }
        }
        return Optional.empty();
    }

    public List<CesFileBlock> getBlocks() {
        return blocks;
    }

    public List<ImmediateDefinition> getDefinitions() {
        List<ImmediateDefinition> result = new ArrayList<>();
        for (CesFileBlock block : blocks) {
            if (block instanceof ImmediateDefinition definition) {
                result.add(definition);
            }
        }
        return result;
    }

    public List<ContextBlock> getContextBlocks() {
        List<ContextBlock> result = new ArrayList<>();
        for (CesFileBlock block : blocks) {
            if (block instanceof ContextBlock contextBlock) {
                result.add(contextBlock);
            }
        }
        return result;
    }

    public List<PropertyBlock> getPropertyBlocks() {
        List<PropertyBlock> result = new ArrayList<>();
        for (CesFileBlock block : blocks) {
            if (block instanceof PropertyBlock propertyBlock) {
                result.add(propertyBlock);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "CesFile{root=" + rootName + ", blocks=" + blocks + '}';
    }
}
