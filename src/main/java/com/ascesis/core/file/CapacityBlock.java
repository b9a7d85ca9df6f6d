/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.model.ContextHandle;
import com.ascesis.model.Identifier;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Literal;
import com.ascesis.model.Polynomial;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Node capacities, {@code cap { 3 a b  1 c }}.
 */
public final class CapacityBlock implements ContextBlock {
    private static final Logger logger = Logger.getLogger(CapacityBlock.class.getName());

    private final TreeMap<String, Long> capacities;

    private CapacityBlock(TreeMap<String, Long> capacities) {
        this.capacities = capacities;
    }

    /**
     * Assigns capacity {@code size} to every node of {@code nodes}.
     *
     * @throws com.ascesis.core.compiler.CompilationException if {@code size}
     *         is not a size literal or {@code nodes} is not a plain node list
     */
    public static CapacityBlock of(Literal size, Polynomial nodes) {
        long capacity = size.asSize();
        IdentifierList nodeList = nodes.toIdentifierList();

        TreeMap<String, Long> capacities = new TreeMap<>();
        for (Identifier node : nodeList) {
            capacities.put(node.name(), capacity);
        }
        return new CapacityBlock(capacities);
    }

    /**
     * Merges later blocks into this one; a node declared again takes the
     * later capacity.
     */
    public CapacityBlock withMore(List<CapacityBlock> more) {
        TreeMap<String, Long> merged = new TreeMap<>(capacities);
        for (CapacityBlock block : more) {
            merged.putAll(block.capacities);
        }
        return new CapacityBlock(merged);
    }

    @Override
    public void compile(ContextHandle ctx) {
        ctx.useContext(context -> {
            for (Map.Entry<String, Long> entry : capacities.entrySet()) {
                if (entry.getValue() > 0) {
                    context.setCapacity(entry.getKey(), entry.getValue());
                } else {
                    logger.warning("Ignoring zero capacity of node '" + entry.getKey() + "'");
                }
            }
        });
    }

    public Map<String, Long> getCapacities() {
        return Collections.unmodifiableMap(capacities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return capacities.equals(((CapacityBlock) o).capacities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacities);
    }

    @Override
    public String toString() {
        return "cap " + capacities;
    }
}
