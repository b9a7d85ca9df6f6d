/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2LongLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2LongMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * The shared state of one compilation: interned identifiers, the compiled
 * content of every named structure, and the node properties declared by
 * capacity, multiplicity and inhibitor blocks.
 *
 * Not thread-safe. Access goes through a {@link ContextHandle}.
 */
public class CompilationContext {

    /**
     * A weight or inhibitor target: one face of one node, restricted to a suit
     * of neighbouring nodes.
     */
    public record SuitKey(Face face, int nodeId, IntList suit) {
        public SuitKey {
            suit = CausalContent.nodeSet(suit);
        }
    }

    private final String name;
    private final IdentifierDictionary dictionary = new IdentifierDictionary();
    private final Map<String, CausalContent> contents = new LinkedHashMap<>();
    private final Object2LongMap<String> capacities = new Object2LongLinkedOpenHashMap<>();
    private final Map<SuitKey, Long> weights = new LinkedHashMap<>();
    private final Set<SuitKey> inhibitors = new LinkedHashSet<>();

    public CompilationContext(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    // ==================== Identifiers ====================

    /**
     * Registers an identifier; repeated calls return the same id.
     */
    public int intern(String identifier) {
        return dictionary.intern(identifier);
    }

    public String nameOf(int id) {
        return dictionary.nameOf(id);
    }

    public IdentifierDictionary getDictionary() {
        return dictionary;
    }

    // ==================== Named content ====================

    /**
     * @return a copy of the content compiled for {@code structureName}, if any
     */
    public Optional<CausalContent> getContent(String structureName) {
        CausalContent content = contents.get(structureName);
        return content == null ? Optional.empty() : Optional.of(content.copy());
    }

    public boolean hasContent(String structureName) {
        return contents.containsKey(structureName);
    }

    public void addContent(String structureName, CausalContent content) {
        contents.put(structureName, content.copy());
    }

    public Set<String> getContentNames() {
        return Collections.unmodifiableSet(contents.keySet());
    }

    // ==================== Node properties ====================

    public void setCapacity(String nodeName, long capacity) {
        intern(nodeName);
        capacities.put(nodeName, capacity);
    }

    public OptionalLong getCapacity(String nodeName) {
        return capacities.containsKey(nodeName)
                ? OptionalLong.of(capacities.getLong(nodeName))
                : OptionalLong.empty();
    }

    public Map<String, Long> getCapacities() {
        return Collections.unmodifiableMap(capacities);
    }

    public void setWeight(Face face, String nodeName, Iterable<String> suitNames, long weight) {
        weights.put(suitKey(face, nodeName, suitNames), weight);
    }

    public OptionalLong getWeight(Face face, String nodeName, Iterable<String> suitNames) {
        SuitKey key = existingSuitKey(face, nodeName, suitNames);
        Long weight = key == null ? null : weights.get(key);
        return weight == null ? OptionalLong.empty() : OptionalLong.of(weight);
    }

    public Map<SuitKey, Long> getWeights() {
        return Collections.unmodifiableMap(weights);
    }

    public void setInhibitor(Face face, String nodeName, Iterable<String> suitNames) {
        inhibitors.add(suitKey(face, nodeName, suitNames));
    }

    public boolean isInhibited(Face face, String nodeName, Iterable<String> suitNames) {
        SuitKey key = existingSuitKey(face, nodeName, suitNames);
        return key != null && inhibitors.contains(key);
    }

    public Set<SuitKey> getInhibitors() {
        return Collections.unmodifiableSet(inhibitors);
    }

    private SuitKey suitKey(Face face, String nodeName, Iterable<String> suitNames) {
        IntList suit = new IntArrayList();
        for (String suitName : suitNames) {
            suit.add(intern(suitName));
        }
        return new SuitKey(face, intern(nodeName), suit);
    }

    private SuitKey existingSuitKey(Face face, String nodeName, Iterable<String> suitNames) {
        int nodeId = dictionary.idOf(nodeName);
        if (nodeId < 0) {
            return null;
        }
        IntList suit = new IntArrayList();
        for (String suitName : suitNames) {
            int id = dictionary.idOf(suitName);
            if (id < 0) {
                return null;
            }
            suit.add(id);
        }
        return new SuitKey(face, nodeId, suit);
    }
}
