/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.model.ContextHandle;
import com.ascesis.core.model.Face;
import com.ascesis.model.Identifier;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Literal;
import com.ascesis.model.Polynomial;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Weights of node faces restricted to a suit of neighbours, for example
 * {@code mul { 2 c <- a b }} declaring that {@code c} needs two tokens from
 * the suit {@code a b}.
 *
 * Entries are kept sorted and free of duplicates.
 */
public final class MultiplicityBlock implements ContextBlock {
    private static final Logger logger = Logger.getLogger(MultiplicityBlock.class.getName());

    /**
     * The weight of one face of one node towards a suit.
     */
    public record Multiplicity(Face face, String node, IdentifierList suit, long size)
            implements Comparable<Multiplicity> {

        private static final Comparator<Multiplicity> ORDER = Comparator
                .comparing(Multiplicity::face)
                .thenComparing(Multiplicity::node)
                .thenComparing(Multiplicity::suit)
                .thenComparingLong(Multiplicity::size);

        public Multiplicity {
            Objects.requireNonNull(face, "Face cannot be null");
            Objects.requireNonNull(node, "Node cannot be null");
            Objects.requireNonNull(suit, "Suit cannot be null");
        }

        @Override
        public int compareTo(Multiplicity other) {
            return ORDER.compare(this, other);
        }
    }

    private final TreeSet<Multiplicity> multiplicities;

    private MultiplicityBlock(TreeSet<Multiplicity> multiplicities) {
        this.multiplicities = multiplicities;
    }

    /**
     * Cause-side weights: each node of {@code postNodes} needs {@code size}
     * tokens from {@code preSet}.
     */
    public static MultiplicityBlock causes(Literal size, Polynomial postNodes, Polynomial preSet) {
        return build(Face.RX, size, postNodes, preSet);
    }

    /**
     * Effect-side weights: each node of {@code preNodes} sends {@code size}
     * tokens to {@code postSet}.
     */
    public static MultiplicityBlock effects(Literal size, Polynomial preNodes, Polynomial postSet) {
        return build(Face.TX, size, preNodes, postSet);
    }

    private static MultiplicityBlock build(Face face, Literal size, Polynomial nodes, Polynomial suit) {
        long weight = size.asSize();
        IdentifierList nodeList = nodes.toIdentifierList();
        IdentifierList suitList = suit.toIdentifierList();

        TreeSet<Multiplicity> multiplicities = new TreeSet<>();
        for (Identifier node : nodeList) {
            multiplicities.add(new Multiplicity(face, node.name(), suitList, weight));
        }
        return new MultiplicityBlock(multiplicities);
    }

    public MultiplicityBlock withMore(List<MultiplicityBlock> more) {
        TreeSet<Multiplicity> merged = new TreeSet<>(multiplicities);
        for (MultiplicityBlock block : more) {
            merged.addAll(block.multiplicities);
        }
        return new MultiplicityBlock(merged);
    }

    @Override
    public void compile(ContextHandle ctx) {
        ctx.useContext(context -> {
            for (Multiplicity mul : multiplicities) {
                if (mul.size() > 0) {
                    context.setWeight(mul.face(), mul.node(), mul.suit().names(), mul.size());
                } else {
                    logger.warning("Ignoring zero weight of " + mul.face() + " face of node '" + mul.node() + "'");
                }
            }
        });
    }

    public List<Multiplicity> getMultiplicities() {
        return List.copyOf(multiplicities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return multiplicities.equals(((MultiplicityBlock) o).multiplicities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(multiplicities);
    }

    @Override
    public String toString() {
        return "mul " + multiplicities;
    }
}
