/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.file;

import com.ascesis.core.model.ContextHandle;
import com.ascesis.core.model.Face;
import com.ascesis.model.Identifier;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Polynomial;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Inhibiting suits of node faces, {@code inh { c <- a b }}. Entries are kept
 * sorted and free of duplicates.
 */
public final class InhibitorBlock implements ContextBlock {

    public record Inhibitor(Face face, String node, IdentifierList suit) implements Comparable<Inhibitor> {

        private static final Comparator<Inhibitor> ORDER = Comparator
                .comparing(Inhibitor::face)
                .thenComparing(Inhibitor::node)
                .thenComparing(Inhibitor::suit);

        public Inhibitor {
            Objects.requireNonNull(face, "Face cannot be null");
            Objects.requireNonNull(node, "Node cannot be null");
            Objects.requireNonNull(suit, "Suit cannot be null");
        }

        @Override
        public int compareTo(Inhibitor other) {
            return ORDER.compare(this, other);
        }
    }

    private final TreeSet<Inhibitor> inhibitors;

    private InhibitorBlock(TreeSet<Inhibitor> inhibitors) {
        this.inhibitors = inhibitors;
    }

    public static InhibitorBlock causes(Polynomial postNodes, Polynomial preSet) {
        return build(Face.RX, postNodes, preSet);
    }

    public static InhibitorBlock effects(Polynomial preNodes, Polynomial postSet) {
        return build(Face.TX, preNodes, postSet);
    }

    private static InhibitorBlock build(Face face, Polynomial nodes, Polynomial suit) {
        IdentifierList nodeList = nodes.toIdentifierList();
        IdentifierList suitList = suit.toIdentifierList();

        TreeSet<Inhibitor> inhibitors = new TreeSet<>();
        for (Identifier node : nodeList) {
            inhibitors.add(new Inhibitor(face, node.name(), suitList));
        }
        return new InhibitorBlock(inhibitors);
    }

    public InhibitorBlock withMore(List<InhibitorBlock> more) {
        TreeSet<Inhibitor> merged = new TreeSet<>(inhibitors);
        for (InhibitorBlock block : more) {
            merged.addAll(block.inhibitors);
        }
        return new InhibitorBlock(merged);
    }

    @Override
    public void compile(ContextHandle ctx) {
        ctx.useContext(context -> {
            for (Inhibitor inh : inhibitors) {
                context.setInhibitor(inh.face(), inh.node(), inh.suit().names());
            }
        });
    }

    public List<Inhibitor> getInhibitors() {
        return List.copyOf(inhibitors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return inhibitors.equals(((InhibitorBlock) o).inhibitors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inhibitors);
    }

    @Override
    public String toString() {
        return "inh " + inhibitors;
    }
}
