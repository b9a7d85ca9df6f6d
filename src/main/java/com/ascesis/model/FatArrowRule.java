/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import com.ascesis.core.compiler.CompilationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A bidirectional chain rule such as {@code a => b <= c}, stored as the
 * ordered list of directed cause/effect pairs of its adjacent links.
 *
 * A chain of more than two polynomials is split into pairs here, when the
 * rule is built, so that the FIT transformation only ever sees pairs.
 */
public final class FatArrowRule {

    /**
     * One directed link of a fat arrow chain.
     */
    public record Part(Polynomial cause, Polynomial effect) {

        public Part {
            Objects.requireNonNull(cause, "Cause cannot be null");
            Objects.requireNonNull(effect, "Effect cannot be null");
        }

        @Override
        public String toString() {
            return "(" + cause + ") => (" + effect + ")";
        }
    }

    private final List<Part> parts;

    private FatArrowRule(List<Part> parts) {
        this.parts = List.copyOf(parts);
    }

    public static FatArrowRule of(List<Part> parts) {
        if (parts.isEmpty()) {
            throw new CompilationException(CompilationException.Reason.INVALID_DEFINITION,
                    "Fat arrow rule without parts");
        }
        List<Part> copies = new ArrayList<>(parts.size());
        for (Part part : parts) {
            copies.add(new Part(part.cause().copy(), part.effect().copy()));
        }
        return new FatArrowRule(copies);
    }

    /**
     * Builds a rule from a parsed chain {@code head op1 p1 op2 p2 ...}.
     * {@code =>} makes the left polynomial the cause, {@code <=} makes the
     * right polynomial the cause and {@code <=>} yields both orderings.
     *
     * @throws CompilationException if the tail is empty or holds a
     *                              non-fat operator
     */
    public static FatArrowRule fromParts(Polynomial head, List<ArrowLink> tail) {
        if (tail.isEmpty()) {
            throw new CompilationException(CompilationException.Reason.INVALID_DEFINITION,
                    "Single-polynomial fat arrow rule: '" + head + "'");
        }

        List<Part> parts = new ArrayList<>();
        Polynomial prev = head;

        for (ArrowLink link : tail) {
            Polynomial poly = link.polynomial();
            switch (link.operator()) {
                case FAT_TX -> parts.add(new Part(prev.copy(), poly.copy()));
                case FAT_RX -> parts.add(new Part(poly.copy(), prev.copy()));
                case FAT_BOTH -> {
                    parts.add(new Part(prev.copy(), poly.copy()));
                    parts.add(new Part(poly.copy(), prev.copy()));
                }
                default -> throw new CompilationException(CompilationException.Reason.INVALID_OPERATOR,
                        "Operator not allowed in a fat arrow rule: '" + link.operator() + "'");
            }
            prev = poly;
        }
        return new FatArrowRule(parts);
    }

    /**
     * Returns the directed parts. Callers must copy a part's polynomials
     * before mutating them.
     */
    public List<Part> getParts() {
        return parts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return parts.equals(((FatArrowRule) o).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return parts.stream().map(Part::toString).collect(Collectors.joining(" + "));
    }
}
