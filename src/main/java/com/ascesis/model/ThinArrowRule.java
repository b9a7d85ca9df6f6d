/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import com.ascesis.core.compiler.CompilationException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A one-directional (or cause-and-effect) rule over a single identifier list:
 * every identifier in the list is caused by any monomial of {@code cause}
 * and causes any monomial of {@code effect}. Either polynomial may be empty.
 *
 * Instances are immutable; accessors return copies of the polynomials.
 */
public final class ThinArrowRule {

    private final IdentifierList identifiers;
    private final Polynomial cause;
    private final Polynomial effect;

    private ThinArrowRule(IdentifierList identifiers, Polynomial cause, Polynomial effect) {
        this.identifiers = Objects.requireNonNull(identifiers, "Identifiers cannot be null");
        this.cause = Objects.requireNonNull(cause, "Cause cannot be null").copy();
        this.effect = Objects.requireNonNull(effect, "Effect cannot be null").copy();
    }

    public static ThinArrowRule of(IdentifierList identifiers, Polynomial cause, Polynomial effect) {
        return new ThinArrowRule(identifiers, cause, effect);
    }

    public static ThinArrowRule effectOnly(IdentifierList identifiers, Polynomial effect) {
        return new ThinArrowRule(identifiers, Polynomial.empty(), effect);
    }

    public static ThinArrowRule causeOnly(IdentifierList identifiers, Polynomial cause) {
        return new ThinArrowRule(identifiers, cause, Polynomial.empty());
    }

    /**
     * Builds a rule from a parsed chain. Accepted shapes:
     * <ul>
     *   <li>{@code nodes -> effect}</li>
     *   <li>{@code nodes <- cause}</li>
     *   <li>{@code cause -> nodes -> effect}</li>
     *   <li>{@code effect <- nodes <- cause}</li>
     * </ul>
     *
     * @throws CompilationException if the chain has another shape, or the
     *                              node side is not a plain identifier list
     */
    public static ThinArrowRule fromParts(Polynomial head, List<ArrowLink> tail) {
        if (tail.size() == 1) {
            ArrowLink link = tail.get(0);
            IdentifierList nodes = head.toIdentifierList();
            return switch (link.operator()) {
                case THIN_TX -> effectOnly(nodes, link.polynomial());
                case THIN_RX -> causeOnly(nodes, link.polynomial());
                default -> throw invalidOperator(link.operator());
            };
        }
        if (tail.size() == 2) {
            ArrowLink first = tail.get(0);
            ArrowLink second = tail.get(1);
            if (first.operator() != second.operator()) {
                throw new CompilationException(CompilationException.Reason.INVALID_OPERATOR,
                        "Mixed directions in a thin arrow rule: '" + first.operator()
                                + "' followed by '" + second.operator() + "'");
            }
            IdentifierList nodes = first.polynomial().toIdentifierList();
            return switch (first.operator()) {
                case THIN_TX -> of(nodes, head, second.polynomial());
                case THIN_RX -> of(nodes, second.polynomial(), head);
                default -> throw invalidOperator(first.operator());
            };
        }
        throw new CompilationException(CompilationException.Reason.INVALID_DEFINITION,
                "Thin arrow rule must have two or three polynomials, got " + (tail.size() + 1));
    }

    private static CompilationException invalidOperator(ArrowOperator operator) {
        return new CompilationException(CompilationException.Reason.INVALID_OPERATOR,
                "Operator not allowed in a thin arrow rule: '" + operator + "'");
    }

    public IdentifierList getIdentifiers() {
        return identifiers;
    }

    public Polynomial getCause() {
        return cause.copy();
    }

    public Polynomial getEffect() {
        return effect.copy();
    }

    public boolean hasCause() {
        return !cause.isEmpty();
    }

    public boolean hasEffect() {
        return !effect.isEmpty();
    }

    /**
     * Warnings accumulated by both polynomials of this rule.
     */
    public List<PolynomialWarning> getWarnings() {
        if (cause.getWarnings().isEmpty()) {
            return effect.getWarnings();
        }
        if (effect.getWarnings().isEmpty()) {
            return cause.getWarnings();
        }
        return Stream.concat(cause.getWarnings().stream(), effect.getWarnings().stream()).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThinArrowRule that = (ThinArrowRule) o;
        return identifiers.equals(that.identifiers) && cause.equals(that.cause) && effect.equals(that.effect);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifiers, cause, effect);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!cause.isEmpty()) {
            sb.append(cause).append(" -> ");
        }
        sb.append(identifiers);
        if (!effect.isEmpty()) {
            sb.append(" -> ").append(effect);
        }
        return sb.toString();
    }
}
