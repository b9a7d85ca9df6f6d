/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import com.ascesis.core.compiler.CompilationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An alphabetically ordered and deduplicated set of monomials, where each
 * monomial is an {@link IdentifierList}.
 *
 * A polynomial models "any of these node groups". Multiplication expands
 * distributively, so {@code a (b + c) d} holds the monomials {@code a b d}
 * and {@code a c d}. Addition is set union.
 *
 * The {@code flat} flag is true while the polynomial is known to hold at
 * most one monomial, which makes it convertible to an {@link IdentifierList}.
 * Once a polynomial is summed, or multiplied by a non-flat factor, the flag
 * stays false.
 *
 * Redundant terms absorbed by the algebra are recorded as
 * {@link PolynomialWarning}s. Warnings are not part of equality.
 */
public final class Polynomial {

    private final TreeSet<IdentifierList> monomials;
    private boolean flat;
    private final List<PolynomialWarning> warnings;

    private Polynomial(TreeSet<IdentifierList> monomials, boolean flat, List<PolynomialWarning> warnings) {
        this.monomials = monomials;
        this.flat = flat;
        this.warnings = warnings;
    }

    /**
     * Returns a flat polynomial with no monomials.
     */
    public static Polynomial empty() {
        return new Polynomial(new TreeSet<>(), true, new ArrayList<>());
    }

    public static Polynomial of(Identifier identifier) {
        return of(IdentifierList.of(identifier));
    }

    public static Polynomial of(String name) {
        return of(Identifier.of(name));
    }

    /**
     * Returns a flat polynomial whose single monomial is {@code monomial}.
     */
    public static Polynomial of(IdentifierList monomial) {
        TreeSet<IdentifierList> monomials = new TreeSet<>();
        monomials.add(monomial);
        return new Polynomial(monomials, true, new ArrayList<>());
    }

    /**
     * Returns an independent copy, warnings included.
     */
    public Polynomial copy() {
        return new Polynomial(new TreeSet<>(monomials), flat, new ArrayList<>(warnings));
    }

    /**
     * Returns {@code this} multiplied by the product of {@code factors}.
     */
    public Polynomial withProductMultiplied(List<Polynomial> factors) {
        multiplyAssign(factors);
        return this;
    }

    /**
     * Returns {@code this} added to the product of {@code factors}.
     */
    public Polynomial withProductAdded(List<Polynomial> factors) {
        if (!factors.isEmpty()) {
            Polynomial head = factors.get(0).copy();
            head.multiplyAssign(factors.subList(1, factors.size()));
            addAssign(head);
        }
        return this;
    }

    public void multiplyAssign(Polynomial... factors) {
        multiplyAssign(List.of(factors));
    }

    /**
     * Replaces the monomials with the cross product of the current
     * monomials and each factor's monomials in turn, pairwise unioned.
     * Every identifier shared by a multiplied pair is recorded as a
     * product idempotency warning.
     */
    public void multiplyAssign(List<Polynomial> factors) {
        for (Polynomial factor : factors) {
            if (!factor.flat) {
                flat = false;
            }
            // the factor may be this polynomial itself
            List<IdentifierList> rhs = new ArrayList<>(factor.monomials);
            if (factor != this) {
                warnings.addAll(factor.warnings);
            }

            List<IdentifierList> lhs = new ArrayList<>(monomials);
            monomials.clear();

            for (IdentifierList thisMono : lhs) {
                for (IdentifierList otherMono : rhs) {
                    for (Identifier shared : thisMono.intersection(otherMono)) {
                        warnings.add(PolynomialWarning.productIdempotency(shared));
                    }
                    monomials.add(thisMono.union(otherMono));
                }
            }
        }
    }

    /**
     * Unions the monomials of {@code other} into this polynomial. Each
     * monomial already present is recorded as a sum idempotency warning.
     * The result is never flat.
     */
    public void addAssign(Polynomial other) {
        flat = false;
        if (other == this) {
            for (IdentifierList monomial : monomials) {
                warnings.add(PolynomialWarning.sumIdempotency(monomial));
            }
            return;
        }
        warnings.addAll(other.warnings);

        for (IdentifierList monomial : other.monomials) {
            if (!monomials.add(monomial)) {
                warnings.add(PolynomialWarning.sumIdempotency(monomial));
            }
        }
    }

    /**
     * Returns a flat polynomial whose only monomial is the union of all
     * monomials of this one. A flat polynomial is copied unchanged.
     * Sum structure is discarded, warnings are kept.
     */
    public Polynomial flattenedClone() {
        if (flat) {
            return copy();
        }
        IdentifierList union = IdentifierList.empty();
        for (IdentifierList monomial : monomials) {
            union = union.union(monomial);
        }
        Polynomial result = of(union);
        result.warnings.addAll(warnings);
        return result;
    }

    /**
     * Interprets this polynomial as a plain list of identifiers.
     *
     * @throws CompilationException if the polynomial is not flat
     */
    public IdentifierList toIdentifierList() {
        if (!flat || monomials.size() > 1) {
            throw new CompilationException(CompilationException.Reason.NOT_AN_IDENTIFIER_LIST,
                    "Not an identifier list: '" + this + "'");
        }
        return monomials.isEmpty() ? IdentifierList.empty() : monomials.first();
    }

    public NavigableSet<IdentifierList> getMonomials() {
        return Collections.unmodifiableNavigableSet(monomials);
    }

    public List<PolynomialWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean isFlat() {
        return flat;
    }

    public boolean isEmpty() {
        return monomials.isEmpty();
    }

    public int size() {
        return monomials.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Polynomial that = (Polynomial) o;
        return flat == that.flat && monomials.equals(that.monomials);
    }

    @Override
    public int hashCode() {
        return 31 * monomials.hashCode() + Boolean.hashCode(flat);
    }

    @Override
    public String toString() {
        if (monomials.isEmpty()) {
            return "()";
        }
        return monomials.stream().map(IdentifierList::toString).collect(Collectors.joining(" + "));
    }
}
