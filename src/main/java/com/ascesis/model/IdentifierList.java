/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An alphabetically ordered and deduplicated list of {@link Identifier}s.
 *
 * Instances are immutable. The same type doubles as the monomial of a
 * {@link Polynomial}: a set of identifiers required together.
 *
 * Lists compare element by element; a proper prefix sorts first.
 */
public final class IdentifierList implements Comparable<IdentifierList>, Iterable<Identifier> {

    private static final IdentifierList EMPTY = new IdentifierList(List.of());

    private final List<Identifier> identifiers;

    private IdentifierList(List<Identifier> sortedUnique) {
        this.identifiers = sortedUnique;
    }

    public static IdentifierList empty() {
        return EMPTY;
    }

    public static IdentifierList of(Identifier identifier) {
        return new IdentifierList(List.of(identifier));
    }

    public static IdentifierList of(String... names) {
        return of(Arrays.stream(names).map(Identifier::of).collect(Collectors.toList()));
    }

    public static IdentifierList of(Collection<Identifier> identifiers) {
        if (identifiers.isEmpty()) {
            return EMPTY;
        }
        return new IdentifierList(List.copyOf(new TreeSet<>(identifiers)));
    }

    /**
     * Returns the sorted, deduplicated union of this list and {@code other}.
     */
    public IdentifierList union(IdentifierList other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        TreeSet<Identifier> merged = new TreeSet<>(identifiers);
        merged.addAll(other.identifiers);
        return new IdentifierList(List.copyOf(merged));
    }

    /**
     * Returns the identifiers present in both lists, in order.
     */
    public List<Identifier> intersection(IdentifierList other) {
        List<Identifier> shared = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < identifiers.size() && j < other.identifiers.size()) {
            int cmp = identifiers.get(i).compareTo(other.identifiers.get(j));
            if (cmp == 0) {
                shared.add(identifiers.get(i));
                i++;
                j++;
            } else if (cmp < 0) {
                i++;
            } else {
                j++;
            }
        }
        return shared;
    }

    public boolean contains(Identifier identifier) {
        return Collections.binarySearch(identifiers, identifier) >= 0;
    }

    public boolean isEmpty() {
        return identifiers.isEmpty();
    }

    public int size() {
        return identifiers.size();
    }

    public Identifier get(int index) {
        return identifiers.get(index);
    }

    public List<Identifier> asList() {
        return identifiers;
    }

    public List<String> names() {
        return identifiers.stream().map(Identifier::name).collect(Collectors.toList());
    }

    @Override
    public Iterator<Identifier> iterator() {
        return identifiers.iterator();
    }

    @Override
    public int compareTo(IdentifierList other) {
        int common = Math.min(identifiers.size(), other.identifiers.size());
        for (int i = 0; i < common; i++) {
            int cmp = identifiers.get(i).compareTo(other.identifiers.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(identifiers.size(), other.identifiers.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return identifiers.equals(((IdentifierList) o).identifiers);
    }

    @Override
    public int hashCode() {
        return identifiers.hashCode();
    }

    @Override
    public String toString() {
        return identifiers.stream().map(Identifier::name).collect(Collectors.joining(" "));
    }
}
