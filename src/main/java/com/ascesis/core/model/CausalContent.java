/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.model;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * The compiled causal assignment of a structure: for every interned
 * identifier id, the family of node sets that may cause it and the family of
 * node sets it may cause.
 *
 * A node set is a sorted, duplicate-free {@link IntList} of ids; a family is
 * the compiled form of a polynomial. Content values combine like
 * polynomials: {@link #addAssign} unions the families per identifier and
 * {@link #multiplyAssign} expands them distributively.
 */
public final class CausalContent {

    /**
     * Lexicographic order of node sets; a proper prefix sorts first.
     */
    public static final Comparator<IntList> NODE_SET_ORDER = (a, b) -> {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(a.getInt(i), b.getInt(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private final Int2ObjectSortedMap<TreeSet<IntList>> causes = new Int2ObjectAVLTreeMap<>();
    private final Int2ObjectSortedMap<TreeSet<IntList>> effects = new Int2ObjectAVLTreeMap<>();

    /**
     * Builds a node set from ids in any order.
     */
    public static IntList nodeSet(int... ids) {
        return nodeSet(IntList.of(ids));
    }

    public static IntList nodeSet(Collection<Integer> ids) {
        IntSortedSet sorted = new IntAVLTreeSet();
        for (int id : ids) {
            sorted.add(id);
        }
        return IntLists.unmodifiable(new IntArrayList(sorted));
    }

    public void addToCauses(int id, Collection<IntList> nodeSets) {
        family(causes, id).addAll(normalized(nodeSets));
    }

    public void addToEffects(int id, Collection<IntList> nodeSets) {
        family(effects, id).addAll(normalized(nodeSets));
    }

    /**
     * Unions the cause and effect families of {@code other} into this
     * content, identifier by identifier.
     */
    public void addAssign(CausalContent other) {
        unionInto(causes, other.causes);
        unionInto(effects, other.effects);
    }

    /**
     * Cross-combines this content with {@code other}. Where both sides
     * assign a family to the same identifier, the result is every pairwise
     * union of their node sets; identifiers assigned on one side only keep
     * that side's family.
     */
    public void multiplyAssign(CausalContent other) {
        multiplyInto(causes, other.causes);
        multiplyInto(effects, other.effects);
    }

    public CausalContent copy() {
        CausalContent result = new CausalContent();
        result.addAssign(this);
        return result;
    }

    public List<IntList> getCauses(int id) {
        TreeSet<IntList> family = causes.get(id);
        return family == null ? List.of() : List.copyOf(family);
    }

    public List<IntList> getEffects(int id) {
        TreeSet<IntList> family = effects.get(id);
        return family == null ? List.of() : List.copyOf(family);
    }

    public IntSortedSet getCauseIds() {
        return new IntAVLTreeSet(causes.keySet());
    }

    public IntSortedSet getEffectIds() {
        return new IntAVLTreeSet(effects.keySet());
    }

    /**
     * Ids of every identifier with a cause or effect family.
     */
    public IntSortedSet getIds() {
        IntSortedSet ids = new IntAVLTreeSet(causes.keySet());
        ids.addAll(effects.keySet());
        return ids;
    }

    public boolean isEmpty() {
        return causes.isEmpty() && effects.isEmpty();
    }

    private static TreeSet<IntList> family(Int2ObjectMap<TreeSet<IntList>> side, int id) {
        TreeSet<IntList> family = side.get(id);
        if (family == null) {
            family = new TreeSet<>(NODE_SET_ORDER);
            side.put(id, family);
        }
        return family;
    }

    private static List<IntList> normalized(Collection<IntList> nodeSets) {
        List<IntList> result = new ArrayList<>(nodeSets.size());
        for (IntList nodeSet : nodeSets) {
            result.add(nodeSet(nodeSet));
        }
        return result;
    }

    private static void unionInto(Int2ObjectSortedMap<TreeSet<IntList>> target,
                                  Int2ObjectSortedMap<TreeSet<IntList>> source) {
        for (Int2ObjectMap.Entry<TreeSet<IntList>> entry : source.int2ObjectEntrySet()) {
            family(target, entry.getIntKey()).addAll(entry.getValue());
        }
    }

    private static void multiplyInto(Int2ObjectSortedMap<TreeSet<IntList>> target,
                                     Int2ObjectSortedMap<TreeSet<IntList>> source) {
        for (Int2ObjectMap.Entry<TreeSet<IntList>> entry : source.int2ObjectEntrySet()) {
            TreeSet<IntList> existing = target.get(entry.getIntKey());
            if (existing == null) {
                family(target, entry.getIntKey()).addAll(entry.getValue());
                continue;
            }

            TreeSet<IntList> product = new TreeSet<>(NODE_SET_ORDER);
            for (IntList left : existing) {
                for (IntList right : entry.getValue()) {
                    IntList union = new IntArrayList(left);
                    union.addAll(right);
                    product.add(nodeSet(union));
                }
            }
            target.put(entry.getIntKey(), product);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CausalContent that = (CausalContent) o;
        return causes.equals(that.causes) && effects.equals(that.effects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(causes, effects);
    }

    @Override
    public String toString() {
        return "CausalContent{causes=" + causes + ", effects=" + effects + '}';
    }
}
