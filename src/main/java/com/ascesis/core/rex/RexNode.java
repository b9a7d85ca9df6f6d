/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.rex;

import com.ascesis.model.FatArrowRule;
import com.ascesis.model.ThinArrowRule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.List;
import java.util.Objects;

/**
 * A node of a {@link Rex} array. The variant set is closed: arrow rules,
 * references to other structures, and the two combinators whose children
 * are indices into the same array.
 */
public sealed interface RexNode permits RexNode.Thin, RexNode.Fat, RexNode.Instance,
        RexNode.Immediate, RexNode.Tree {

    record Thin(ThinArrowRule rule) implements RexNode {
        public Thin {
            Objects.requireNonNull(rule, "Rule cannot be null");
        }
    }

    record Fat(FatArrowRule rule) implements RexNode {
        public Fat {
            Objects.requireNonNull(rule, "Rule cannot be null");
        }
    }

    /**
     * A reference to a previously defined structure, {@code name(args)}.
     */
    record Instance(String name, List<String> args) implements RexNode {
        public Instance {
            Objects.requireNonNull(name, "Instance name cannot be null");
            args = List.copyOf(args);
        }
    }

    /**
     * A reference to a definition of the same file, {@code name!(args)}.
     */
    record Immediate(String name, List<String> args) implements RexNode {
        public Immediate {
            Objects.requireNonNull(name, "Immediate name cannot be null");
            args = List.copyOf(args);
        }
    }

    /**
     * A combinator node. Children are array indices, always greater than
     * the index of the node itself.
     */
    sealed interface Tree extends RexNode permits Product, Sum {

        IntList children();

        /**
         * Returns the same kind of node with every child index shifted.
         */
        Tree shifted(int offset);

        Tree withChildren(IntList children);
    }

    record Product(IntList children) implements Tree {
        public Product {
            children = IntLists.unmodifiable(new IntArrayList(children));
        }

        @Override
        public Product shifted(int offset) {
            return new Product(shift(children, offset));
        }

        @Override
        public Product withChildren(IntList children) {
            return new Product(children);
        }
    }

    record Sum(IntList children) implements Tree {
        public Sum {
            children = IntLists.unmodifiable(new IntArrayList(children));
        }

        @Override
        public Sum shifted(int offset) {
            return new Sum(shift(children, offset));
        }

        @Override
        public Sum withChildren(IntList children) {
            return new Sum(children);
        }
    }

    private static IntList shift(IntList children, int offset) {
        IntList shifted = new IntArrayList(children.size());
        for (int i = 0; i < children.size(); i++) {
            shifted.add(children.getInt(i) + offset);
        }
        return shifted;
    }
}
