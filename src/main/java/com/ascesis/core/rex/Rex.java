/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.rex;

import com.ascesis.core.compiler.CompilationException;
import com.ascesis.core.optimization.FitTransformer;
import com.ascesis.model.ArrowOperator;
import com.ascesis.model.FatArrowRule;
import com.ascesis.model.ThinArrowRule;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A rule expression stored as a flat array of {@link RexNode}s.
 *
 * Index 0 is the root. {@link RexNode.Product} and {@link RexNode.Sum} nodes
 * refer to their children by index, and every child index is greater than
 * the index of its parent, so the array can be folded from the last node
 * to the first without recursion and cannot contain cycles.
 *
 * Larger expressions are built by appending whole sub-arrays with their
 * indices shifted by the current array length.
 */
public final class Rex {

    /**
     * One member of a chain {@code head op1 rex1 op2 rex2 ...}. A null
     * operator means juxtaposition, i.e. a product.
     */
    public record Link(ArrowOperator operator, Rex rex) {

        public Link {
            Objects.requireNonNull(rex, "Rex cannot be null");
        }

        public static Link product(Rex rex) {
            return new Link(null, rex);
        }

        public static Link sum(Rex rex) {
            return new Link(ArrowOperator.ADD, rex);
        }

        boolean isProduct() {
            return operator == null;
        }
    }

    private final List<RexNode> nodes;

    private Rex(List<RexNode> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public static Rex of(ThinArrowRule rule) {
        return new Rex(List.of(new RexNode.Thin(rule)));
    }

    public static Rex of(FatArrowRule rule) {
        return new Rex(List.of(new RexNode.Fat(rule)));
    }

    public static Rex instance(String name, List<String> args) {
        return new Rex(List.of(new RexNode.Instance(name, args)));
    }

    public static Rex immediate(String name, List<String> args) {
        return new Rex(List.of(new RexNode.Immediate(name, args)));
    }

    /**
     * Wraps an explicit node array after checking its index invariants.
     *
     * @throws CompilationException with reason INVALID_AST on a broken array
     */
    public static Rex ofNodes(List<RexNode> nodes) {
        Rex rex = new Rex(nodes);
        rex.validate();
        return rex;
    }

    /**
     * Returns this expression combined with {@code links}. A chain without
     * any {@code +} becomes one product; otherwise the result is a sum of
     * addends, each addend being either a single member or a product of
     * consecutive juxtaposed members.
     *
     * @throws CompilationException if a link carries an operator other than {@code +}
     */
    public Rex withMore(List<Link> links) {
        if (links.isEmpty()) {
            return this;
        }
        for (Link link : links) {
            if (!link.isProduct() && link.operator() != ArrowOperator.ADD) {
                throw new CompilationException(CompilationException.Reason.INVALID_OPERATOR,
                        "Operator not allowed between rule expressions: '" + link.operator() + "'");
            }
        }

        boolean plusless = links.stream().allMatch(Link::isProduct);
        List<RexNode> kinds = new ArrayList<>();

        if (plusless) {
            kinds.add(new RexNode.Product(IntList.of()));
            IntList ids = new IntArrayList();

            ids.add(kinds.size());
            appendWithOffset(kinds, nodes);
            for (Link link : links) {
                ids.add(kinds.size());
                appendWithOffset(kinds, link.rex().nodes);
            }

            kinds.set(0, new RexNode.Product(ids));
            return new Rex(kinds);
        }

        kinds.add(new RexNode.Sum(IntList.of()));
        IntList sumIds = new IntArrayList();
        IntList productIds = new IntArrayList();
        int anchor = 1; // index of the current addend

        if (links.get(0).isProduct()) {
            kinds.add(new RexNode.Product(IntList.of()));
            productIds.add(kinds.size());
        }
        appendWithOffset(kinds, nodes);

        for (int i = 0; i < links.size(); i++) {
            Link link = links.get(i);
            boolean followedByProduct = i + 1 < links.size() && links.get(i + 1).isProduct();

            if (link.isProduct()) {
                productIds.add(kinds.size());
                appendWithOffset(kinds, link.rex().nodes);
                continue;
            }

            if (!productIds.isEmpty()) {
                kinds.set(anchor, new RexNode.Product(productIds));
                productIds = new IntArrayList();
            }
            sumIds.add(anchor);
            anchor = kinds.size();

            if (followedByProduct) {
                kinds.add(new RexNode.Product(IntList.of()));
                productIds.add(kinds.size());
            }
            appendWithOffset(kinds, link.rex().nodes);
        }

        if (!productIds.isEmpty()) {
            kinds.set(anchor, new RexNode.Product(productIds));
        }
        sumIds.add(anchor);
        kinds.set(0, new RexNode.Sum(sumIds));

        return new Rex(kinds);
    }

    private static void appendWithOffset(List<RexNode> target, List<RexNode> source) {
        int offset = target.size();
        for (RexNode node : source) {
            target.add(node instanceof RexNode.Tree tree ? tree.shifted(offset) : node);
        }
    }

    /**
     * Returns a copy with every fat arrow rule replaced by a sum of the thin
     * arrow rules produced by the FIT transformation.
     */
    public Rex fitClone() {
        return fitClone(new FitTransformer());
    }

    public Rex fitClone(FitTransformer transformer) {
        if (!containsFat()) {
            return this;
        }

        int[] idMap = new int[nodes.size()];
        List<RexNode> newNodes = new ArrayList<>();

        for (int i = 0; i < nodes.size(); i++) {
            idMap[i] = newNodes.size();
            RexNode node = nodes.get(i);

            if (node instanceof RexNode.Fat fat) {
                List<ThinArrowRule> tars = transformer.transform(fat.rule());
                IntList ids = new IntArrayList(tars.size());
                for (int k = 0; k < tars.size(); k++) {
                    ids.add(newNodes.size() + 1 + k);
                }
                newNodes.add(new RexNode.Sum(ids));
                for (ThinArrowRule tar : tars) {
                    newNodes.add(new RexNode.Thin(tar));
                }
            } else {
                newNodes.add(node);
            }
        }

        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) instanceof RexNode.Tree tree) {
                IntList remapped = new IntArrayList(tree.children().size());
                for (int child : tree.children()) {
                    if (child <= i || child >= nodes.size()) {
                        throw CompilationException.invalidAst(
                                "node " + i + " refers to child " + child + " of " + nodes.size());
                    }
                    remapped.add(idMap[child]);
                }
                newNodes.set(idMap[i], tree.withChildren(remapped));
            }
        }

        return new Rex(newNodes);
    }

    /**
     * Checks that every combinator has at least one child and that all
     * child indices point forward and stay inside the array.
     *
     * @throws CompilationException with reason INVALID_AST on the first violation
     */
    public void validate() {
        if (nodes.isEmpty()) {
            throw CompilationException.invalidAst("empty rule expression");
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) instanceof RexNode.Tree tree) {
                if (tree.children().isEmpty()) {
                    throw CompilationException.invalidAst("node " + i + " has no children");
                }
                for (int child : tree.children()) {
                    if (child <= i) {
                        throw CompilationException.invalidAst(
                                "node " + i + " refers backward to child " + child);
                    }
                    if (child >= nodes.size()) {
                        throw CompilationException.invalidAst(
                                "node " + i + " refers to child " + child + " out of range " + nodes.size());
                    }
                }
            }
        }
    }

    public boolean containsFat() {
        return nodes.stream().anyMatch(node -> node instanceof RexNode.Fat);
    }

    public List<RexNode> getNodes() {
        return nodes;
    }

    public RexNode get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((Rex) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Rex[");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(i).append(": ").append(nodes.get(i));
        }
        return sb.append(']').toString();
    }
}
