/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.CompilationContext;
import com.ascesis.core.model.ContextHandle;
import com.ascesis.core.optimization.FitTransformer;
import com.ascesis.core.rex.Rex;
import com.ascesis.core.rex.RexNode;
import com.ascesis.model.Identifier;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Polynomial;
import com.ascesis.model.PolynomialWarning;
import com.ascesis.model.ThinArrowRule;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Folds a {@link Rex} into the {@link CausalContent} it denotes.
 *
 * The fold is a single pass from the last node to the root. Because every
 * child index is greater than its parent's, all children of a node are
 * already compiled when the node is reached.
 */
public class RexCompiler {
    private static final Logger logger = Logger.getLogger(RexCompiler.class.getName());

    private final Tracer tracer;
    private final CompilerConfig config;
    private final FitTransformer fitTransformer;

    public RexCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.defaults());
    }

    public RexCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.fitTransformer = new FitTransformer();
    }

    /**
     * Applies the FIT transformation to every fat arrow rule and compiles
     * the result.
     *
     * @param rex The rule expression, possibly containing fat arrow rules.
     * @param ctx The context holding interned identifiers and the content of
     *            previously compiled structures.
     * @return The causal content of the expression.
     * @throws UnresolvedDependencyException if a referenced structure is not compiled yet
     * @throws CompilationException on a broken expression tree
     */
    public CausalContent compileNormalized(Rex rex, ContextHandle ctx) {
        return compile(normalize(rex), ctx);
    }

    /**
     * Returns a copy of {@code rex} without fat arrow rules.
     */
    public Rex normalize(Rex rex) {
        if (!rex.containsFat()) {
            return rex;
        }
        Span span = tracer.spanBuilder("fit-normalize").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("nodeCount", rex.size());
            Rex thin = rex.fitClone(fitTransformer);
            span.setAttribute("normalizedNodeCount", thin.size());
            return thin;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Compiles an expression that contains no fat arrow rules.
     *
     * @throws CompilationException with reason FAT_LEAK if a fat arrow rule is found
     */
    public CausalContent compile(Rex rex, ContextHandle ctx) {
        Span span = tracer.spanBuilder("compile-rex").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("context", ctx.getName());
            span.setAttribute("nodeCount", rex.size());

            CausalContent content = fold(rex, ctx);

            span.setAttribute("identifierCount", content.getIds().size());
            return content;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    CausalContent fold(Rex rex, ContextHandle ctx) {
        int size = rex.size();
        if (size == 0) {
            throw CompilationException.invalidAst("empty rule expression");
        }

        CausalContent[] compiled = new CausalContent[size];
        List<PolynomialWarning> warnings = new ArrayList<>();

        for (int i = size - 1; i >= 0; i--) {
            RexNode node = rex.get(i);

            if (node instanceof RexNode.Thin thin) {
                ThinArrowRule rule = thin.rule();
                warnings.addAll(rule.getWarnings());
                compiled[i] = ctx.withContext(context -> compileThin(rule, context));
            } else if (node instanceof RexNode.Instance instance) {
                compiled[i] = lookup(instance.name(), ctx);
            } else if (node instanceof RexNode.Immediate immediate) {
                compiled[i] = lookup(immediate.name(), ctx);
            } else if (node instanceof RexNode.Product product) {
                compiled[i] = combine(i, product.children(), compiled, true);
            } else if (node instanceof RexNode.Sum sum) {
                compiled[i] = combine(i, sum.children(), compiled, false);
            } else if (node instanceof RexNode.Fat) {
                throw CompilationException.fatLeak(i);
            } else {
                throw CompilationException.invalidAst("unknown node kind at " + i + ": " + node);
            }
        }

        if (config.isLogPolynomialWarnings()) {
            for (PolynomialWarning warning : warnings) {
                logger.warning("In '" + ctx.getName() + "': " + warning);
            }
        }
        logger.fine(String.format("Folded %d nodes in '%s' (%d warnings)", size, ctx.getName(), warnings.size()));

        return compiled[0];
    }

    private static CausalContent compileThin(ThinArrowRule rule, CompilationContext context) {
        CausalContent content = new CausalContent();
        List<IntList> causes = rule.hasCause() ? nodeSets(rule.getCause(), context) : List.of();
        List<IntList> effects = rule.hasEffect() ? nodeSets(rule.getEffect(), context) : List.of();

        for (Identifier identifier : rule.getIdentifiers()) {
            int id = context.intern(identifier.name());
            if (!causes.isEmpty()) {
                content.addToCauses(id, causes);
            }
            if (!effects.isEmpty()) {
                content.addToEffects(id, effects);
            }
        }
        return content;
    }

    private static List<IntList> nodeSets(Polynomial polynomial, CompilationContext context) {
        List<IntList> result = new ArrayList<>(polynomial.size());
        for (IdentifierList monomial : polynomial.getMonomials()) {
            IntList ids = new IntArrayList(monomial.size());
            for (Identifier identifier : monomial) {
                ids.add(context.intern(identifier.name()));
            }
            result.add(CausalContent.nodeSet(ids));
        }
        return result;
    }

    /**
     * Identifiers interned by nodes folded before a failed lookup stay
     * interned; interning is idempotent, so a retried fold finds the same ids.
     */
    private static CausalContent lookup(String name, ContextHandle ctx) {
        return ctx.withContext(context -> context.getContent(name))
                .orElseThrow(() -> new UnresolvedDependencyException(name));
    }

    private static CausalContent combine(int index, IntList children, CausalContent[] compiled, boolean product) {
        if (children.isEmpty()) {
            throw CompilationException.invalidAst("node " + index + " has no children");
        }

        CausalContent result = null;
        for (int child : children) {
            if (child <= index || child >= compiled.length) {
                throw CompilationException.invalidAst(
                        "node " + index + " refers to child " + child + " of " + compiled.length);
            }
            CausalContent value = compiled[child];
            if (result == null) {
                result = value.copy();
            } else if (product) {
                result.multiplyAssign(value);
            } else {
                result.addAssign(value);
            }
        }
        return result;
    }
}
