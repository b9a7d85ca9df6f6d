/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

import com.ascesis.core.file.CesFile;
import com.ascesis.core.file.ContextBlock;
import com.ascesis.core.file.ImmediateDefinition;
import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.ContextHandle;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Compiles a whole definitions file into a {@link ContextHandle}.
 *
 * The compilation proceeds in these steps:
 * 1. Checking that a root is chosen, that it is defined, and that no
 *    structure is defined twice.
 * 2. Declaring capacities, weights and inhibitors of the context blocks.
 * 3. Compiling the structure definitions. A definition that refers to a
 *    structure not compiled yet is postponed to the next pass, so
 *    definitions may appear in any order.
 */
public class CesFileCompiler {
    private static final Logger logger = Logger.getLogger(CesFileCompiler.class.getName());

    private final Tracer tracer;
    private final CompilerConfig config;
    private final RexCompiler rexCompiler;

    public CesFileCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.defaults());
    }

    public CesFileCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.rexCompiler = new RexCompiler(tracer, config);
    }

    /**
     * Compiles every block of {@code file}, registers the content of every
     * definition under its name, and returns the content of the root.
     *
     * @throws CompilationException with reason ROOT_UNSET, ROOT_MISSING,
     *         DUPLICATE_DEFINITION or UNRESOLVED_DEPENDENCY, or any error of
     *         the individual definitions
     */
    public CausalContent compile(CesFile file, ContextHandle ctx) {
        Span span = tracer.spanBuilder("compile-ces-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            String rootName = file.getRootName().orElseThrow(() -> new CompilationException(
                    CompilationException.Reason.ROOT_UNSET, "Undeclared root structure"));
            List<ImmediateDefinition> definitions = file.getDefinitions();
            checkDefinitions(rootName, definitions);

            span.setAttribute("rootName", rootName);
            span.setAttribute("definitionCount", definitions.size());

            Optional<String> title = file.getVisName("title");
            if (title.isPresent()) {
                logger.info("Using '" + rootName + "' as the root structure: \"" + title.get() + "\"");
            } else {
                logger.info("Using '" + rootName + "' as the root structure");
            }

            List<ContextBlock> contextBlocks = file.getContextBlocks();
            for (ContextBlock block : contextBlocks) {
                block.compile(ctx);
            }
            span.setAttribute("contextBlockCount", contextBlocks.size());

            resolveDefinitions(definitions, ctx);

            CausalContent root = ctx.withContext(context -> context.getContent(rootName))
                    .orElseThrow(() -> new CompilationException(CompilationException.Reason.ROOT_MISSING,
                            "Missing root structure '" + rootName + "'"));

            long compilationTime = System.nanoTime() - startTime;
            span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(compilationTime));
            logger.info(String.format("Compiled %d structures in %d ms",
                    definitions.size(), TimeUnit.NANOSECONDS.toMillis(compilationTime)));
            return root;
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static void checkDefinitions(String rootName, List<ImmediateDefinition> definitions) {
        Set<String> names = new HashSet<>();
        for (ImmediateDefinition definition : definitions) {
            if (!names.add(definition.name())) {
                throw new CompilationException(CompilationException.Reason.DUPLICATE_DEFINITION,
                        "Structure '" + definition.name() + "' is defined more than once");
            }
        }
        if (!names.contains(rootName)) {
            throw new CompilationException(CompilationException.Reason.ROOT_MISSING,
                    "Missing root structure '" + rootName + "'");
        }
    }

    /**
     * Compiles definitions pass by pass until all are compiled. A pass that
     * compiles nothing means the remaining definitions depend on undefined
     * or mutually dependent structures.
     */
    private void resolveDefinitions(List<ImmediateDefinition> definitions, ContextHandle ctx) {
        Span span = tracer.spanBuilder("resolve-definitions").startSpan();
        try (Scope scope = span.makeCurrent()) {
            int maxPasses = config.resolutionPassesFor(definitions.size());
            List<ImmediateDefinition> pending = new ArrayList<>(definitions);
            Map<String, UnresolvedDependencyException> postponed = new LinkedHashMap<>();
            int passes = 0;

            while (!pending.isEmpty()) {
                if (passes == maxPasses) {
                    throw unresolved(postponed, "after " + passes + " passes");
                }
                passes++;
                postponed.clear();
                List<ImmediateDefinition> next = new ArrayList<>();

                for (ImmediateDefinition definition : pending) {
                    try {
                        CausalContent content = rexCompiler.compileNormalized(definition.rex(), ctx);
                        ctx.useContext(context -> context.addContent(definition.name(), content));
                        logger.fine("Compiled structure '" + definition.name() + "'");
                    } catch (UnresolvedDependencyException e) {
                        postponed.put(definition.name(), e);
                        next.add(definition);
                    }
                }

                if (next.size() == pending.size()) {
                    throw unresolved(postponed, "no progress in pass " + passes);
                }
                pending = next;
            }

            span.setAttribute("passCount", passes);
            logger.fine(String.format("Resolved %d definitions in %d passes", definitions.size(), passes));
        } catch (CompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private static CompilationException unresolved(Map<String, UnresolvedDependencyException> postponed,
                                                   String detail) {
        String summary = postponed.entrySet().stream()
                .map(entry -> "'" + entry.getKey() + "' needs '" + entry.getValue().getDependencyName() + "'")
                .collect(Collectors.joining(", "));
        logger.warning("Unresolved definitions: " + summary);

        return new CompilationException(CompilationException.Reason.UNRESOLVED_DEPENDENCY,
                "Unresolved definitions (" + detail + "): " + summary,
                postponed.values().stream().findFirst().orElse(null));
    }
}
