/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

import com.ascesis.api.CompilationResult;
import com.ascesis.api.ICesCompiler;
import com.ascesis.core.file.CesFile;
import com.ascesis.core.loader.CesFileLoader;
import com.ascesis.core.model.CausalContent;
import com.ascesis.core.model.ContextHandle;
import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads a definitions file and compiles it into a fresh context.
 *
 * The root structure is the one named by the file itself or, if the file
 * names none, the configured default.
 */
public class AscesisCompiler implements ICesCompiler {

    private final CompilerConfig config;
    private final CesFileLoader loader;
    private final CesFileCompiler fileCompiler;

    public AscesisCompiler(Tracer tracer, CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.loader = new CesFileLoader();
        this.fileCompiler = new CesFileCompiler(tracer, config);
    }

    @Override
    public CompilationResult compile(Path path) throws IOException {
        CesFile file = loader.load(path);
        return compile(file, contextName(path));
    }

    public CompilationResult compile(CesFile file, String contextName) {
        if (file.getRootName().isEmpty()) {
            file.setRootName(config.getRootName());
        }
        ContextHandle ctx = ContextHandle.create(contextName);
        CausalContent root = fileCompiler.compile(file, ctx);
        return new CompilationResult(file.getRootName().orElseThrow(), root, ctx);
    }

    private static String contextName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
