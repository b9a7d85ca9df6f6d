package com.ascesis.api;

import java.nio.file.Path;

/**
 * Contract for compiling a definitions file into causal content.
 */
public interface ICesCompiler {

    /**
     * Compiles a definitions file.
     *
     * @param path path to the JSON syntax tree of the file
     * @return the root structure's content together with its context
     * @throws Exception if compilation fails (e.g., IO or an invalid definition)
     */
    CompilationResult compile(Path path) throws Exception;
}
