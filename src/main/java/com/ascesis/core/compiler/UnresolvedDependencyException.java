/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

/**
 * Thrown when an instance or immediate reference names a structure whose
 * content has not been compiled yet. Callers compiling several definitions
 * retry after compiling the dependency.
 */
public class UnresolvedDependencyException extends CompilationException {

    private final String dependencyName;

    public UnresolvedDependencyException(String dependencyName) {
        super(Reason.UNRESOLVED_DEPENDENCY, "Unresolved dependency '" + dependencyName + "'");
        this.dependencyName = dependencyName;
    }

    public String getDependencyName() {
        return dependencyName;
    }
}
