/*
 * Copyright (c) 2025 Ascesis Rex Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.ascesis.core.compiler;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Configuration of the compiler.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be set through an environment variable or, when the
 * variable is absent, a system property of the same name:
 * <pre>
 * ASCESIS_ROOT_NAME=Main
 * ASCESIS_LOG_POLYNOMIAL_WARNINGS=true
 * ASCESIS_MAX_RESOLUTION_PASSES=0
 * ASCESIS_PRETTY_OUTPUT=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * CompilerConfig config = CompilerConfig.builder()
 *     .rootName("Main")
 *     .maxResolutionPasses(10)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    static final String ENV_ROOT_NAME = "ASCESIS_ROOT_NAME";
    static final String ENV_LOG_POLYNOMIAL_WARNINGS = "ASCESIS_LOG_POLYNOMIAL_WARNINGS";
    static final String ENV_MAX_RESOLUTION_PASSES = "ASCESIS_MAX_RESOLUTION_PASSES";
    static final String ENV_PRETTY_OUTPUT = "ASCESIS_PRETTY_OUTPUT";

    public static final String DEFAULT_ROOT_NAME = "Main";

    private final String rootName;
    private final boolean logPolynomialWarnings;
    private final int maxResolutionPasses;
    private final boolean prettyOutput;

    private CompilerConfig(Builder builder) {
        this.rootName = builder.rootName;
        this.logPolynomialWarnings = builder.logPolynomialWarnings;
        this.maxResolutionPasses = builder.maxResolutionPasses;
        this.prettyOutput = builder.prettyOutput;
        validate();
    }

    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from defaults overridden by environment
     * variables and system properties.
     */
    public static CompilerConfig fromEnvironment() {
        Builder builder = builder();
        getEnv(ENV_ROOT_NAME).ifPresent(builder::rootName);
        getEnvBoolean(ENV_LOG_POLYNOMIAL_WARNINGS).ifPresent(builder::logPolynomialWarnings);
        getEnvInt(ENV_MAX_RESOLUTION_PASSES).ifPresent(builder::maxResolutionPasses);
        getEnvBoolean(ENV_PRETTY_OUTPUT).ifPresent(builder::prettyOutput);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Name of the structure compiled as the root of a definitions file. */
    public String getRootName() {
        return rootName;
    }

    public boolean isLogPolynomialWarnings() {
        return logPolynomialWarnings;
    }

    /**
     * Upper bound on dependency resolution passes; 0 means one pass per
     * definition plus one, which always suffices for an acyclic file.
     */
    public int getMaxResolutionPasses() {
        return maxResolutionPasses;
    }

    public int resolutionPassesFor(int definitionCount) {
        return maxResolutionPasses > 0 ? maxResolutionPasses : definitionCount + 1;
    }

    public boolean isPrettyOutput() {
        return prettyOutput;
    }

    private void validate() {
        if (rootName == null || rootName.isBlank()) {
            throw new IllegalArgumentException("rootName must not be blank");
        }
        if (maxResolutionPasses < 0) {
            throw new IllegalArgumentException("maxResolutionPasses must not be negative: " + maxResolutionPasses);
        }
    }

    @Override
    public String toString() {
        return "CompilerConfig{rootName=" + rootName
                + ", logPolynomialWarnings=" + logPolynomialWarnings
                + ", maxResolutionPasses=" + maxResolutionPasses
                + ", prettyOutput=" + prettyOutput + '}';
    }

    public static final class Builder {
        private String rootName = DEFAULT_ROOT_NAME;
        private boolean logPolynomialWarnings = true;
        private int maxResolutionPasses = 0;
        private boolean prettyOutput = true;

        private Builder() {
        }

        public Builder rootName(String rootName) {
            this.rootName = rootName;
            return this;
        }

        public Builder logPolynomialWarnings(boolean logPolynomialWarnings) {
            this.logPolynomialWarnings = logPolynomialWarnings;
            return this;
        }

        public Builder maxResolutionPasses(int maxResolutionPasses) {
            this.maxResolutionPasses = maxResolutionPasses;
            return this;
        }

        public Builder prettyOutput(boolean prettyOutput) {
            this.prettyOutput = prettyOutput;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }

    // ========================================================================
    // ENVIRONMENT VARIABLE HELPERS
    // ========================================================================

    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.trim().isEmpty()) {
            value = System.getProperty(key);
        }
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded setting: " + key + "=" + value);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static Optional<Integer> getEnvInt(String key) {
        return getEnv(key).flatMap(val -> {
            try {
                return Optional.of(Integer.parseInt(val));
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + key + ": " + val);
                return Optional.empty();
            }
        });
    }

    private static Optional<Boolean> getEnvBoolean(String key) {
        return getEnv(key).map(val -> {
            String normalized = val.toLowerCase();
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        });
    }
}
