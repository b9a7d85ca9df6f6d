package com.ascesis.core.compiler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(CompilerConfig.ENV_ROOT_NAME);
        System.clearProperty(CompilerConfig.ENV_MAX_RESOLUTION_PASSES);
        System.clearProperty(CompilerConfig.ENV_PRETTY_OUTPUT);
    }

    @Test
    @DisplayName("Defaults should allow one pass more than the definitions")
    void testDefaults() {
        CompilerConfig config = CompilerConfig.defaults();

        assertThat(config.getRootName()).isEqualTo(CompilerConfig.DEFAULT_ROOT_NAME);
        assertThat(config.isLogPolynomialWarnings()).isTrue();
        assertThat(config.isPrettyOutput()).isTrue();
        assertThat(config.getMaxResolutionPasses()).isZero();
        assertThat(config.resolutionPassesFor(4)).isEqualTo(5);
    }

    @Test
    @DisplayName("An explicit pass limit overrides the derived one")
    void testBuilder() {
        CompilerConfig config = CompilerConfig.builder()
                .rootName("Top")
                .maxResolutionPasses(2)
                .prettyOutput(false)
                .logPolynomialWarnings(false)
                .build();

        assertThat(config.getRootName()).isEqualTo("Top");
        assertThat(config.resolutionPassesFor(10)).isEqualTo(2);
        assertThat(config.isPrettyOutput()).isFalse();
        assertThat(config.isLogPolynomialWarnings()).isFalse();
    }

    @Test
    void testInvalidValues() {
        assertThatThrownBy(() -> CompilerConfig.builder().rootName(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerConfig.builder().maxResolutionPasses(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("System properties should be read when the environment is silent")
    void testSystemPropertyOverrides() {
        System.setProperty(CompilerConfig.ENV_ROOT_NAME, "Net");
        System.setProperty(CompilerConfig.ENV_MAX_RESOLUTION_PASSES, "7");
        System.setProperty(CompilerConfig.ENV_PRETTY_OUTPUT, "false");

        CompilerConfig config = CompilerConfig.fromEnvironment();

        assertThat(config.getRootName()).isEqualTo("Net");
        assertThat(config.getMaxResolutionPasses()).isEqualTo(7);
        assertThat(config.isPrettyOutput()).isFalse();
    }
}
