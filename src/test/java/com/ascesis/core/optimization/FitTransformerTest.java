package com.ascesis.core.optimization;

import com.ascesis.model.ArrowLink;
import com.ascesis.model.ArrowOperator;
import com.ascesis.model.FatArrowRule;
import com.ascesis.model.IdentifierList;
import com.ascesis.model.Polynomial;
import com.ascesis.model.ThinArrowRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the {@link FitTransformer}.
 */
class FitTransformerTest {

    private FitTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new FitTransformer();
    }

    // --- Helper Methods ---

    private static Polynomial p(String... names) {
        return Polynomial.of(IdentifierList.of(names));
    }

    private static Polynomial sum(Polynomial first, Polynomial... rest) {
        Polynomial result = first.copy();
        for (Polynomial addend : rest) {
            result.addAssign(addend);
        }
        return result;
    }

    private static IdentifierList ids(String... names) {
        return IdentifierList.of(names);
    }

    private static FatArrowRule chain(Polynomial head, Object... operatorsAndPolynomials) {
        List<ArrowLink> tail = new ArrayList<>();
        for (int i = 0; i < operatorsAndPolynomials.length; i += 2) {
            tail.add(ArrowLink.of((ArrowOperator) operatorsAndPolynomials[i], (Polynomial) operatorsAndPolynomials[i + 1]));
        }
        return FatArrowRule.fromParts(head, tail);
    }

    // --- Test Cases ---

    @Test
    @DisplayName("a => b gives an effect rule for a and a cause rule for b")
    void testSingleArrow() {
        List<ThinArrowRule> rules = transformer.transform(chain(p("a"), ArrowOperator.FAT_TX, p("b")));

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("a"), p("b")),
                ThinArrowRule.causeOnly(ids("b"), p("a")));
    }

    @Test
    @DisplayName("a => b => c pairs the middle node into a two-sided rule")
    void testChain() {
        List<ThinArrowRule> rules = transformer.transform(
                chain(p("a"), ArrowOperator.FAT_TX, p("b"), ArrowOperator.FAT_TX, p("c")));

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("a"), p("b")),
                ThinArrowRule.of(ids("b"), p("a"), p("c")),
                ThinArrowRule.causeOnly(ids("c"), p("b")));
    }

    @Test
    @DisplayName("a <= b => c merges the fork by key and by polynomial")
    void testFork() {
        List<ThinArrowRule> rules = transformer.transform(
                chain(p("a"), ArrowOperator.FAT_RX, p("b"), ArrowOperator.FAT_TX, p("c")));

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("b"), sum(p("a"), p("c"))),
                ThinArrowRule.causeOnly(ids("a", "c"), p("b")));
        assertThat(rules.get(0).getEffect().isFlat()).isFalse();
    }

    @Test
    @DisplayName("Forks with more than two branches merge into one rule per direction")
    void testWideFork() {
        FatArrowRule rule = FatArrowRule.of(List.of(
                new FatArrowRule.Part(p("b"), p("a")),
                new FatArrowRule.Part(p("b"), p("c")),
                new FatArrowRule.Part(p("b"), p("d"))));

        List<ThinArrowRule> rules = transformer.transform(rule);

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("b"), sum(p("a"), p("c"), p("d"))),
                ThinArrowRule.causeOnly(ids("a", "c", "d"), p("b")));
    }

    @Test
    @DisplayName("Joins with more than two branches merge symmetrically")
    void testWideJoin() {
        FatArrowRule rule = FatArrowRule.of(List.of(
                new FatArrowRule.Part(p("a"), p("z")),
                new FatArrowRule.Part(p("b"), p("z")),
                new FatArrowRule.Part(p("c"), p("z"))));

        List<ThinArrowRule> rules = transformer.transform(rule);

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("a", "b", "c"), p("z")),
                ThinArrowRule.causeOnly(ids("z"), sum(p("a"), p("b"), p("c"))));
    }

    @Test
    @DisplayName("a <=> b gives two two-sided rules")
    void testBothDirections() {
        List<ThinArrowRule> rules = transformer.transform(chain(p("a"), ArrowOperator.FAT_BOTH, p("b")));

        assertThat(rules).containsExactly(
                ThinArrowRule.of(ids("a"), p("b"), p("b")),
                ThinArrowRule.of(ids("b"), p("a"), p("a")));
    }

    @Test
    @DisplayName("Sums on either side are flattened into the rule keys")
    void testSumSidesAreFlattened() {
        List<ThinArrowRule> rules = transformer.transform(
                chain(sum(p("a"), p("b")), ArrowOperator.FAT_TX, p("c")));

        assertThat(rules).containsExactly(
                ThinArrowRule.effectOnly(ids("a", "b"), p("c")),
                ThinArrowRule.causeOnly(ids("c"), sum(p("a"), p("b"))));
    }

    static Stream<Arguments> fatRules() {
        return Stream.of(
                Arguments.of("a => b", chain(p("a"), ArrowOperator.FAT_TX, p("b"))),
                Arguments.of("a => b => c", chain(p("a"), ArrowOperator.FAT_TX, p("b"), ArrowOperator.FAT_TX, p("c"))),
                Arguments.of("a <= b => c", chain(p("a"), ArrowOperator.FAT_RX, p("b"), ArrowOperator.FAT_TX, p("c"))),
                Arguments.of("a <=> b <=> c", chain(p("a"), ArrowOperator.FAT_BOTH, p("b"), ArrowOperator.FAT_BOTH, p("c"))),
                Arguments.of("a b => c + d <= e", chain(p("a", "b"), ArrowOperator.FAT_TX, sum(p("c"), p("d")),
                        ArrowOperator.FAT_RX, p("e"))),
                Arguments.of("a => b <= a => c", chain(p("a"), ArrowOperator.FAT_TX, p("b"), ArrowOperator.FAT_RX,
                        p("a"), ArrowOperator.FAT_TX, p("c"))));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("fatRules")
    @DisplayName("Every directed part stays covered by the thin rules")
    void testCoveragePreservation(String description, FatArrowRule rule) {
        List<ThinArrowRule> rules = transformer.transform(rule);

        assertThat(rules).isNotEmpty();
        assertThat(rules.size()).isLessThanOrEqualTo(2 * rule.getParts().size());

        for (FatArrowRule.Part part : rule.getParts()) {
            IdentifierList sources = part.cause().flattenedClone().toIdentifierList();
            IdentifierList sinks = part.effect().flattenedClone().toIdentifierList();

            assertThat(rules).as("effect of %s", part).anySatisfy(thin -> {
                assertThat((Object) thin.getIdentifiers().union(sources)).isEqualTo(thin.getIdentifiers());
                assertThat(thin.getEffect().getMonomials()).containsAll(part.effect().getMonomials());
            });
            assertThat(rules).as("cause of %s", part).anySatisfy(thin -> {
                assertThat((Object) thin.getIdentifiers().union(sinks)).isEqualTo(thin.getIdentifiers());
                assertThat(thin.getCause().getMonomials()).containsAll(part.cause().getMonomials());
            });
        }
    }

    @Test
    @DisplayName("The transformation leaves the input rule untouched")
    void testInputIsNotMutated() {
        FatArrowRule rule = chain(p("a"), ArrowOperator.FAT_RX, p("b"), ArrowOperator.FAT_TX, p("c"));
        String before = rule.toString();

        transformer.transform(rule);

        assertThat(rule.toString()).isEqualTo(before);
        assertThat(rule.getParts().get(0).effect().isFlat()).isTrue();
    }
}
