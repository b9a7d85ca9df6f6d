package com.ascesis.model;

import com.ascesis.core.compiler.CompilationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolynomialTest {

    // --- Helper Methods ---

    private static Polynomial p(String name) {
        return Polynomial.of(name);
    }

    private static Polynomial sum(Polynomial first, Polynomial... rest) {
        Polynomial result = first.copy();
        for (Polynomial addend : rest) {
            result.addAssign(addend);
        }
        return result;
    }

    private static Polynomial product(Polynomial first, Polynomial... rest) {
        return first.copy().withProductMultiplied(List.of(rest));
    }

    private static IdentifierList mono(String... names) {
        return IdentifierList.of(names);
    }

    // --- Test Cases ---

    @Test
    @DisplayName("Single identifier is a flat single monomial")
    void testSingleIdentifier() {
        Polynomial a = p("a");

        assertThat(a.isFlat()).isTrue();
        assertThat(a.getMonomials()).containsExactly(mono("a"));
        assertThat((Object) a.toIdentifierList()).isEqualTo(mono("a"));
    }

    @Test
    @DisplayName("Empty polynomial is flat and collapses to the empty list")
    void testEmpty() {
        Polynomial empty = Polynomial.empty();

        assertThat(empty.isFlat()).isTrue();
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.toIdentifierList().isEmpty()).isTrue();
        assertThat(empty).hasToString("()");
    }

    @Test
    @DisplayName("Product of flat factors stays flat and unions identifiers")
    void testFlatProduct() {
        Polynomial abc = product(p("c"), p("a"), p("b"));

        assertThat(abc.isFlat()).isTrue();
        assertThat(abc.getMonomials()).containsExactly(mono("a", "b", "c"));
        assertThat(abc.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Sum is never flat, even of a single monomial with itself")
    void testSumClearsFlatness() {
        Polynomial ab = sum(p("a"), p("b"));

        assertThat(ab.isFlat()).isFalse();
        assertThat(ab.getMonomials()).containsExactly(mono("a"), mono("b"));
        assertThatThrownBy(ab::toIdentifierList)
                .isInstanceOf(CompilationException.class)
                .extracting(e -> ((CompilationException) e).getReason())
                .isEqualTo(CompilationException.Reason.NOT_AN_IDENTIFIER_LIST);
    }

    @Test
    @DisplayName("Multiplication distributes over addition")
    void testDistributivity() {
        Polynomial pp = sum(p("a"), p("b"));
        Polynomial q = p("c");
        Polynomial r = product(p("d"), p("e"));

        Polynomial left = product(pp, sum(q, r));
        Polynomial right = sum(product(pp, q), product(pp, r));

        assertThat(left).isEqualTo(right);
        assertThat(left.getMonomials()).containsExactly(
                mono("a", "c"), mono("a", "d", "e"), mono("b", "c"), mono("b", "d", "e"));
    }

    @Test
    @DisplayName("Flattening is idempotent and keeps warnings")
    void testFlattenIdempotence() {
        Polynomial poly = sum(product(p("a"), p("b")), p("c"), p("a"));

        Polynomial once = poly.flattenedClone();
        Polynomial twice = once.flattenedClone();

        assertThat(once.isFlat()).isTrue();
        assertThat(once.getMonomials()).containsExactly(mono("a", "b", "c"));
        assertThat(twice).isEqualTo(once);
        assertThat(once.getWarnings()).isEqualTo(poly.getWarnings());
    }

    @Test
    @DisplayName("(a (b + c) d e) + f g expands to three monomials")
    void testNestedExpansion() {
        Polynomial bc = p("b").withProductAdded(List.of(p("c")));
        Polynomial poly = p("a")
                .withProductMultiplied(List.of(bc, p("d"), p("e")))
                .withProductAdded(List.of(p("f"), p("g")));

        assertThat(poly.getMonomials()).containsExactly(
                mono("a", "b", "d", "e"), mono("a", "c", "d", "e"), mono("f", "g"));
        assertThat(poly.isFlat()).isFalse();
        assertThat(poly.getWarnings()).isEmpty();
        assertThat(poly).hasToString("a b d e + a c d e + f g");
    }

    @Test
    @DisplayName("Adding a monomial to itself records a sum idempotency warning")
    void testSumIdempotency() {
        Polynomial aa = sum(p("a"), p("a"));

        assertThat(aa.getMonomials()).containsExactly(mono("a"));
        assertThat(aa.isFlat()).isFalse();
        assertThat(aa.getWarnings()).containsExactly(PolynomialWarning.sumIdempotency(mono("a")));
    }

    @Test
    @DisplayName("Multiplying overlapping monomials records one warning per shared identifier")
    void testProductIdempotency() {
        Polynomial left = product(p("a"), p("b"), p("c"));
        Polynomial right = product(p("b"), p("c"), p("d"));

        left.multiplyAssign(right);

        assertThat(left.getMonomials()).containsExactly(mono("a", "b", "c", "d"));
        assertThat(left.getWarnings()).containsExactly(
                PolynomialWarning.productIdempotency(Identifier.of("b")),
                PolynomialWarning.productIdempotency(Identifier.of("c")));
    }

    @Test
    @DisplayName("Squaring a sum unions every pair of its monomials")
    void testSelfProduct() {
        Polynomial ab = sum(p("a"), p("b"));
        Polynomial expected = product(ab, ab.copy());

        ab.multiplyAssign(ab);

        assertThat(ab.getMonomials()).containsExactlyInAnyOrder(mono("a"), mono("a", "b"), mono("b"));
        assertThat(ab).isEqualTo(expected);
        assertThat(ab.getWarnings()).containsExactlyInAnyOrder(
                PolynomialWarning.productIdempotency(Identifier.of("a")),
                PolynomialWarning.productIdempotency(Identifier.of("b")));
    }

    @Test
    @DisplayName("Adding a sum to itself warns once per monomial and keeps earlier warnings once")
    void testSelfSum() {
        Polynomial repeated = sum(p("a"), p("a"), p("b"));

        repeated.addAssign(repeated);

        assertThat(repeated.getMonomials()).containsExactlyInAnyOrder(mono("a"), mono("b"));
        assertThat(repeated.getWarnings()).containsExactlyInAnyOrder(
                PolynomialWarning.sumIdempotency(mono("a")),
                PolynomialWarning.sumIdempotency(mono("a")),
                PolynomialWarning.sumIdempotency(mono("b")));
    }

    @Test
    @DisplayName("Warnings of operands travel with the result")
    void testWarningsPropagate() {
        Polynomial aa = sum(p("a"), p("a"));
        Polynomial result = product(p("x"), aa);

        assertThat(result.getWarnings()).containsExactly(PolynomialWarning.sumIdempotency(mono("a")));
    }

    @Test
    @DisplayName("Warnings do not take part in equality")
    void testEqualityIgnoresWarnings() {
        Polynomial clean = sum(p("a"), p("b"));
        Polynomial noisy = sum(p("a"), p("b"), p("b"));

        assertThat(noisy.getWarnings()).hasSize(1);
        assertThat(noisy).isEqualTo(clean);
        assertThat(noisy.hashCode()).isEqualTo(clean.hashCode());
    }

    @Test
    @DisplayName("Copies are independent")
    void testCopyIndependence() {
        Polynomial original = p("a");
        Polynomial copy = original.copy();

        copy.addAssign(p("b"));

        assertThat(original.getMonomials()).containsExactly(mono("a"));
        assertThat(original.isFlat()).isTrue();
    }
}
