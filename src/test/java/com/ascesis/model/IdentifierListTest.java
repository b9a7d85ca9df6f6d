package com.ascesis.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierListTest {

    @Test
    @DisplayName("Lists are sorted and free of duplicates")
    void testNormalization() {
        IdentifierList list = IdentifierList.of("c", "a", "b", "a");

        assertThat(list.names()).containsExactly("a", "b", "c");
        assertThat((Object) list).hasToString("a b c");
    }

    @Test
    @DisplayName("Union merges two lists")
    void testUnion() {
        IdentifierList union = IdentifierList.of("a", "c").union(IdentifierList.of("b", "c", "d"));

        assertThat(union.names()).containsExactly("a", "b", "c", "d");
    }

    @Test
    @DisplayName("Intersection returns the shared identifiers in order")
    void testIntersection() {
        List<Identifier> shared = IdentifierList.of("a", "b", "c").intersection(IdentifierList.of("b", "c", "d"));

        assertThat(shared).containsExactly(Identifier.of("b"), Identifier.of("c"));
        assertThat(IdentifierList.of("a").intersection(IdentifierList.of("b"))).isEmpty();
    }

    @Test
    @DisplayName("A proper prefix sorts first")
    void testOrdering() {
        IdentifierList a = IdentifierList.of("a");
        IdentifierList ab = IdentifierList.of("a", "b");
        IdentifierList b = IdentifierList.of("b");

        assertThat(a.compareTo(ab)).isNegative();
        assertThat(ab.compareTo(b)).isNegative();
        assertThat(IdentifierList.empty().compareTo(a)).isNegative();
        assertThat(ab.compareTo(IdentifierList.of("b", "a"))).isZero();
    }

    @Test
    @DisplayName("Blank identifiers are rejected")
    void testBlankIdentifier() {
        assertThatThrownBy(() -> Identifier.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
