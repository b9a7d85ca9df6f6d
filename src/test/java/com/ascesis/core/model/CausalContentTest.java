package com.ascesis.core.model;

import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CausalContentTest {

    private static IntList set(int... ids) {
        return CausalContent.nodeSet(ids);
    }

    @Test
    @DisplayName("Node sets are sorted and deduplicated")
    void testNodeSet() {
        assertThat((List<Integer>) set(3, 1, 3, 2)).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Families keep each node set once, in order")
    void testAddToFamilies() {
        CausalContent content = new CausalContent();
        content.addToEffects(0, List.of(set(2, 1), set(3)));
        content.addToEffects(0, List.of(set(1, 2)));

        assertThat(content.getEffects(0)).containsExactly(set(1, 2), set(3));
        assertThat(content.getCauses(0)).isEmpty();
        assertThat(content.getEffectIds()).containsExactly(0);
    }

    @Test
    @DisplayName("Sum unions families identifier by identifier")
    void testAddAssign() {
        CausalContent left = new CausalContent();
        left.addToEffects(0, List.of(set(1)));
        CausalContent right = new CausalContent();
        right.addToEffects(0, List.of(set(2)));
        right.addToCauses(5, List.of(set(0)));

        left.addAssign(right);

        assertThat(left.getEffects(0)).containsExactly(set(1), set(2));
        assertThat(left.getCauses(5)).containsExactly(set(0));
        assertThat(left.getIds()).containsExactly(0, 5);
    }

    @Test
    @DisplayName("Product multiplies shared families and carries over the rest")
    void testMultiplyAssign() {
        CausalContent left = new CausalContent();
        left.addToEffects(0, List.of(set(1), set(2)));
        left.addToCauses(7, List.of(set(8)));
        CausalContent right = new CausalContent();
        right.addToEffects(0, List.of(set(3), set(1)));
        right.addToCauses(9, List.of(set(4)));

        left.multiplyAssign(right);

        assertThat(left.getEffects(0)).containsExactly(set(1), set(1, 2), set(1, 3), set(2, 3));
        assertThat(left.getCauses(7)).containsExactly(set(8));
        assertThat(left.getCauses(9)).containsExactly(set(4));
    }

    @Test
    @DisplayName("Copies are independent and equal")
    void testCopy() {
        CausalContent content = new CausalContent();
        content.addToCauses(1, List.of(set(2)));

        CausalContent copy = content.copy();
        copy.addToCauses(1, List.of(set(3)));

        assertThat(content.getCauses(1)).containsExactly(set(2));
        assertThat(copy).isNotEqualTo(content);
        assertThat(content.copy()).isEqualTo(content);
    }
}
