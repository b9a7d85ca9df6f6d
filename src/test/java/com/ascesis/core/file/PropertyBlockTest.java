package com.ascesis.core.file;

import com.ascesis.core.compiler.CompilationException;
import com.ascesis.model.Literal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertyBlockTest {

    private static PropertyBlock.Value size(long value) {
        return new PropertyBlock.LiteralValue(Literal.size(value));
    }

    private static PropertyBlock.Value name(String value) {
        return new PropertyBlock.LiteralValue(Literal.name(value));
    }

    @Test
    @DisplayName("Should look up values through nested blocks")
    void testNestedLookup() {
        PropertyBlock inner = PropertyBlock.of("width", size(40))
                .withMore(List.of(PropertyBlock.of("label", name("wide"))));
        PropertyBlock outer = PropertyBlock.of("layout", new PropertyBlock.BlockValue(
                PropertyBlock.of("node", new PropertyBlock.BlockValue(inner))));

        assertThat(outer.getNestedSize(List.of("layout", "node"), "width")).hasValue(40);
        assertThat(outer.getNestedName(List.of("layout", "node"), "label")).hasValue("wide");
        assertThat(outer.getNestedSize(List.of("layout", "missing"), "width")).isEmpty();
        assertThat(outer.getNestedIdentifier(List.of("layout"), "node")).isEmpty();
    }

    @Test
    @DisplayName("A later field with the same key takes precedence")
    void testWithMoreOverrides() {
        PropertyBlock block = PropertyBlock.of("title", name("first"))
                .withMore(List.of(PropertyBlock.of("title", name("second")),
                        PropertyBlock.of("node", new PropertyBlock.IdentifierValue("a"))));

        assertThat(block.getName("title")).hasValue("second");
        assertThat(block.getFields()).containsOnlyKeys("title", "node");
    }

    @Test
    @DisplayName("Getters should not convert between value kinds")
    void testKindMismatch() {
        PropertyBlock block = PropertyBlock.of("count", size(3));

        assertThat(block.getSize("count")).hasValue(3);
        assertThat(block.getName("count")).isEmpty();
        assertThat(block.getIdentifier("count")).isEmpty();
        assertThat(block.getBlock("count")).isEmpty();
    }

    @Test
    void testSelectors() {
        assertThat(PropertyBlock.empty().getSelector()).isEmpty();
        assertThat(PropertyBlock.empty().withSelector("vis").getSelector()).hasValue(PropertyBlock.Selector.VIS);
        assertThatThrownBy(() -> PropertyBlock.Selector.fromKeyword("gui"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("'gui'");
    }
}
