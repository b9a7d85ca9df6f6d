package com.ascesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AscesisApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write the compiled root content to the output file")
    void testRunWritesOutput() throws Exception {
        Path input = Path.of(getClass().getResource("/arrows.json").toURI());
        Path output = tempDir.resolve("arrows.out.json");

        AscesisApplication.run(input, output);

        JsonNode tree = new ObjectMapper().readTree(Files.readString(output));
        assertThat(tree.get("context").asText()).isEqualTo("arrows");
        assertThat(tree.get("root").asText()).isEqualTo("Main");
        assertThat(tree.get("capacities").get("a").asLong()).isEqualTo(2L);
        assertThat(tree.get("weights")).hasSize(1);
        assertThat(tree.get("inhibitors").get(0).get("face").asText()).isEqualTo("TX");
    }
}
