package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void sortsKeysRecursivelyAndKeepsArrayOrder() throws Exception {
        JsonNode input = MAPPER.readTree("""
            {"b": 1, "a": {"z": [3, {"y": 1, "x": 2}], "c": null}}
            """);

        String canonical = new String(Canonicalizer.canonicalBytes(input), StandardCharsets.UTF_8);

        assertThat(canonical).isEqualTo("{\"a\":{\"c\":null,\"z\":[3,{\"x\":2,\"y\":1}]},\"b\":1}");
    }

    @Test
    void isIdempotent() throws Exception {
        JsonNode input = MAPPER.readTree("""
            {"nodes": {"b": {"k": [2, 1]}, "a": {}}, "id": "x", "ünïcode": "✓"}
            """);

        JsonNode once = Canonicalizer.canonicalize(input);
        JsonNode twice = Canonicalizer.canonicalize(once);

        assertThat(twice).isEqualTo(once);
        assertThat(Canonicalizer.canonicalBytes(twice)).isEqualTo(Canonicalizer.canonicalBytes(input));
    }

    @Test
    void doesNotModifyInput() throws Exception {
        JsonNode input = MAPPER.readTree("{\"b\": 1, \"a\": 2}");

        Canonicalizer.canonicalize(input);

        assertThat(input.fieldNames().next()).isEqualTo("b");
    }
}
