package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void recognisesWholeLeafPlaceholders() {
        assertThat(TemplateRenderer.stateKey("{{state.name}}")).contains("name");
        assertThat(TemplateRenderer.stateKey("{{  state.user_id  }}")).contains("user_id");
        assertThat(TemplateRenderer.stateKey("hi {{state.name}}")).isEmpty();
        assertThat(TemplateRenderer.stateKey("{{state.}}")).isEmpty();
        assertThat(TemplateRenderer.stateKey("{{other.name}}")).isEmpty();
    }

    @Test
    void rendersCopyWithStringifiedValues() throws Exception {
        JsonNode template = MAPPER.readTree("""
            {"a": "{{state.n}}", "b": ["{{state.s}}", "keep"], "c": {"d": "{{state.obj}}"}}
            """);
        var state = new ConfigFlowState(Map.of(
            "n", IntNode.valueOf(4),
            "s", TextNode.valueOf("text"),
            "obj", MAPPER.readTree("{\"k\":1}")
        ), "in");

        JsonNode rendered = TemplateRenderer.render(template, state);

        assertThat(rendered.get("a").asText()).isEqualTo("4");
        assertThat(rendered.get("b").get(0).asText()).isEqualTo("text");
        assertThat(rendered.get("b").get(1).asText()).isEqualTo("keep");
        assertThat(rendered.get("c").get("d").asText()).isEqualTo("{\"k\":1}");
        assertThat(template.get("a").asText()).isEqualTo("{{state.n}}");
    }

    @Test
    void findsFirstMissingKeyInDocumentOrder() throws Exception {
        JsonNode template = MAPPER.readTree("""
            {"a": "{{state.present}}", "b": ["{{state.first}}"], "c": "{{state.second}}"}
            """);
        var state = new ConfigFlowState(Map.of("present", TextNode.valueOf("x")), "in");

        assertThat(TemplateRenderer.firstMissingKey(template, state)).contains("first");
    }
}
