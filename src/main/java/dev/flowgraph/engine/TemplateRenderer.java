package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whole-leaf {@code {{state.<key>}}} substitution over a JSON tree. A string leaf is replaced
 * only when the placeholder is its entire content; embedded placeholders are left alone.
 */
public final class TemplateRenderer {

    private static final Pattern STATE_REF = Pattern.compile("^\\{\\{\\s*state\\.([A-Za-z_]\\w*)\\s*}}$");

    private TemplateRenderer() {}

    /** State key referenced by a leaf, or empty if the leaf is not a placeholder. */
    public static Optional<String> stateKey(String leaf) {
        Matcher m = STATE_REF.matcher(leaf);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /** First referenced key the state cannot supply, in document order. */
    public static Optional<String> firstMissingKey(JsonNode template, ConfigFlowState state) {
        if (template.isTextual()) {
            return stateKey(template.asText()).filter(key -> !state.has(key));
        }
        if (template.isContainerNode()) {
            for (JsonNode child : template) {
                Optional<String> missing = firstMissingKey(child, state);
                if (missing.isPresent()) {
                    return missing;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Render a copy of the template. Placeholders whose key is absent from state are kept as is;
     * check {@link #firstMissingKey} first when that matters.
     */
    public static JsonNode render(JsonNode template, ConfigFlowState state) {
        if (template.isTextual()) {
            return stateKey(template.asText())
                .flatMap(state::text)
                .<JsonNode>map(TextNode::valueOf)
                .orElseGet(template::deepCopy);
        }
        if (template.isObject()) {
            ObjectNode out = ((ObjectNode) template).objectNode();
            template.properties().forEach(e -> out.set(e.getKey(), render(e.getValue(), state)));
            return out;
        }
        if (template.isArray()) {
            ArrayNode out = ((ArrayNode) template).arrayNode();
            template.forEach(item -> out.add(render(item, state)));
            return out;
        }
        return template.deepCopy();
    }
}
