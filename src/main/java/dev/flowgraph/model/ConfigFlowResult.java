package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of interpreting a config flow.
 */
public sealed interface ConfigFlowResult {

    /** The materialized node and the id it should be inserted under. */
    record Success(String nodeId, JsonNode node) implements ConfigFlowResult {
        public Success {
            node = node.deepCopy();
        }

        @Override
        public JsonNode node() {
            return node.deepCopy();
        }
    }

    record Failure(Diagnostic diagnostic) implements ConfigFlowResult {}
}
