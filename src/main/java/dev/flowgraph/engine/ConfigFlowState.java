package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state for one config-flow run: resolved values keyed by field id, and the walk
 * position. Local to a single call.
 */
public final class ConfigFlowState {
    private final Map<String, JsonNode> values;
    private String currentNode;
    private int visitCount;

    public ConfigFlowState(Map<String, JsonNode> answers, String entryNode) {
        this.values = new LinkedHashMap<>();
        answers.forEach((key, value) -> values.put(key, value.deepCopy()));
        this.currentNode = entryNode;
        this.visitCount = 1;
    }

    public String currentNode() { return currentNode; }
    public int visitCount() { return visitCount; }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /** Text form of a value: strings unquoted, everything else as compact JSON. */
    public Optional<String> text(String key) {
        return get(key).map(ConfigFlowState::stringify);
    }

    /** Record a value unless an answer for the key already exists. */
    public void resolve(String key, JsonNode value) {
        values.putIfAbsent(key, value.deepCopy());
    }

    /**
     * Move to the next node: update currentNode and increment visitCount.
     */
    public void transitionTo(String nextNode) {
        this.currentNode = nextNode;
        this.visitCount++;
    }

    static String stringify(JsonNode value) {
        return value.isTextual() ? value.asText() : value.toString();
    }
}
