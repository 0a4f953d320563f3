package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Canonicalized, content-addressed form of a flow document.
 */
public record FlowBundle(
    String id,
    String kind,
    String entry,
    String hash, // lowercase hex, 256 bits
    List<ComponentPin> componentPins,
    JsonNode canonicalJson
) {

    public FlowBundle {
        componentPins = List.copyOf(componentPins);
        canonicalJson = canonicalJson == null ? null : canonicalJson.deepCopy();
    }

    @Override
    public JsonNode canonicalJson() {
        return canonicalJson == null ? null : canonicalJson.deepCopy();
    }
}
