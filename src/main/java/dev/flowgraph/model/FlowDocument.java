package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * A validated flow document. Node order is declaration order.
 */
public record FlowDocument(
    String id,
    String kind,
    String title,          // nullable
    String description,    // nullable
    String start,          // nullable, resolved by the loader when the document is loaded
    Integer schemaVersion, // nullable
    JsonNode parameters,   // nullable
    List<String> tags,
    Map<String, String> entrypoints,
    JsonNode meta,         // nullable
    Map<String, NodeDocument> nodes
) {

    public FlowDocument {
        parameters = Json.copy(parameters);
        meta = Json.copy(meta);
        tags = Json.listCopy(tags);
        entrypoints = Json.orderedCopy(entrypoints);
        nodes = Json.orderedCopy(nodes);
    }

    /** Minimal document with only the required parts. */
    public static FlowDocument of(String id, String kind, String start, Map<String, NodeDocument> nodes) {
        return new FlowDocument(id, kind, null, null, start, null, null, List.of(), Map.of(), null, nodes);
    }

    @Override
    public JsonNode parameters() {
        return Json.copy(parameters);
    }

    @Override
    public JsonNode meta() {
        return Json.copy(meta);
    }

    /** Entry node: declared start, then a node named {@code in}, then the first node. */
    public String entryNode() {
        if (start != null) {
            return start;
        }
        if (nodes.containsKey("in")) {
            return "in";
        }
        return nodes.keySet().stream().findFirst().orElse(null);
    }
}
