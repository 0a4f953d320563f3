package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed graph built from a flow document; the working form for editing, validation and
 * interpretation. The default entry is stored under {@link #START}.
 */
public record FlowIr(
    String id,
    String kind,
    String title,          // nullable
    String description,    // nullable
    JsonNode parameters,   // nullable
    List<String> tags,
    Integer schemaVersion, // nullable
    JsonNode meta,         // nullable
    Map<String, String> entrypoints,
    Map<String, NodeIr> nodes
) {

    public static final String START = "start";

    public FlowIr {
        parameters = Json.copy(parameters);
        meta = Json.copy(meta);
        tags = Json.listCopy(tags);
        entrypoints = Json.orderedCopy(entrypoints);
        nodes = Json.orderedCopy(nodes);
    }

    public static FlowIr of(String id, String kind, Map<String, String> entrypoints, Map<String, NodeIr> nodes) {
        return new FlowIr(id, kind, null, null, null, List.of(), null, null, entrypoints, nodes);
    }

    @Override
    public JsonNode parameters() {
        return Json.copy(parameters);
    }

    @Override
    public JsonNode meta() {
        return Json.copy(meta);
    }

    public Optional<NodeIr> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<String> startNode() {
        return Optional.ofNullable(entrypoints.get(START));
    }

    public FlowIr withNodes(Map<String, NodeIr> newNodes) {
        return new FlowIr(id, kind, title, description, parameters, tags, schemaVersion, meta, entrypoints, newNodes);
    }
}
