package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A node of the working graph. Edges refer to other nodes by id only.
 */
public record NodeIr(
    String id,
    NodeKind kind,
    String componentKey,
    JsonNode payload,
    List<Route> routing,
    JsonNode output,    // nullable
    JsonNode telemetry, // nullable
    String packAlias,   // nullable
    String operation    // nullable
) {

    public NodeIr {
        payload = Json.copyOrNull(payload);
        routing = Json.listCopy(routing);
        output = Json.copy(output);
        telemetry = Json.copy(telemetry);
    }

    public static NodeIr of(String id, String componentKey, JsonNode payload, List<Route> routing) {
        return new NodeIr(id, NodeKind.classify(componentKey), componentKey, payload, routing,
            null, null, null, null);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    @Override
    public JsonNode output() {
        return Json.copy(output);
    }

    @Override
    public JsonNode telemetry() {
        return Json.copy(telemetry);
    }

    public NodeIr withRouting(List<Route> newRouting) {
        return new NodeIr(id, kind, componentKey, payload, newRouting, output, telemetry, packAlias, operation);
    }
}
