package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Request to insert one component node after an anchor.
 */
public record AddStepSpec(
    String newId,
    String anchor,        // nullable, defaults to the start node
    String componentKey,
    JsonNode payload,     // nullable
    List<Route> routing,  // nullable, inherit the anchor's routing
    String packAlias,     // nullable
    String operation      // nullable
) {

    public AddStepSpec {
        payload = payload == null ? null : payload.deepCopy();
        routing = routing == null ? null : List.copyOf(routing);
    }

    public static AddStepSpec of(String newId, String anchor, String componentKey, JsonNode payload) {
        return new AddStepSpec(newId, anchor, componentKey, payload, null, null, null);
    }

    public AddStepSpec withRouting(List<Route> explicitRouting) {
        return new AddStepSpec(newId, anchor, componentKey, payload, explicitRouting, packAlias, operation);
    }

    public AddStepSpec withOperation(String op) {
        return new AddStepSpec(newId, anchor, componentKey, payload, routing, packAlias, op);
    }

    @Override
    public JsonNode payload() {
        return payload == null ? null : payload.deepCopy();
    }
}
