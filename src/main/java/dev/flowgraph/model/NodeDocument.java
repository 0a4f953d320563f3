package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node as it appears in a flow document: one component key with its payload, plus the
 * reserved keys. {@code routing} keeps its wire form: an array of route objects, the scalar
 * {@code "out"} or {@code "reply"}, or absent.
 */
public record NodeDocument(
    String componentKey,
    JsonNode payload,
    JsonNode routing,   // nullable
    JsonNode output,    // nullable
    JsonNode telemetry, // nullable
    String packAlias,   // nullable
    String operation    // nullable
) {

    public static final String ROUTING = "routing";
    public static final String OUTPUT = "output";
    public static final String TELEMETRY = "telemetry";
    public static final String PACK_ALIAS = "pack_alias";
    public static final String OPERATION = "operation";

    public NodeDocument {
        payload = Json.copyOrNull(payload);
        routing = Json.copy(routing);
        output = Json.copy(output);
        telemetry = Json.copy(telemetry);
    }

    public static boolean isReservedKey(String key) {
        return ROUTING.equals(key) || OUTPUT.equals(key) || TELEMETRY.equals(key)
            || PACK_ALIAS.equals(key) || OPERATION.equals(key);
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    @Override
    public JsonNode routing() {
        return Json.copy(routing);
    }

    @Override
    public JsonNode output() {
        return Json.copy(output);
    }

    @Override
    public JsonNode telemetry() {
        return Json.copy(telemetry);
    }
}
