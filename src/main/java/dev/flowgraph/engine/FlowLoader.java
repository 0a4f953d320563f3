package dev.flowgraph.engine;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.flowgraph.model.ComponentKey;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.JsonPointers;
import dev.flowgraph.model.LoadResult;
import dev.flowgraph.model.NodeDocument;
import dev.flowgraph.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads flow documents from YAML or JSON text.
 *
 * <p>Loading runs in stages: parse, schema validation, node shape, graph references. Each stage
 * reports all of its own findings; a stage with errors stops the pipeline. A document is
 * returned only when no stage reported an error.
 */
public final class FlowLoader {

    private static final Logger log = LoggerFactory.getLogger(FlowLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private FlowLoader() {}

    /**
     * Load a flow document validated against the bundled schema.
     */
    public static LoadResult load(String text) {
        return load(text, FlowSchemas.bundled());
    }

    /**
     * Load a flow document validated against the given schema text.
     */
    public static LoadResult load(String text, String schemaText) {
        FlowSchemaValidator schema;
        try {
            schema = FlowSchemaValidator.compile(schemaText);
        } catch (IOException e) {
            return failure(Diagnostic.of(DiagnosticCode.SCHEMA_INVALID, "", "schema is not usable: " + e.getMessage()));
        }
        return load(text, schema);
    }

    /**
     * Load a flow document validated against a compiled schema.
     */
    public static LoadResult load(String text, FlowSchemaValidator schema) {
        JsonNode root;
        try {
            root = YAML.readTree(text);
        } catch (JsonProcessingException e) {
            return failure(Diagnostic.of(DiagnosticCode.YAML_PARSE, "", describeParseError(e)));
        }
        if (root == null || root.isMissingNode()) {
            return failure(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, "", "document is empty"));
        }

        List<Diagnostic> schemaErrors = schema.validate(root);
        if (!schemaErrors.isEmpty()) {
            return new LoadResult.Failure(schemaErrors);
        }

        var errors = new ArrayList<Diagnostic>();
        checkEnvelope(root, errors);
        if (!errors.isEmpty()) {
            return new LoadResult.Failure(errors);
        }
        Map<String, NodeDocument> nodes = parseNodes(root.get("nodes"), errors);
        if (!errors.isEmpty()) {
            return new LoadResult.Failure(errors);
        }

        Map<String, String> entrypoints = parseEntrypoints(root.get("entrypoints"));
        checkRouteTargets(nodes, errors);
        String start = resolveStart(root, entrypoints, nodes, errors);
        if (!errors.isEmpty()) {
            return new LoadResult.Failure(errors);
        }

        FlowDocument document = new FlowDocument(
            root.get("id").asText(),
            root.path("type").isTextual() ? root.get("type").asText() : root.get("kind").asText(),
            optionalText(root, "title"),
            optionalText(root, "description"),
            start,
            root.path("schema_version").isInt() ? root.get("schema_version").asInt() : null,
            root.get("parameters"),
            parseTags(root.get("tags")),
            entrypoints,
            root.get("meta"),
            nodes
        );
        log.debug("Loaded flow '{}' with {} nodes, start '{}'", document.id(), nodes.size(), start);
        return new LoadResult.Success(document);
    }

    /**
     * Load a flow document from a file, validated against the bundled schema.
     */
    public static LoadResult loadFromFile(Path path) throws IOException {
        return load(Files.readString(path, StandardCharsets.UTF_8));
    }

    /** Fields the loader itself depends on, whatever schema the caller supplied. */
    private static void checkEnvelope(JsonNode root, List<Diagnostic> errors) {
        if (!root.isObject()) {
            errors.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, "", "flow document must be an object"));
            return;
        }
        if (!root.path("id").isTextual()) {
            errors.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, "/id", "flow 'id' must be a string"));
        }
        if (!root.path("type").isTextual() && !root.path("kind").isTextual()) {
            errors.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, "/type", "flow needs a 'type' or 'kind'"));
        }
        if (!root.path("nodes").isObject()) {
            errors.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, "/nodes", "flow 'nodes' must be a map"));
            return;
        }
        for (var entry : root.get("nodes").properties()) {
            if (!entry.getValue().isObject()) {
                errors.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, JsonPointers.node(entry.getKey()),
                    "node '%s' must be a map".formatted(entry.getKey())));
            }
        }
    }

    private static Map<String, NodeDocument> parseNodes(JsonNode nodesNode, List<Diagnostic> errors) {
        var nodes = new LinkedHashMap<String, NodeDocument>();
        for (var entry : nodesNode.properties()) {
            NodeDocument node = parseNode(entry.getKey(), entry.getValue(), errors);
            if (node != null) {
                nodes.put(entry.getKey(), node);
            }
        }
        return nodes;
    }

    private static NodeDocument parseNode(String nodeId, JsonNode node, List<Diagnostic> errors) {
        String pointer = JsonPointers.node(nodeId);
        var componentKeys = new ArrayList<String>();
        for (var field : node.properties()) {
            if (!NodeDocument.isReservedKey(field.getKey())) {
                componentKeys.add(field.getKey());
            }
        }

        if (componentKeys.isEmpty()) {
            errors.add(Diagnostic.of(DiagnosticCode.MISSING_COMPONENT_KEY, pointer,
                "node '%s' must contain exactly one component key like 'qa.process'".formatted(nodeId)));
            return null;
        }
        if (componentKeys.size() > 1) {
            errors.add(Diagnostic.of(DiagnosticCode.DUPLICATE_COMPONENT_KEY, pointer,
                "node '%s' has more than one component key: %s".formatted(nodeId, componentKeys)));
            return null;
        }

        String componentKey = componentKeys.get(0);
        if (!ComponentKey.isWellFormed(componentKey)) {
            errors.add(Diagnostic.of(DiagnosticCode.INVALID_COMPONENT_KEY_FORMAT, JsonPointers.append(pointer, componentKey),
                "invalid component key '%s' in node '%s' (expected a builtin or <namespace>.<adapter>[.<operation>])"
                    .formatted(componentKey, nodeId)));
            return null;
        }

        int before = errors.size();
        RoutingCodec.read(node.get(NodeDocument.ROUTING), JsonPointers.append(pointer, NodeDocument.ROUTING), errors);
        if (errors.size() != before) {
            return null;
        }

        return new NodeDocument(
            componentKey,
            node.get(componentKey),
            node.get(NodeDocument.ROUTING),
            node.get(NodeDocument.OUTPUT),
            node.get(NodeDocument.TELEMETRY),
            optionalText(node, NodeDocument.PACK_ALIAS),
            optionalText(node, NodeDocument.OPERATION)
        );
    }

    private static void checkRouteTargets(Map<String, NodeDocument> nodes, List<Diagnostic> errors) {
        for (var entry : nodes.entrySet()) {
            String nodeId = entry.getKey();
            List<Route> routes = RoutingCodec.parse(entry.getValue().routing());
            for (int i = 0; i < routes.size(); i++) {
                String target = routes.get(i).to();
                if (target != null && !nodes.containsKey(target)) {
                    errors.add(Diagnostic.of(DiagnosticCode.ROUTE_TARGET_MISSING,
                        JsonPointers.node(nodeId, NodeDocument.ROUTING, i, "to"),
                        "missing node '%s' referenced in routing from '%s'".formatted(target, nodeId)));
                }
            }
        }
    }

    private static String resolveStart(JsonNode root, Map<String, String> entrypoints,
                                       Map<String, NodeDocument> nodes, List<Diagnostic> errors) {
        for (var entry : entrypoints.entrySet()) {
            if (!nodes.containsKey(entry.getValue())) {
                errors.add(Diagnostic.of(DiagnosticCode.ENTRYPOINT_MISSING, JsonPointers.of("entrypoints", entry.getKey()),
                    "entrypoint '%s' targets unknown node '%s'".formatted(entry.getKey(), entry.getValue())));
            }
        }

        String start = optionalText(root, "start");
        if (start != null) {
            if (!nodes.containsKey(start)) {
                errors.add(Diagnostic.of(DiagnosticCode.ENTRYPOINT_MISSING, "/start",
                    "start node '%s' not found in nodes".formatted(start)));
            }
            return start;
        }
        if (entrypoints.containsKey("start")) {
            return entrypoints.get("start");
        }
        if (nodes.containsKey("in")) {
            return "in";
        }
        errors.add(Diagnostic.of(DiagnosticCode.MISSING_ENTRYPOINT, "/start",
            "flow declares no 'start' and has no node named 'in'"));
        return null;
    }

    private static Map<String, String> parseEntrypoints(JsonNode node) {
        var entrypoints = new LinkedHashMap<String, String>();
        if (node != null) {
            for (var entry : node.properties()) {
                entrypoints.put(entry.getKey(), entry.getValue().asText());
            }
        }
        return entrypoints;
    }

    private static List<String> parseTags(JsonNode node) {
        var tags = new ArrayList<String>();
        if (node != null) {
            node.forEach(t -> tags.add(t.asText()));
        }
        return tags;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describeParseError(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        String message = e.getOriginalMessage();
        if (location == null || location.getLineNr() < 0) {
            return "YAML parse error: " + message;
        }
        return "YAML parse error at %d:%d: %s".formatted(location.getLineNr(), location.getColumnNr(), message);
    }

    private static LoadResult failure(Diagnostic diagnostic) {
        log.debug("Flow load failed: {}", diagnostic);
        return new LoadResult.Failure(List.of(diagnostic));
    }
}
