package dev.flowgraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.NodeDocument;

import java.io.UncheckedIOException;

/**
 * Renders flow documents to their wire shape: each node is a map holding its component key
 * with the payload, plus the reserved keys that are set.
 */
public final class DocumentWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final YAMLMapper YAML = YAMLMapper.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .build();

    private DocumentWriter() {}

    public static ObjectNode toTree(FlowDocument document) {
        ObjectNode root = NODES.objectNode();
        root.put("id", document.id());
        root.put("type", document.kind());
        putIfPresent(root, "title", document.title());
        putIfPresent(root, "description", document.description());
        putIfPresent(root, "start", document.start());
        if (document.schemaVersion() != null) {
            root.put("schema_version", document.schemaVersion());
        }
        if (document.parameters() != null) {
            root.set("parameters", document.parameters());
        }
        if (!document.tags().isEmpty()) {
            ArrayNode tags = root.putArray("tags");
            document.tags().forEach(tags::add);
        }
        if (!document.entrypoints().isEmpty()) {
            ObjectNode entrypoints = root.putObject("entrypoints");
            document.entrypoints().forEach(entrypoints::put);
        }
        if (document.meta() != null) {
            root.set("meta", document.meta());
        }

        ObjectNode nodes = root.putObject("nodes");
        for (var entry : document.nodes().entrySet()) {
            nodes.set(entry.getKey(), nodeTree(entry.getValue()));
        }
        return root;
    }

    static ObjectNode nodeTree(NodeDocument node) {
        ObjectNode tree = NODES.objectNode();
        tree.set(node.componentKey(), node.payload());
        putIfPresent(tree, NodeDocument.PACK_ALIAS, node.packAlias());
        putIfPresent(tree, NodeDocument.OPERATION, node.operation());
        if (node.output() != null) {
            tree.set(NodeDocument.OUTPUT, node.output());
        }
        if (node.telemetry() != null) {
            tree.set(NodeDocument.TELEMETRY, node.telemetry());
        }
        if (node.routing() != null) {
            tree.set(NodeDocument.ROUTING, node.routing());
        }
        return tree;
    }

    public static String toJson(FlowDocument document) {
        return write(JSON, toTree(document), true);
    }

    public static String toYaml(FlowDocument document) {
        return write(YAML, toTree(document), false);
    }

    /** Pretty JSON for any tree. */
    public static String toJson(JsonNode tree) {
        return write(JSON, tree, true);
    }

    private static String write(ObjectMapper mapper, JsonNode tree, boolean pretty) {
        try {
            return pretty
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                : mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            // trees built from JsonNode values always serialize
            throw new UncheckedIOException(e);
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
