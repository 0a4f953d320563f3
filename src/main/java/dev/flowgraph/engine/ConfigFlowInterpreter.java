package dev.flowgraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowgraph.model.ComponentKey;
import dev.flowgraph.model.ConfigFlowResult;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.JsonPointers;
import dev.flowgraph.model.NodeDocument;
import dev.flowgraph.model.NodeKind;
import dev.flowgraph.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a config flow: a flow of {@code questions} nodes ending in a {@code template} node,
 * evaluated against caller answers to produce one node definition.
 *
 * <p>Questions nodes resolve each declared field from the answers, then the field default. The
 * template node renders its payload from the collected state and ends the run. The output is
 * either the {@code {node_id, node}} envelope the template produced, or the template node's own
 * id with the rendered payload.
 */
public final class ConfigFlowInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ConfigFlowInterpreter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** Visits allowed beyond the node count before the walk is treated as a loop. */
    static final int TRAVERSAL_SLACK = 4;

    private ConfigFlowInterpreter() {}

    public static ConfigFlowResult run(FlowDocument document, Map<String, JsonNode> answers) {
        String entry = document.entryNode();
        if (entry == null) {
            return failure(DiagnosticCode.MISSING_ENTRYPOINT, "/start", "config flow has no nodes");
        }
        var state = new ConfigFlowState(answers, entry);
        int limit = document.nodes().size() + TRAVERSAL_SLACK;

        while (state.visitCount() <= limit) {
            String nodeId = state.currentNode();
            NodeDocument node = document.nodes().get(nodeId);
            if (node == null) {
                return failure(DiagnosticCode.ENTRYPOINT_MISSING, JsonPointers.node(nodeId),
                    "node '%s' missing during config flow execution".formatted(nodeId));
            }
            log.debug("Config flow '{}' visiting '{}'", document.id(), nodeId);

            switch (NodeKind.classify(node.componentKey())) {
                case QUESTIONS -> {
                    Optional<Diagnostic> problem = applyQuestions(nodeId, node.payload(), state);
                    if (problem.isPresent()) {
                        return new ConfigFlowResult.Failure(problem.get());
                    }
                }
                case TEMPLATE -> {
                    return renderTemplate(nodeId, node.payload(), state);
                }
                case COMPONENT, OTHER -> {
                    return failure(DiagnosticCode.UNSUPPORTED_CONFIG_NODE_KIND, JsonPointers.node(nodeId, node.componentKey()),
                        "unsupported component '%s' in config flow".formatted(node.componentKey()));
                }
            }

            Optional<String> next = selectNext(RoutingCodec.parse(node.routing()), state);
            if (next.isEmpty()) {
                return failure(DiagnosticCode.NO_REACHABLE_NEXT, JsonPointers.node(nodeId, NodeDocument.ROUTING),
                    "config flow cannot continue from '%s' before reaching a template node".formatted(nodeId));
            }
            state.transitionTo(next.get());
        }

        return failure(DiagnosticCode.TRAVERSAL_LIMIT_EXCEEDED, "/nodes",
            "config flow exceeded %d node visits".formatted(limit));
    }

    private static Optional<Diagnostic> applyQuestions(String nodeId, JsonNode payload, ConfigFlowState state) {
        String pointer = JsonPointers.node(nodeId, ComponentKey.QUESTIONS);
        JsonNode fields = payload.get("fields");
        if (fields == null || !fields.isArray()) {
            return Optional.of(Diagnostic.of(DiagnosticCode.QUESTIONS_FIELDS_REQUIRED, pointer,
                "questions node '%s' has no fields list".formatted(nodeId)));
        }

        for (int i = 0; i < fields.size(); i++) {
            JsonNode field = fields.get(i);
            String fieldPointer = JsonPointers.append(JsonPointers.append(pointer, "fields"), i);
            JsonNode id = field.get("id");
            if (id == null || !id.isTextual()) {
                return Optional.of(Diagnostic.of(DiagnosticCode.QUESTIONS_FIELDS_REQUIRED, fieldPointer,
                    "questions field has no 'id'"));
            }
            if (state.has(id.asText())) {
                continue;
            }
            JsonNode fallback = field.get("default");
            if (fallback == null) {
                return Optional.of(Diagnostic.of(DiagnosticCode.MISSING_ANSWER, fieldPointer,
                    "missing answer for '%s'".formatted(id.asText())));
            }
            state.resolve(id.asText(), fallback);
        }
        return Optional.empty();
    }

    private static ConfigFlowResult renderTemplate(String nodeId, JsonNode payload, ConfigFlowState state) {
        String pointer = JsonPointers.node(nodeId, ComponentKey.TEMPLATE);
        JsonNode template = payload;
        if (payload.isTextual()) {
            try {
                template = MAPPER.readTree(payload.asText());
            } catch (JsonProcessingException e) {
                return failure(DiagnosticCode.TEMPLATE_INVALID, pointer,
                    "template is not valid JSON: " + e.getOriginalMessage());
            }
        }

        Optional<String> missing = TemplateRenderer.firstMissingKey(template, state);
        if (missing.isPresent()) {
            return failure(DiagnosticCode.MISSING_ANSWER, pointer,
                "missing answer for '%s'".formatted(missing.get()));
        }
        JsonNode rendered = TemplateRenderer.render(template, state);

        JsonNode envelopeId = rendered.get("node_id");
        JsonNode envelopeNode = rendered.get("node");
        if (envelopeId != null && envelopeId.isTextual() && envelopeNode != null && envelopeNode.isObject()) {
            return new ConfigFlowResult.Success(envelopeId.asText(), normalizeNode((ObjectNode) envelopeNode));
        }
        JsonNode node = rendered.isObject() ? normalizeNode((ObjectNode) rendered) : rendered;
        return new ConfigFlowResult.Success(nodeId, node);
    }

    /**
     * Edge selection: the first route that is not {@code out}, whose guard holds and that names a
     * target node.
     */
    static Optional<String> selectNext(List<Route> routes, ConfigFlowState state) {
        for (Route route : routes) {
            if (route.out() || !route.hasTarget()) {
                continue;
            }
            if (route.isGuarded() && !guardHolds(route.status(), state)) {
                continue;
            }
            return Optional.of(route.to());
        }
        return Optional.empty();
    }

    /** {@code key==value} compares {@code state[key]}; a bare value compares {@code state["status"]}. */
    static boolean guardHolds(String guard, ConfigFlowState state) {
        int eq = guard.indexOf("==");
        String key = eq < 0 ? "status" : guard.substring(0, eq).trim();
        String expected = eq < 0 ? guard.trim() : guard.substring(eq + 2).trim();
        return state.text(key).map(expected::equals).orElse(false);
    }

    /**
     * A node written as {@code {tool: {component, pack_alias?, operation?, ...config}, routing?}}
     * becomes {@code {<component>: config, pack_alias?, operation?, routing?}}. Other shapes pass
     * through.
     */
    static JsonNode normalizeNode(ObjectNode node) {
        JsonNode tool = node.get("tool");
        long componentKeys = node.properties().stream()
            .filter(e -> !NodeDocument.isReservedKey(e.getKey()))
            .count();
        if (componentKeys != 1 || tool == null || !tool.isObject() || !tool.path("component").isTextual()) {
            return node;
        }

        ObjectNode config = ((ObjectNode) tool).deepCopy();
        String component = config.remove("component").asText();
        JsonNode packAlias = config.remove(NodeDocument.PACK_ALIAS);
        JsonNode operation = config.remove(NodeDocument.OPERATION);

        ObjectNode flat = NODES.objectNode();
        flat.set(component, config);
        copyFirst(flat, NodeDocument.PACK_ALIAS, packAlias, node.get(NodeDocument.PACK_ALIAS));
        copyFirst(flat, NodeDocument.OPERATION, operation, node.get(NodeDocument.OPERATION));
        for (String reserved : List.of(NodeDocument.OUTPUT, NodeDocument.TELEMETRY, NodeDocument.ROUTING)) {
            if (node.has(reserved)) {
                flat.set(reserved, node.get(reserved).deepCopy());
            }
        }
        return flat;
    }

    private static void copyFirst(ObjectNode target, String field, JsonNode preferred, JsonNode fallback) {
        JsonNode value = preferred != null && !preferred.isNull() ? preferred : fallback;
        if (value != null && !value.isNull()) {
            target.set(field, value.deepCopy());
        }
    }

    private static ConfigFlowResult failure(DiagnosticCode code, String pointer, String message) {
        log.debug("Config flow failed: {} {}", code, message);
        return new ConfigFlowResult.Failure(Diagnostic.of(code, pointer, message));
    }
}
