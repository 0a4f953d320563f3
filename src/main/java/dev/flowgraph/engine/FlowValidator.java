package dev.flowgraph.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowgraph.catalog.ComponentCatalog;
import dev.flowgraph.catalog.ComponentMetadata;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowIr;
import dev.flowgraph.model.JsonPointers;
import dev.flowgraph.model.NodeDocument;
import dev.flowgraph.model.NodeIr;
import dev.flowgraph.model.Route;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a flow graph against itself and a component catalog.
 *
 * <p>All checks run; nothing short-circuits. Routing cycles are legal. A result that is empty or
 * holds only warnings means the flow passes.
 */
public final class FlowValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FlowValidator() {}

    public static List<Diagnostic> validate(FlowIr flow, ComponentCatalog catalog) {
        var diagnostics = new ArrayList<Diagnostic>();

        for (var entry : flow.entrypoints().entrySet()) {
            if (!flow.nodes().containsKey(entry.getValue())) {
                String pointer = FlowIr.START.equals(entry.getKey()) ? "/start" : JsonPointers.of("entrypoints", entry.getKey());
                diagnostics.add(Diagnostic.of(DiagnosticCode.ENTRYPOINT_MISSING, pointer,
                    "entrypoint '%s' targets unknown node '%s'".formatted(entry.getKey(), entry.getValue())));
            }
        }

        for (NodeIr node : flow.nodes().values()) {
            checkRoutes(flow, node, diagnostics);
            checkKind(node, catalog, diagnostics);
        }

        checkReachability(flow, diagnostics);
        return diagnostics;
    }

    /** True when any diagnostic should block a write. */
    public static boolean hasErrors(List<Diagnostic> diagnostics) {
        return Diagnostic.hasErrors(diagnostics);
    }

    private static void checkRoutes(FlowIr flow, NodeIr node, List<Diagnostic> out) {
        List<Route> routes = node.routing();
        for (int i = 0; i < routes.size(); i++) {
            String target = routes.get(i).to();
            if (target != null && !flow.nodes().containsKey(target)) {
                out.add(Diagnostic.of(DiagnosticCode.ROUTE_TARGET_MISSING,
                    JsonPointers.node(node.id(), NodeDocument.ROUTING, i, "to"),
                    "missing node '%s' referenced in routing from '%s'".formatted(target, node.id())));
            }
        }
    }

    private static void checkKind(NodeIr node, ComponentCatalog catalog, List<Diagnostic> out) {
        String pointer = JsonPointers.node(node.id(), node.componentKey());
        switch (node.kind()) {
            case QUESTIONS -> {
                JsonNode fields = node.payload().get("fields");
                if (fields == null || !fields.isArray() || fields.isEmpty()) {
                    out.add(Diagnostic.of(DiagnosticCode.QUESTIONS_FIELDS_REQUIRED, pointer,
                        "questions node '%s' declares no fields".formatted(node.id())));
                }
            }
            case TEMPLATE -> {
                if (isEmptyTemplate(node.payload())) {
                    out.add(Diagnostic.of(DiagnosticCode.TEMPLATE_EMPTY, pointer,
                        "template node '%s' has an empty payload".formatted(node.id())));
                }
            }
            case COMPONENT, OTHER -> {
                Optional<ComponentMetadata> meta = ComponentChecks.resolve(catalog, node.componentKey());
                if (meta.isEmpty()) {
                    out.add(Diagnostic.of(DiagnosticCode.COMPONENT_NOT_FOUND, pointer,
                        "component '%s' used by node '%s' is not in the catalog".formatted(node.componentKey(), node.id())));
                    return;
                }
                ComponentChecks.checkRequiredFields(meta.get(), node.componentKey(), node.payload(), pointer, out);
                ComponentChecks.checkOperation(meta.get(), node.componentKey(), node.operation(),
                    JsonPointers.node(node.id(), NodeDocument.OPERATION), out);
            }
        }
    }

    private static boolean isEmptyTemplate(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return true;
        }
        if (payload.isTextual()) {
            if (payload.asText().isBlank()) {
                return true;
            }
            try {
                // string templates are JSON text, rendered after parsing
                return isEmptyTemplate(MAPPER.readTree(payload.asText()));
            } catch (JsonProcessingException e) {
                // not JSON: a non-empty literal, rejected as TEMPLATE_INVALID when run
                return false;
            }
        }
        return payload.isContainerNode() && payload.isEmpty();
    }

    private static void checkReachability(FlowIr flow, List<Diagnostic> out) {
        if (flow.entrypoints().isEmpty()) {
            return;
        }
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(flow.entrypoints().values());
        while (!pending.isEmpty()) {
            String id = pending.pop();
            NodeIr node = flow.nodes().get(id);
            if (node == null || !seen.add(id)) {
                continue;
            }
            for (Route route : node.routing()) {
                if (route.hasTarget()) {
                    pending.push(route.to());
                }
            }
        }
        for (String id : flow.nodes().keySet()) {
            if (!seen.contains(id)) {
                out.add(Diagnostic.of(DiagnosticCode.NODE_UNREACHABLE, JsonPointers.node(id),
                    "node '%s' is not reachable from any entrypoint".formatted(id)));
            }
        }
    }
}
