package dev.flowgraph.engine;

import dev.flowgraph.catalog.ComponentCatalog;
import dev.flowgraph.catalog.ComponentMetadata;
import dev.flowgraph.model.AddStepPlan;
import dev.flowgraph.model.AddStepResult;
import dev.flowgraph.model.AddStepSpec;
import dev.flowgraph.model.ComponentKey;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowIr;
import dev.flowgraph.model.JsonPointers;
import dev.flowgraph.model.NodeIr;
import dev.flowgraph.model.NodeKind;
import dev.flowgraph.model.PlanResult;
import dev.flowgraph.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Inserts a component node after an anchor node.
 *
 * <p>Planning checks the request in a fixed order and stops at the first failing check. Applying
 * a plan rewires the anchor to forward to the new node, which inherits the anchor's previous
 * routing unless the request supplies its own.
 */
public final class AddStepPlanner {

    /** Route target in explicit routing that is replaced by the anchor's current routes. */
    public static final String NEXT_NODE_PLACEHOLDER = "NEXT_NODE_PLACEHOLDER";

    private static final Logger log = LoggerFactory.getLogger(AddStepPlanner.class);

    private AddStepPlanner() {}

    public static PlanResult plan(FlowIr flow, AddStepSpec spec, ComponentCatalog catalog) {
        Optional<String> anchor = resolveAnchor(flow, spec.anchor());
        if (anchor.isEmpty()) {
            String message = spec.anchor() == null
                ? "flow has no nodes to insert after"
                : "anchor node '%s' not found".formatted(spec.anchor());
            return failure(DiagnosticCode.ANCHOR_NOT_FOUND, JsonPointers.of("nodes"), message);
        }
        String anchorId = anchor.get();

        if (spec.newId() == null || spec.newId().isBlank()) {
            return failure(DiagnosticCode.SCHEMA_VIOLATION, JsonPointers.of("nodes"), "new node id must not be blank");
        }
        if (flow.nodes().containsKey(spec.newId())) {
            return failure(DiagnosticCode.DUPLICATE_NODE_ID, JsonPointers.node(spec.newId()),
                "node '%s' already exists".formatted(spec.newId()));
        }

        String componentKey = spec.componentKey();
        String pointer = JsonPointers.node(spec.newId(), componentKey == null ? "" : componentKey);
        if (!ComponentKey.isWellFormed(componentKey)) {
            return failure(DiagnosticCode.INVALID_COMPONENT_KEY_FORMAT, pointer,
                "invalid component key '%s'".formatted(componentKey));
        }

        if (!ComponentKey.isBuiltin(componentKey)) {
            Optional<ComponentMetadata> meta = ComponentChecks.resolve(catalog, componentKey);
            if (meta.isEmpty()) {
                return failure(DiagnosticCode.COMPONENT_NOT_FOUND, pointer,
                    "component '%s' is not in the catalog".formatted(componentKey));
            }
            var problems = new ArrayList<Diagnostic>();
            ComponentChecks.checkRequiredFields(meta.get(), componentKey, spec.payload(), pointer, problems);
            if (problems.isEmpty()) {
                ComponentChecks.checkOperation(meta.get(), componentKey, spec.operation(),
                    JsonPointers.node(spec.newId(), "operation"), problems);
            }
            if (!problems.isEmpty()) {
                log.debug("Add-step '{}' rejected: {}", spec.newId(), problems);
                return new PlanResult.Failure(problems);
            }
        }

        NodeIr anchorNode = flow.nodes().get(anchorId);
        List<Route> priorRouting = anchorNode.routing();
        List<Route> routing = resolveRouting(spec.routing(), priorRouting);

        NodeIr newNode = new NodeIr(
            spec.newId(),
            NodeKind.classify(componentKey),
            componentKey,
            spec.payload(),
            routing,
            null,
            null,
            spec.packAlias(),
            spec.operation()
        );
        log.debug("Planned '{}' after '{}' with {} routes", spec.newId(), anchorId, routing.size());
        return new PlanResult.Success(new AddStepPlan(anchorId, newNode, priorRouting));
    }

    /**
     * Apply a plan to a flow. The input flow is not modified.
     *
     * @throws IllegalArgumentException if the plan does not fit the flow
     */
    public static FlowIr apply(FlowIr flow, AddStepPlan plan) {
        String newId = plan.newNode().id();
        if (!flow.nodes().containsKey(plan.anchor())) {
            throw new IllegalArgumentException("Anchor node not in flow: " + plan.anchor());
        }
        if (flow.nodes().containsKey(newId)) {
            throw new IllegalArgumentException("Node already in flow: " + newId);
        }

        var nodes = new LinkedHashMap<String, NodeIr>();
        for (NodeIr node : flow.nodes().values()) {
            if (node.id().equals(plan.anchor())) {
                nodes.put(node.id(), node.withRouting(List.of(Route.toNode(newId))));
                nodes.put(newId, plan.newNode());
            } else {
                nodes.put(node.id(), node);
            }
        }
        return flow.withNodes(nodes);
    }

    /**
     * Plan, apply and validate in one call. Fails with the planning diagnostics, or with the
     * validator's findings when any of them is an error.
     */
    public static AddStepResult planAndApply(FlowIr flow, AddStepSpec spec, ComponentCatalog catalog) {
        PlanResult planned = plan(flow, spec, catalog);
        if (planned instanceof PlanResult.Failure failure) {
            return new AddStepResult.Failure(failure.diagnostics());
        }
        FlowIr updated = apply(flow, ((PlanResult.Success) planned).plan());
        List<Diagnostic> diagnostics = FlowValidator.validate(updated, catalog);
        if (Diagnostic.hasErrors(diagnostics)) {
            return new AddStepResult.Failure(diagnostics);
        }
        return new AddStepResult.Success(updated, diagnostics);
    }

    private static Optional<String> resolveAnchor(FlowIr flow, String explicit) {
        if (explicit != null) {
            return flow.nodes().containsKey(explicit) ? Optional.of(explicit) : Optional.empty();
        }
        Optional<String> start = flow.startNode().filter(flow.nodes()::containsKey);
        if (start.isPresent()) {
            return start;
        }
        return flow.nodes().keySet().stream().findFirst();
    }

    private static List<Route> resolveRouting(List<Route> explicit, List<Route> anchorRouting) {
        if (explicit == null) {
            return anchorRouting;
        }
        var routing = new ArrayList<Route>();
        for (Route route : explicit) {
            if (NEXT_NODE_PLACEHOLDER.equals(route.to())) {
                routing.addAll(anchorRouting);
            } else {
                routing.add(route);
            }
        }
        return routing;
    }

    private static PlanResult failure(DiagnosticCode code, String pointer, String message) {
        log.debug("Add-step plan failed: {} {}", code, message);
        return new PlanResult.Failure(List.of(Diagnostic.of(code, pointer, message)));
    }

    /** Placeholder route for explicit routing specs. */
    public static Route placeholderRoute() {
        return Route.toNode(NEXT_NODE_PLACEHOLDER);
    }
}
