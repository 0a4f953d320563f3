package dev.flowgraph.engine;

import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.FlowIr;
import dev.flowgraph.model.NodeDocument;
import dev.flowgraph.model.NodeIr;
import dev.flowgraph.model.NodeKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between flow documents and the typed graph. Node order is preserved both ways.
 */
public final class FlowIrMapper {

    private FlowIrMapper() {}

    /**
     * Build the graph for a loaded document. The document's start becomes the {@code start}
     * entrypoint; other named entrypoints follow in declared order.
     *
     * @throws IllegalArgumentException if a node's routing is malformed (never for loaded documents)
     */
    public static FlowIr fromDocument(FlowDocument doc) {
        var entrypoints = new LinkedHashMap<String, String>();
        String entry = doc.entryNode();
        if (entry != null) {
            entrypoints.put(FlowIr.START, entry);
        }
        for (var named : doc.entrypoints().entrySet()) {
            entrypoints.putIfAbsent(named.getKey(), named.getValue());
        }

        var nodes = new LinkedHashMap<String, NodeIr>();
        for (var node : doc.nodes().entrySet()) {
            nodes.put(node.getKey(), toNodeIr(node.getKey(), node.getValue()));
        }

        return new FlowIr(doc.id(), doc.kind(), doc.title(), doc.description(), doc.parameters(),
            doc.tags(), doc.schemaVersion(), doc.meta(), entrypoints, nodes);
    }

    /**
     * Render the graph back to a document. Routing uses the {@code out}/{@code reply}
     * shorthand only for a single unguarded terminal route.
     */
    public static FlowDocument toDocument(FlowIr ir) {
        String start = ir.startNode().orElse(null);
        var entrypoints = new LinkedHashMap<String, String>();
        for (var named : ir.entrypoints().entrySet()) {
            if (!FlowIr.START.equals(named.getKey())) {
                entrypoints.put(named.getKey(), named.getValue());
            }
        }

        Map<String, NodeDocument> nodes = new LinkedHashMap<>();
        for (NodeIr node : ir.nodes().values()) {
            nodes.put(node.id(), new NodeDocument(
                node.componentKey(),
                node.payload(),
                RoutingCodec.render(node.routing()),
                node.output(),
                node.telemetry(),
                node.packAlias(),
                node.operation()
            ));
        }

        return new FlowDocument(ir.id(), ir.kind(), ir.title(), ir.description(), start,
            ir.schemaVersion(), ir.parameters(), ir.tags(), entrypoints, ir.meta(), nodes);
    }

    private static NodeIr toNodeIr(String id, NodeDocument node) {
        return new NodeIr(
            id,
            NodeKind.classify(node.componentKey()),
            node.componentKey(),
            node.payload(),
            RoutingCodec.parse(node.routing()),
            node.output(),
            node.telemetry(),
            node.packAlias(),
            node.operation()
        );
    }
}
