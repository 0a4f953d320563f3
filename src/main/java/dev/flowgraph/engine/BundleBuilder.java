package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowgraph.model.ComponentKey;
import dev.flowgraph.model.ComponentPin;
import dev.flowgraph.model.FlowBundle;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.NodeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds content-addressed bundles. Documents that differ only in key order or formatting get
 * the same hash.
 */
public final class BundleBuilder {

    private static final Logger log = LoggerFactory.getLogger(BundleBuilder.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private BundleBuilder() {}

    public static FlowBundle build(FlowDocument document) {
        return build(document, Map.of());
    }

    /**
     * @param explicitPins version constraints keyed by {@code namespace.name}; unlisted
     *                     components get {@link ComponentPin#ANY_VERSION}
     */
    public static FlowBundle build(FlowDocument document, Map<String, String> explicitPins) {
        JsonNode canonical = Canonicalizer.canonicalize(hashedTree(document));
        String hash = sha256Hex(Canonicalizer.canonicalBytes(canonical));
        List<ComponentPin> pins = componentPins(document, explicitPins);
        log.debug("Bundled flow '{}': hash {}, {} pins", document.id(), hash, pins.size());
        return new FlowBundle(document.id(), document.kind(), document.entryNode(), hash, pins, canonical);
    }

    /**
     * Document tree with every node's routing in its rendered form, so {@code out} and
     * {@code [{out: true}]}, or absent routing and {@code []}, hash alike.
     */
    static ObjectNode hashedTree(FlowDocument document) {
        ObjectNode tree = DocumentWriter.toTree(document);
        for (var entry : tree.get("nodes").properties()) {
            ObjectNode node = (ObjectNode) entry.getValue();
            JsonNode routing = RoutingCodec.render(RoutingCodec.parse(node.get(NodeDocument.ROUTING)));
            if (routing == null) {
                node.remove(NodeDocument.ROUTING);
            } else {
                node.set(NodeDocument.ROUTING, routing);
            }
        }
        return tree;
    }

    static List<ComponentPin> componentPins(FlowDocument document, Map<String, String> explicitPins) {
        Set<String> seen = new LinkedHashSet<>();
        var pins = new ArrayList<ComponentPin>();
        for (NodeDocument node : document.nodes().values()) {
            if (ComponentKey.isBuiltin(node.componentKey())) {
                continue;
            }
            ComponentKey.parse(node.componentKey()).ifPresent(key -> {
                if (seen.add(key.pinId())) {
                    String constraint = explicitPins.getOrDefault(key.pinId(), ComponentPin.ANY_VERSION);
                    pins.add(new ComponentPin(key.namespace(), key.name(), constraint));
                }
            });
        }
        return pins;
    }

    /** Wire shape: {@code {id, entry, hash, component_pins: [{namespace, name, version_constraint}]}}. */
    public static ObjectNode toJson(FlowBundle bundle) {
        ObjectNode root = NODES.objectNode();
        root.put("id", bundle.id());
        root.put("entry", bundle.entry());
        root.put("hash", bundle.hash());
        ArrayNode pins = root.putArray("component_pins");
        for (ComponentPin pin : bundle.componentPins()) {
            pins.addObject()
                .put("namespace", pin.namespace())
                .put("name", pin.name())
                .put("version_constraint", pin.versionConstraint());
        }
        return root;
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
