package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.JsonPointers;
import dev.flowgraph.model.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts a node's routing between its wire form and {@link Route} lists.
 *
 * <p>Wire forms: absent or {@code null} (no routes), the scalar {@code out} or {@code reply}
 * (one terminal route), or an array of route objects with keys {@code to}, {@code out},
 * {@code reply} and {@code status}.
 */
public final class RoutingCodec {

    public static final String OUT = "out";
    public static final String REPLY = "reply";

    private static final Set<String> ROUTE_KEYS = Set.of("to", OUT, REPLY, "status");
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RoutingCodec() {}

    /**
     * Parse routing that is known to be valid.
     *
     * @throws IllegalArgumentException if the routing is malformed
     */
    public static List<Route> parse(JsonNode routing) {
        var errors = new ArrayList<Diagnostic>();
        List<Route> routes = read(routing, "/routing", errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Malformed routing: " + errors.get(0));
        }
        return routes;
    }

    /**
     * Parse routing, adding one diagnostic per malformed entry to {@code errors}. Returns the
     * routes that parsed cleanly, in order.
     */
    public static List<Route> read(JsonNode routing, String pointer, List<Diagnostic> errors) {
        var routes = new ArrayList<Route>();
        if (routing == null || routing.isNull() || routing.isMissingNode()) {
            return routes;
        }
        if (routing.isTextual()) {
            switch (routing.asText()) {
                case OUT -> routes.add(Route.outRoute());
                case REPLY -> routes.add(Route.replyRoute());
                default -> errors.add(violation(pointer,
                    "unsupported routing shorthand '%s' (expected 'out', 'reply' or a list)".formatted(routing.asText())));
            }
            return routes;
        }
        if (!routing.isArray()) {
            errors.add(violation(pointer, "routing must be a list of routes or 'out'/'reply'"));
            return routes;
        }

        for (int i = 0; i < routing.size(); i++) {
            Route route = readRoute(routing.get(i), JsonPointers.append(pointer, i), errors);
            if (route != null) {
                routes.add(route);
            }
        }
        return routes;
    }

    private static Route readRoute(JsonNode entry, String pointer, List<Diagnostic> errors) {
        if (!entry.isObject()) {
            errors.add(violation(pointer, "route must be an object"));
            return null;
        }
        int before = errors.size();
        for (var field : entry.properties()) {
            if (!ROUTE_KEYS.contains(field.getKey())) {
                errors.add(violation(JsonPointers.append(pointer, field.getKey()),
                    "unsupported routing key '%s'".formatted(field.getKey())));
            }
        }

        String to = textField(entry, "to", pointer, errors);
        String status = textField(entry, "status", pointer, errors);
        boolean out = boolField(entry, OUT, pointer, errors);
        boolean reply = boolField(entry, REPLY, pointer, errors);

        if (to == null && !out && !reply && errors.size() == before) {
            errors.add(violation(pointer, "route needs one of 'to', 'out' or 'reply'"));
        }
        return errors.size() == before ? new Route(to, out, reply, status) : null;
    }

    private static String textField(JsonNode entry, String key, String pointer, List<Diagnostic> errors) {
        JsonNode value = entry.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            errors.add(violation(JsonPointers.append(pointer, key), "'%s' must be a non-empty string".formatted(key)));
            return null;
        }
        return value.asText();
    }

    private static boolean boolField(JsonNode entry, String key, String pointer, List<Diagnostic> errors) {
        JsonNode value = entry.get(key);
        if (value == null || value.isNull()) {
            return false;
        }
        if (!value.isBoolean()) {
            errors.add(violation(JsonPointers.append(pointer, key), "'%s' must be a boolean".formatted(key)));
            return false;
        }
        return value.asBoolean();
    }

    /**
     * Render routes to their wire form. Only a lone unguarded {@code out} or {@code reply} route
     * uses the scalar shorthand; empty routing renders as {@code null}.
     */
    public static JsonNode render(List<Route> routes) {
        if (routes.isEmpty()) {
            return null;
        }
        if (routes.size() == 1 && routes.get(0).isBareOut()) {
            return TextNode.valueOf(OUT);
        }
        if (routes.size() == 1 && routes.get(0).isBareReply()) {
            return TextNode.valueOf(REPLY);
        }
        return toArray(routes);
    }

    /** Render routes as an explicit list, never as shorthand. */
    public static ArrayNode toArray(List<Route> routes) {
        ArrayNode array = NODES.arrayNode();
        for (Route route : routes) {
            array.add(toObject(route));
        }
        return array;
    }

    static ObjectNode toObject(Route route) {
        ObjectNode node = NODES.objectNode();
        if (route.to() != null) {
            node.put("to", route.to());
        }
        if (route.out()) {
            node.put(OUT, true);
        }
        if (route.reply()) {
            node.put(REPLY, true);
        }
        if (route.status() != null) {
            node.put("status", route.status());
        }
        return node;
    }

    private static Diagnostic violation(String pointer, String message) {
        return Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, pointer, message);
    }
}
