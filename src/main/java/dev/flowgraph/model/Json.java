package dev.flowgraph.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers that keep model values free of aliasing.
 */
final class Json {

    private Json() {}

    /** Deep copy; Java null stays null. */
    static JsonNode copy(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    /** Deep copy; Java null becomes JSON null. */
    static JsonNode copyOrNull(JsonNode node) {
        return node == null ? NullNode.getInstance() : node.deepCopy();
    }

    static <V> Map<String, V> orderedCopy(Map<String, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    static <T> List<T> listCopy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
