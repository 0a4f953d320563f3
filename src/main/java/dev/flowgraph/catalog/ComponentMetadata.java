package dev.flowgraph.catalog;

import java.util.Set;

/**
 * What the catalog knows about one component: the config fields a node must supply and the
 * operations it exposes. An empty {@code operations} set means operations are not declared.
 */
public record ComponentMetadata(
    String id,
    Set<String> requiredFields,
    Set<String> operations
) {

    public ComponentMetadata {
        requiredFields = Set.copyOf(requiredFields);
        operations = Set.copyOf(operations);
    }

    public static ComponentMetadata of(String id, String... requiredFields) {
        return new ComponentMetadata(id, Set.of(requiredFields), Set.of());
    }
}
