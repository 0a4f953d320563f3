package dev.flowgraph.catalog;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable catalog seeded programmatically.
 */
public final class InMemoryComponentCatalog implements ComponentCatalog {

    private final Map<String, ComponentMetadata> entries;

    private InMemoryComponentCatalog(Map<String, ComponentMetadata> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static InMemoryComponentCatalog of(ComponentMetadata... components) {
        return of(List.of(components));
    }

    public static InMemoryComponentCatalog of(Collection<ComponentMetadata> components) {
        var entries = new LinkedHashMap<String, ComponentMetadata>();
        for (ComponentMetadata meta : components) {
            entries.put(meta.id(), meta);
        }
        return new InMemoryComponentCatalog(entries);
    }

    public static InMemoryComponentCatalog empty() {
        return new InMemoryComponentCatalog(Map.of());
    }

    @Override
    public Optional<ComponentMetadata> resolve(String componentReference) {
        return Optional.ofNullable(entries.get(componentReference));
    }

    public int size() {
        return entries.size();
    }
}
