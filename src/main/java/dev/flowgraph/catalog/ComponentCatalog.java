package dev.flowgraph.catalog;

import java.util.Optional;

/**
 * Read-only lookup of component metadata supplied by the host.
 *
 * <p>Implementations must be safe for concurrent reads; the flow core never mutates a catalog.
 */
public interface ComponentCatalog {

    /**
     * Look up a component by the key used in flow documents.
     *
     * @param componentReference component key, e.g. {@code ai.greentic.echo}
     * @return metadata, or empty when the catalog does not know the component
     */
    Optional<ComponentMetadata> resolve(String componentReference);
}
