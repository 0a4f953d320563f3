package dev.flowgraph.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog built from {@code component.manifest.json} files:
 *
 * <pre>{@code
 * {
 *   "id": "ai.greentic.echo",
 *   "operations": [{"name": "process"}],
 *   "config_schema": {"required": ["message"]}
 * }
 * }</pre>
 *
 * Unreadable manifests are skipped with a warning so one broken file does not hide the rest.
 */
public final class ManifestComponentCatalog implements ComponentCatalog {

    private static final Logger log = LoggerFactory.getLogger(ManifestComponentCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InMemoryComponentCatalog delegate;

    private ManifestComponentCatalog(InMemoryComponentCatalog delegate) {
        this.delegate = delegate;
    }

    public static ManifestComponentCatalog load(List<Path> manifests) {
        var components = new ArrayList<ComponentMetadata>();
        for (Path path : manifests) {
            try {
                components.add(parseManifest(MAPPER.readTree(path.toFile())));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping component manifest {}: {}", path, e.getMessage());
            }
        }
        return new ManifestComponentCatalog(InMemoryComponentCatalog.of(components));
    }

    static ComponentMetadata parseManifest(JsonNode root) {
        JsonNode id = root.get("id");
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new IllegalArgumentException("manifest has no 'id'");
        }

        Set<String> operations = new LinkedHashSet<>();
        JsonNode ops = root.path("operations");
        for (JsonNode op : ops) {
            if (op.isTextual()) {
                operations.add(op.asText());
            } else if (op.hasNonNull("name")) {
                operations.add(op.get("name").asText());
            }
        }

        Set<String> required = new LinkedHashSet<>();
        root.path("config_schema").path("required").forEach(r -> required.add(r.asText()));

        return new ComponentMetadata(id.asText(), required, operations);
    }

    @Override
    public Optional<ComponentMetadata> resolve(String componentReference) {
        return delegate.resolve(componentReference);
    }

    public int size() {
        return delegate.size();
    }
}
