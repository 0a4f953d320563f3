package dev.flowgraph.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowgraph.catalog.ComponentCatalog;
import dev.flowgraph.catalog.ComponentMetadata;
import dev.flowgraph.model.ComponentKey;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.JsonPointers;

import java.util.List;
import java.util.Optional;

/**
 * Catalog checks shared by the planner and the validator.
 */
final class ComponentChecks {

    private ComponentChecks() {}

    /**
     * Resolve by the full key first, then by {@code namespace.name} for keys that carry an
     * operation segment.
     */
    static Optional<ComponentMetadata> resolve(ComponentCatalog catalog, String componentKey) {
        Optional<ComponentMetadata> direct = catalog.resolve(componentKey);
        if (direct.isPresent()) {
            return direct;
        }
        return ComponentKey.parse(componentKey)
            .filter(key -> key.operation() != null)
            .flatMap(key -> catalog.resolve(key.pinId()));
    }

    /**
     * Check a payload against the component's required fields. A missing payload reports once;
     * otherwise every absent field reports on its own.
     */
    static void checkRequiredFields(ComponentMetadata meta, String componentKey, JsonNode payload,
                                    String pointer, List<Diagnostic> out) {
        if (meta.requiredFields().isEmpty()) {
            return;
        }
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            out.add(Diagnostic.of(DiagnosticCode.COMPONENT_PAYLOAD_REQUIRED, pointer,
                "component '%s' requires a payload with fields %s"
                    .formatted(componentKey, meta.requiredFields().stream().sorted().toList())));
            return;
        }
        for (String field : meta.requiredFields().stream().sorted().toList()) {
            if (!payload.has(field)) {
                out.add(Diagnostic.of(DiagnosticCode.COMPONENT_CONFIG_REQUIRED, JsonPointers.append(pointer, field),
                    "component '%s' requires config field '%s'".formatted(componentKey, field)));
            }
        }
    }

    /** Operations are only checked against catalogs that declare some. */
    static void checkOperation(ComponentMetadata meta, String componentKey, String operation,
                               String pointer, List<Diagnostic> out) {
        if (operation == null || meta.operations().isEmpty() || meta.operations().contains(operation)) {
            return;
        }
        out.add(Diagnostic.of(DiagnosticCode.COMPONENT_OPERATION_UNKNOWN, pointer,
            "component '%s' has no operation '%s' (known: %s)"
                .formatted(componentKey, operation, meta.operations().stream().sorted().toList())));
    }
}
