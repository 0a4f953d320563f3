package dev.flowgraph.model;

/**
 * Stable machine-readable diagnostic codes. Names are part of the wire format.
 */
public enum DiagnosticCode {

    YAML_PARSE(ErrorCategory.SCHEMA, Severity.ERROR),
    SCHEMA_INVALID(ErrorCategory.SCHEMA, Severity.ERROR),
    SCHEMA_VIOLATION(ErrorCategory.SCHEMA, Severity.ERROR),
    MISSING_COMPONENT_KEY(ErrorCategory.SCHEMA, Severity.ERROR),
    DUPLICATE_COMPONENT_KEY(ErrorCategory.SCHEMA, Severity.ERROR),
    INVALID_COMPONENT_KEY_FORMAT(ErrorCategory.SCHEMA, Severity.ERROR),

    MISSING_ENTRYPOINT(ErrorCategory.GRAPH, Severity.ERROR),
    ENTRYPOINT_MISSING(ErrorCategory.GRAPH, Severity.ERROR),
    ROUTE_TARGET_MISSING(ErrorCategory.GRAPH, Severity.ERROR),
    ANCHOR_NOT_FOUND(ErrorCategory.GRAPH, Severity.ERROR),
    DUPLICATE_NODE_ID(ErrorCategory.GRAPH, Severity.ERROR),
    NODE_UNREACHABLE(ErrorCategory.GRAPH, Severity.WARNING),

    COMPONENT_NOT_FOUND(ErrorCategory.RESOLUTION, Severity.ERROR),
    COMPONENT_PAYLOAD_REQUIRED(ErrorCategory.RESOLUTION, Severity.ERROR),
    COMPONENT_CONFIG_REQUIRED(ErrorCategory.RESOLUTION, Severity.ERROR),
    COMPONENT_OPERATION_UNKNOWN(ErrorCategory.RESOLUTION, Severity.ERROR),
    QUESTIONS_FIELDS_REQUIRED(ErrorCategory.RESOLUTION, Severity.ERROR),
    TEMPLATE_EMPTY(ErrorCategory.RESOLUTION, Severity.ERROR),

    MISSING_ANSWER(ErrorCategory.INTERPRETER, Severity.ERROR),
    NO_REACHABLE_NEXT(ErrorCategory.INTERPRETER, Severity.ERROR),
    UNSUPPORTED_CONFIG_NODE_KIND(ErrorCategory.INTERPRETER, Severity.ERROR),
    TEMPLATE_INVALID(ErrorCategory.INTERPRETER, Severity.ERROR),
    TRAVERSAL_LIMIT_EXCEEDED(ErrorCategory.INTERPRETER, Severity.ERROR);

    private final ErrorCategory category;
    private final Severity defaultSeverity;

    DiagnosticCode(ErrorCategory category, Severity defaultSeverity) {
        this.category = category;
        this.defaultSeverity = defaultSeverity;
    }

    public ErrorCategory category() {
        return category;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
