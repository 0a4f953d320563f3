package dev.flowgraph.model;

import java.util.Collection;
import java.util.Objects;

/**
 * A located finding about a flow. {@code pointer} is a JSON Pointer into the flow document,
 * e.g. {@code /nodes/start/routing/0/to}.
 */
public record Diagnostic(
    DiagnosticCode code,
    String pointer,
    Severity severity,
    String message
) {

    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(severity, "severity");
        pointer = pointer == null ? "" : pointer;
    }

    /** Diagnostic with the code's default severity. */
    public static Diagnostic of(DiagnosticCode code, String pointer, String message) {
        return new Diagnostic(code, pointer, code.defaultSeverity(), message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public static boolean hasErrors(Collection<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    @Override
    public String toString() {
        return "%s %s %s: %s".formatted(severity, code, pointer.isEmpty() ? "/" : pointer, message);
    }
}
