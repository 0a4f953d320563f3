package dev.flowgraph.cli;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.flowgraph.engine.DocumentWriter;
import dev.flowgraph.model.Diagnostic;

import java.util.List;
import java.util.Locale;

/**
 * Renders diagnostics for terminal or machine consumption.
 */
public final class DiagnosticFormatter {

    private DiagnosticFormatter() {}

    /** One diagnostic per line: {@code SEVERITY CODE pointer: message}. */
    public static String text(List<Diagnostic> diagnostics) {
        var sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }

    /** JSON list of {@code {code, pointer, severity, message}}. */
    public static ArrayNode toJson(List<Diagnostic> diagnostics) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (Diagnostic d : diagnostics) {
            array.addObject()
                .put("code", d.code().name())
                .put("pointer", d.pointer())
                .put("severity", d.severity().name().toLowerCase(Locale.ROOT))
                .put("message", d.message());
        }
        return array;
    }

    public static String format(List<Diagnostic> diagnostics, boolean json) {
        return json ? DocumentWriter.toJson(toJson(diagnostics)) + "\n" : text(diagnostics);
    }
}
