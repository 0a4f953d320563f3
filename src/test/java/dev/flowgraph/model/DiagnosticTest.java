package dev.flowgraph.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    @Test
    void usesCodeDefaultSeverity() {
        assertThat(Diagnostic.of(DiagnosticCode.ROUTE_TARGET_MISSING, "/x", "m").severity()).isEqualTo(Severity.ERROR);
        assertThat(Diagnostic.of(DiagnosticCode.NODE_UNREACHABLE, "/x", "m").severity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void codesBelongToCategories() {
        assertThat(DiagnosticCode.YAML_PARSE.category()).isEqualTo(ErrorCategory.SCHEMA);
        assertThat(DiagnosticCode.DUPLICATE_NODE_ID.category()).isEqualTo(ErrorCategory.GRAPH);
        assertThat(DiagnosticCode.COMPONENT_NOT_FOUND.category()).isEqualTo(ErrorCategory.RESOLUTION);
        assertThat(DiagnosticCode.MISSING_ANSWER.category()).isEqualTo(ErrorCategory.INTERPRETER);
    }

    @Test
    void onlyErrorsBlock() {
        var warning = Diagnostic.of(DiagnosticCode.NODE_UNREACHABLE, "/nodes/a", "unreachable");
        var error = Diagnostic.of(DiagnosticCode.TEMPLATE_EMPTY, "/nodes/b/template", "empty");

        assertThat(Diagnostic.hasErrors(List.of(warning))).isFalse();
        assertThat(Diagnostic.hasErrors(List.of(warning, error))).isTrue();
    }

    @Test
    void formatsForTerminal() {
        assertThat(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, null, "document is empty"))
            .hasToString("ERROR SCHEMA_VIOLATION /: document is empty");
    }

    @Test
    void escapesPointerSegments() {
        assertThat(JsonPointers.node("a/b", "x~y", 0)).isEqualTo("/nodes/a~1b/x~0y/0");
    }
}
