package dev.flowgraph.model;

import java.util.List;

/**
 * Result of planning, applying and validating an insertion in one call.
 */
public sealed interface AddStepResult {

    /** The edited flow, with any warning-level diagnostics found on it. */
    record Success(FlowIr flow, List<Diagnostic> warnings) implements AddStepResult {
        public Success {
            warnings = List.copyOf(warnings);
        }
    }

    record Failure(List<Diagnostic> diagnostics) implements AddStepResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
