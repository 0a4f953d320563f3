package dev.flowgraph.model;

import java.util.List;

/**
 * Result of planning an insertion.
 */
public sealed interface PlanResult {

    record Success(AddStepPlan plan) implements PlanResult {}

    record Failure(List<Diagnostic> diagnostics) implements PlanResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
