package dev.flowgraph.model;

import java.util.List;

/**
 * Result of loading a flow document from text.
 */
public sealed interface LoadResult {

    record Success(FlowDocument document) implements LoadResult {}

    record Failure(List<Diagnostic> diagnostics) implements LoadResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
