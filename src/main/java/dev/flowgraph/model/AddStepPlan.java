package dev.flowgraph.model;

import java.util.List;

/**
 * Resolved effect of an {@link AddStepSpec}: where the node goes and what it routes to.
 */
public record AddStepPlan(
    String anchor,
    NodeIr newNode,
    List<Route> anchorPriorRouting
) {

    public AddStepPlan {
        anchorPriorRouting = List.copyOf(anchorPriorRouting);
    }
}
