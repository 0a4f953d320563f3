package dev.flowgraph.model;

/**
 * A routing edge leaving a node. A route forwards to another node ({@code to}), ends the flow
 * ({@code out}) or replies to the origin ({@code reply}); any form may carry a {@code status}
 * guard. A node's routes are matched in declaration order.
 */
public record Route(
    String to,      // nullable, no target for terminal routes
    boolean out,
    boolean reply,
    String status   // nullable, unguarded
) {

    public static Route toNode(String nodeId) {
        return new Route(nodeId, false, false, null);
    }

    public static Route outRoute() {
        return new Route(null, true, false, null);
    }

    public static Route replyRoute() {
        return new Route(null, false, true, null);
    }

    public Route withStatus(String guard) {
        return new Route(to, out, reply, guard);
    }

    public boolean hasTarget() {
        return to != null;
    }

    public boolean isGuarded() {
        return status != null;
    }

    /** True for exactly {@code {out: true}}: no target, no reply, no guard. */
    public boolean isBareOut() {
        return out && to == null && !reply && status == null;
    }

    /** True for exactly {@code {reply: true}}: no target, no out, no guard. */
    public boolean isBareReply() {
        return reply && to == null && !out && status == null;
    }
}
