package dev.flowgraph.model;

/**
 * Closed set of node kinds. Call sites switch over it exhaustively.
 */
public enum NodeKind {
    COMPONENT,
    QUESTIONS,
    TEMPLATE,
    OTHER;

    public static NodeKind classify(String componentKey) {
        if (ComponentKey.QUESTIONS.equals(componentKey)) {
            return QUESTIONS;
        }
        if (ComponentKey.TEMPLATE.equals(componentKey)) {
            return TEMPLATE;
        }
        if (ComponentKey.isNamespaced(componentKey)) {
            return COMPONENT;
        }
        return OTHER;
    }
}
