package dev.flowgraph.model;

/**
 * Families of failures a flow operation can report.
 */
public enum ErrorCategory {

    /** Parse and structural failures while loading a document. */
    SCHEMA,

    /** Topology failures: missing anchors, dangling routes, duplicate ids. */
    GRAPH,

    /** Catalog misses and missing required component fields. */
    RESOLUTION,

    /** Config-flow evaluation failures. */
    INTERPRETER
}
