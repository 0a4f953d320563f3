package dev.flowgraph.model;

public enum Severity {
    ERROR,
    WARNING
}
