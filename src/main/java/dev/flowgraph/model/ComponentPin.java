package dev.flowgraph.model;

/**
 * A component dependency of a bundle. {@code versionConstraint} is {@code *} unless pinned.
 */
public record ComponentPin(String namespace, String name, String versionConstraint) {

    public static final String ANY_VERSION = "*";
}
