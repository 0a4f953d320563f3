package dev.flowgraph.model;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed form of a node's component key. {@code <namespace>.<name>.<operation...>}: everything
 * after the second dot is the operation, kept verbatim even when it contains dots.
 */
public record ComponentKey(
    String namespace,
    String name,
    String operation // nullable, two-segment keys such as "qa.process" carry no operation
) {

    public static final String QUESTIONS = "questions";
    public static final String TEMPLATE = "template";
    public static final Set<String> BUILTINS = Set.of(QUESTIONS, TEMPLATE);

    private static final Pattern NAMESPACED = Pattern.compile("^[A-Za-z][\\w-]*(\\.[\\w-]+)+$");

    public static boolean isBuiltin(String key) {
        return BUILTINS.contains(key);
    }

    public static boolean isNamespaced(String key) {
        return key != null && NAMESPACED.matcher(key).matches();
    }

    /** Keys a flow document may use: a builtin or a namespaced component reference. */
    public static boolean isWellFormed(String key) {
        return isBuiltin(key) || isNamespaced(key);
    }

    public static Optional<ComponentKey> parse(String key) {
        if (!isNamespaced(key)) {
            return Optional.empty();
        }
        String[] parts = key.split("\\.", 3);
        String operation = parts.length == 3 ? parts[2] : null;
        return Optional.of(new ComponentKey(parts[0], parts[1], operation));
    }

    /** The {@code namespace.name} pair used for pinning. */
    public String pinId() {
        return namespace + "." + name;
    }
}
