package dev.flowgraph.model;

/**
 * Builds RFC 6901 JSON Pointers from path segments.
 */
public final class JsonPointers {

    private JsonPointers() {}

    public static String of(Object... segments) {
        var sb = new StringBuilder();
        for (Object segment : segments) {
            sb.append('/').append(escape(String.valueOf(segment)));
        }
        return sb.toString();
    }

    public static String node(String nodeId, Object... rest) {
        var sb = new StringBuilder(of("nodes", nodeId));
        if (rest.length > 0) {
            sb.append(of(rest));
        }
        return sb.toString();
    }

    public static String append(String base, Object segment) {
        return base + "/" + escape(String.valueOf(segment));
    }

    static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }
}
