package dev.flowgraph.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Access to the flow document schema bundled on the classpath.
 */
public final class FlowSchemas {

    public static final String BUNDLED_RESOURCE = "/schemas/flow.schema.json";

    private FlowSchemas() {}

    /** Text of the bundled schema. */
    public static String bundledText() {
        return Holder.TEXT;
    }

    /** Compiled bundled schema, shared. */
    public static FlowSchemaValidator bundled() {
        return Holder.VALIDATOR;
    }

    private static final class Holder {
        static final String TEXT = readResource();
        static final FlowSchemaValidator VALIDATOR = compile(TEXT);

        private static String readResource() {
            try (InputStream in = FlowSchemas.class.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Bundled schema not found: " + BUNDLED_RESOURCE);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
            }
        }

        private static FlowSchemaValidator compile(String text) {
            try {
                return FlowSchemaValidator.compile(text);
            } catch (IOException e) {
                throw new UncheckedIOException("Bundled schema is not valid JSON", e);
            }
        }
    }
}
