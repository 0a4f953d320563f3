package dev.flowgraph.engine;

import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.FlowIr;
import dev.flowgraph.model.LoadResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Loading helpers for tests.
 */
final class TestFlows {

    private TestFlows() {}

    static FlowDocument load(String yaml) {
        LoadResult result = FlowLoader.load(yaml);
        assertThat(result).isInstanceOf(LoadResult.Success.class);
        return ((LoadResult.Success) result).document();
    }

    static FlowIr ir(String yaml) {
        return FlowIrMapper.fromDocument(load(yaml));
    }

    static String resource(String name) {
        try (InputStream in = TestFlows.class.getResourceAsStream("/flows/" + name)) {
            assertThat(in).as("test resource %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
