package dev.flowgraph.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentKeyTest {

    @Test
    void keepsDottedOperationVerbatim() {
        ComponentKey key = ComponentKey.parse("ai.greentic.http.get.v2").orElseThrow();

        assertThat(key.namespace()).isEqualTo("ai");
        assertThat(key.name()).isEqualTo("greentic");
        assertThat(key.operation()).isEqualTo("http.get.v2");
        assertThat(key.pinId()).isEqualTo("ai.greentic");
    }

    @Test
    void twoSegmentKeyHasNoOperation() {
        ComponentKey key = ComponentKey.parse("qa.process").orElseThrow();

        assertThat(key.operation()).isNull();
    }

    @Test
    void builtinsAreWellFormedButNotNamespaced() {
        assertThat(ComponentKey.isWellFormed("questions")).isTrue();
        assertThat(ComponentKey.isWellFormed("template")).isTrue();
        assertThat(ComponentKey.parse("questions")).isEmpty();
    }

    @Test
    void rejectsMalformedKeys() {
        assertThat(ComponentKey.isWellFormed("echo")).isFalse();
        assertThat(ComponentKey.isWellFormed("1ai.echo")).isFalse();
        assertThat(ComponentKey.isWellFormed("ai.")).isFalse();
        assertThat(ComponentKey.isWellFormed("ai echo.x")).isFalse();
        assertThat(ComponentKey.isWellFormed("ai..echo")).isFalse();
        assertThat(ComponentKey.isWellFormed("ai.echo.")).isFalse();
        assertThat(ComponentKey.parse("ai..echo")).isEmpty();
        assertThat(ComponentKey.isWellFormed(null)).isFalse();
    }
}
