package dev.flowgraph.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ManifestComponentCatalogTest {

    @TempDir
    Path dir;

    @Test
    void readsIdOperationsAndRequiredFields() throws IOException {
        Path manifest = write("echo.manifest.json", """
            {
              "id": "ai.greentic.echo",
              "operations": [{"name": "process"}, "preview"],
              "config_schema": {"required": ["message"]}
            }
            """);

        ManifestComponentCatalog catalog = ManifestComponentCatalog.load(List.of(manifest));

        ComponentMetadata meta = catalog.resolve("ai.greentic.echo").orElseThrow();
        assertThat(meta.operations()).containsExactlyInAnyOrder("process", "preview");
        assertThat(meta.requiredFields()).containsExactly("message");
        assertThat(catalog.resolve("ai.greentic.other")).isEmpty();
    }

    @Test
    void skipsUnreadableManifests() throws IOException {
        Path good = write("good.json", "{\"id\": \"qa.process\"}");
        Path noId = write("no-id.json", "{\"operations\": []}");
        Path broken = write("broken.json", "{ nope");
        Path missing = dir.resolve("missing.json");

        ManifestComponentCatalog catalog = ManifestComponentCatalog.load(List.of(noId, broken, missing, good));

        assertThat(catalog.size()).isEqualTo(1);
        assertThat(catalog.resolve("qa.process")).isPresent();
        assertThat(catalog.resolve("qa.process").orElseThrow().requiredFields()).isEmpty();
    }

    @Test
    void inMemoryCatalogResolvesByFullId() {
        InMemoryComponentCatalog catalog = InMemoryComponentCatalog.of(ComponentMetadata.of("qa.process", "x"));

        assertThat(catalog.resolve("qa.process")).map(ComponentMetadata::requiredFields).contains(Set.of("x"));
        assertThat(InMemoryComponentCatalog.empty().resolve("qa.process")).isEmpty();
    }

    private Path write(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }
}
