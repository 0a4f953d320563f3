package dev.flowgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FlowCliTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String FLOW = """
        id: cli-flow
        type: messaging
        start: start
        nodes:
          start:
            ai.greentic.echo:
              message: hi
            routing:
              - to: end
          end:
            qa.process: {}
            routing: out
        """;

    private static final String CONFIG_FLOW = """
        id: cfg
        type: component-config
        start: ask
        nodes:
          ask:
            questions:
              fields:
                - id: name
            routing:
              - to: emit
          emit:
            template:
              greeting: "{{state.name}}"
        """;

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void lintPassesValidFlow() throws IOException {
        int code = run("lint", write("flow.yaml", FLOW).toString());

        assertThat(code).isZero();
        assertThat(out.toString()).startsWith("OK ");
    }

    @Test
    void lintFailsOnLoadErrors() throws IOException {
        Path file = write("bad.yaml", FLOW.replace("- to: end", "- to: nowhere"));

        int code = run("lint", file.toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_INVALID);
        assertThat(err.toString()).contains("ROUTE_TARGET_MISSING", "/nodes/start/routing/0/to");
    }

    @Test
    void lintPrintsJsonDiagnostics() throws IOException {
        Path file = write("bad.yaml", FLOW.replace("- to: end", "- to: nowhere"));

        int code = run("lint", "--json", file.toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_INVALID);
        JsonNode diagnostics = MAPPER.readTree(out.toString());
        assertThat(diagnostics.get(0).get("code").asText()).isEqualTo("ROUTE_TARGET_MISSING");
        assertThat(diagnostics.get(0).get("severity").asText()).isEqualTo("error");
    }

    @Test
    void lintUsesCatalogWhenGiven() throws IOException {
        Path flow = write("flow.yaml", FLOW);
        Path manifest = write("echo.json", """
            {"id": "ai.greentic.echo", "config_schema": {"required": ["message", "level"]}}
            """);

        int code = run("lint", flow.toString(), "--catalog", manifest.toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_INVALID);
        assertThat(err.toString()).contains("COMPONENT_CONFIG_REQUIRED", "COMPONENT_NOT_FOUND");
    }

    @Test
    void missingFileIsIoError() {
        int code = run("lint", dir.resolve("absent.yaml").toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_IO);
    }

    @Test
    void bundlePrintsWireShape() throws IOException {
        int code = run("bundle", write("flow.yaml", FLOW).toString(), "--pin", "qa.process=^2");

        assertThat(code).isZero();
        JsonNode bundle = MAPPER.readTree(out.toString());
        assertThat(bundle.get("id").asText()).isEqualTo("cli-flow");
        assertThat(bundle.get("entry").asText()).isEqualTo("start");
        assertThat(bundle.get("hash").asText()).hasSize(64);
        assertThat(bundle.get("component_pins").get(1).get("version_constraint").asText()).isEqualTo("^2");
    }

    @Test
    void addStepWritesUpdatedFlow() throws IOException {
        Path flow = write("flow.yaml", FLOW);
        Path manifest = write("catalog.json", "{\"id\": \"ai.greentic.echo\", \"config_schema\": {\"required\": [\"message\"]}}");
        Path qa = write("qa.json", "{\"id\": \"qa.process\"}");
        Path target = dir.resolve("out.yaml");

        int code = run("add-step", flow.toString(), "--id", "greet", "--component", "ai.greentic.echo",
            "--after", "start", "--payload", "{\"message\": \"hello\"}",
            "--catalog", manifest.toString(), "--catalog", qa.toString(), "--out", target.toString());

        assertThat(code).isZero();
        JsonNode written = new ObjectMapper(new YAMLFactory()).readTree(target.toFile());
        assertThat(written.get("nodes").get("start").get("routing").get(0).get("to").asText()).isEqualTo("greet");
        assertThat(written.get("nodes").get("greet").get("routing").get(0).get("to").asText()).isEqualTo("end");
    }

    @Test
    void addStepRejectsDuplicateId() throws IOException {
        Path flow = write("flow.yaml", FLOW);
        Path qa = write("qa.json", "{\"id\": \"qa.process\"}");

        int code = run("add-step", flow.toString(), "--id", "end", "--component", "qa.process",
            "--catalog", qa.toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_INVALID);
        assertThat(err.toString()).contains("DUPLICATE_NODE_ID");
    }

    @Test
    void answersPrintsMaterializedNode() throws IOException {
        int code = run("answers", write("cfg.yaml", CONFIG_FLOW).toString(), "--answer", "name=Ada");

        assertThat(code).isZero();
        JsonNode result = MAPPER.readTree(out.toString());
        assertThat(result.get("node_id").asText()).isEqualTo("emit");
        assertThat(result.get("node").get("greeting").asText()).isEqualTo("Ada");
    }

    @Test
    void answersReportsMissingAnswer() throws IOException {
        int code = run("answers", write("cfg.yaml", CONFIG_FLOW).toString());

        assertThat(code).isEqualTo(FlowCli.EXIT_INVALID);
        assertThat(err.toString()).contains("MISSING_ANSWER", "'name'");
    }

    @Test
    void noSubcommandIsUsageError() {
        assertThat(run()).isEqualTo(FlowCli.EXIT_USAGE);
    }

    private int run(String... args) {
        CommandLine cli = new CommandLine(new FlowCli());
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }
}
