package dev.flowgraph.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowgraph.engine.AddStepPlanner;
import dev.flowgraph.engine.DocumentWriter;
import dev.flowgraph.engine.FlowIrMapper;
import dev.flowgraph.engine.RoutingCodec;
import dev.flowgraph.model.AddStepResult;
import dev.flowgraph.model.AddStepSpec;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.Route;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "add-step", mixinStandardHelpOptions = true,
    description = "Insert a component node after an anchor node and print the updated flow.")
class AddStepCommand extends FlowFileCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Option(names = "--id", required = true, description = "Id of the new node")
    String newId;

    @Option(names = "--component", required = true, description = "Component key, e.g. ai.greentic.echo")
    String component;

    @Option(names = "--after", description = "Anchor node (default: the start node)")
    String anchor;

    @Option(names = "--payload", description = "Component config as JSON")
    String payload;

    @Option(names = "--routing", description = "Routing as JSON; may use " + AddStepPlanner.NEXT_NODE_PLACEHOLDER)
    String routing;

    @Option(names = "--operation", description = "Component operation")
    String operation;

    @Option(names = "--pack-alias", description = "Pack alias of the component")
    String packAlias;

    @Option(names = "--catalog", paramLabel = "MANIFEST", description = "component.manifest.json files")
    List<Path> catalog;

    @Option(names = "--out", description = "Write the updated flow here instead of stdout")
    Path outFile;

    @Override
    public Integer call() {
        try {
            Optional<FlowDocument> doc = loadFlow();
            if (doc.isEmpty()) {
                return FlowCli.EXIT_INVALID;
            }

            var problems = new ArrayList<Diagnostic>();
            JsonNode payloadNode = parseJson(payload, "/payload", problems);
            List<Route> routes = null;
            JsonNode routingNode = parseJson(routing, "/routing", problems);
            if (routingNode != null) {
                routes = RoutingCodec.read(routingNode, "/routing", problems);
            }
            if (!problems.isEmpty()) {
                report(problems);
                return FlowCli.EXIT_INVALID;
            }

            var spec = new AddStepSpec(newId, anchor, component, payloadNode, routes, packAlias, operation);
            AddStepResult result = AddStepPlanner.planAndApply(FlowIrMapper.fromDocument(doc.get()), spec, catalog(catalog));
            if (result instanceof AddStepResult.Failure failure) {
                report(failure.diagnostics());
                return FlowCli.EXIT_INVALID;
            }

            var success = (AddStepResult.Success) result;
            report(success.warnings());
            String yaml = DocumentWriter.toYaml(FlowIrMapper.toDocument(success.flow()));
            if (outFile != null) {
                Files.writeString(outFile, yaml, StandardCharsets.UTF_8);
            } else {
                out().print(yaml);
                out().flush();
            }
            return 0;
        } catch (IOException e) {
            return ioFailure(e);
        }
    }

    private static JsonNode parseJson(String text, String pointer, List<Diagnostic> problems) {
        if (text == null) {
            return null;
        }
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            problems.add(Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, pointer,
                "not valid JSON: " + e.getOriginalMessage()));
            return null;
        }
    }
}
