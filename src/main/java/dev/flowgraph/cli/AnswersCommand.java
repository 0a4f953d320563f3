package dev.flowgraph.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.flowgraph.engine.ConfigFlowInterpreter;
import dev.flowgraph.engine.DocumentWriter;
import dev.flowgraph.model.ConfigFlowResult;
import dev.flowgraph.model.FlowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "answers", mixinStandardHelpOptions = true,
    description = "Run a config flow against answers and print the node it produces.")
class AnswersCommand extends FlowFileCommand implements Callable<Integer> {

    @Option(names = "--answer", paramLabel = "FIELD=VALUE", description = "Answer for a questions field")
    Map<String, String> answers = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try {
            Optional<FlowDocument> doc = loadFlow();
            if (doc.isEmpty()) {
                return FlowCli.EXIT_INVALID;
            }
            var values = new LinkedHashMap<String, JsonNode>();
            answers.forEach((key, value) -> values.put(key, TextNode.valueOf(value)));

            ConfigFlowResult result = ConfigFlowInterpreter.run(doc.get(), values);
            if (result instanceof ConfigFlowResult.Failure failure) {
                report(List.of(failure.diagnostic()));
                return FlowCli.EXIT_INVALID;
            }
            var success = (ConfigFlowResult.Success) result;
            ObjectNode envelope = JsonNodeFactory.instance.objectNode();
            envelope.put("node_id", success.nodeId());
            envelope.set("node", success.node());
            out().println(DocumentWriter.toJson(envelope));
            return 0;
        } catch (IOException e) {
            return ioFailure(e);
        }
    }
}
