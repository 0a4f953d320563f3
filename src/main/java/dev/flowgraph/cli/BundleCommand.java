package dev.flowgraph.cli;

import dev.flowgraph.engine.BundleBuilder;
import dev.flowgraph.engine.DocumentWriter;
import dev.flowgraph.model.FlowBundle;
import dev.flowgraph.model.FlowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "bundle", mixinStandardHelpOptions = true,
    description = "Print the content-addressed bundle of a flow.")
class BundleCommand extends FlowFileCommand implements Callable<Integer> {

    @Option(names = "--pin", paramLabel = "NAMESPACE.NAME=CONSTRAINT",
        description = "Version constraint for a component, e.g. --pin ai.greentic=^1.2")
    Map<String, String> pins = new LinkedHashMap<>();

    @Override
    public Integer call() {
        try {
            Optional<FlowDocument> doc = loadFlow();
            if (doc.isEmpty()) {
                return FlowCli.EXIT_INVALID;
            }
            FlowBundle bundle = BundleBuilder.build(doc.get(), pins);
            out().println(DocumentWriter.toJson(BundleBuilder.toJson(bundle)));
            return 0;
        } catch (IOException e) {
            return ioFailure(e);
        }
    }
}
