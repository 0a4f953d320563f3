package dev.flowgraph.cli;

import dev.flowgraph.engine.FlowIrMapper;
import dev.flowgraph.engine.FlowValidator;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.FlowDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "lint", mixinStandardHelpOptions = true,
    description = "Load and validate a flow. Exits 1 when any error is found.")
class LintCommand extends FlowFileCommand implements Callable<Integer> {

    @Option(names = "--catalog", paramLabel = "MANIFEST",
        description = "component.manifest.json files; without any, catalog lookups are skipped")
    List<Path> catalog;

    @Override
    public Integer call() {
        try {
            Optional<FlowDocument> doc = loadFlow();
            if (doc.isEmpty()) {
                return FlowCli.EXIT_INVALID;
            }
            List<Diagnostic> diagnostics = FlowValidator.validate(FlowIrMapper.fromDocument(doc.get()), catalog(catalog));
            if (catalog == null || catalog.isEmpty()) {
                diagnostics = diagnostics.stream()
                    .filter(d -> d.code() != DiagnosticCode.COMPONENT_NOT_FOUND)
                    .toList();
            }
            if (json && diagnostics.isEmpty()) {
                out().println("[]");
            }
            report(diagnostics);
            if (FlowValidator.hasErrors(diagnostics)) {
                return FlowCli.EXIT_INVALID;
            }
            if (!json) {
                out().println("OK " + file);
            }
            return 0;
        } catch (IOException e) {
            return ioFailure(e);
        }
    }
}
