package dev.flowgraph.cli;

import dev.flowgraph.catalog.ComponentCatalog;
import dev.flowgraph.catalog.InMemoryComponentCatalog;
import dev.flowgraph.catalog.ManifestComponentCatalog;
import dev.flowgraph.engine.FlowLoader;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.FlowDocument;
import dev.flowgraph.model.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared plumbing for subcommands that read one flow file.
 */
abstract class FlowFileCommand {

    private static final Logger log = LoggerFactory.getLogger(FlowFileCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Flow document (YAML or JSON)")
    Path file;

    @Option(names = "--json", description = "Print diagnostics as JSON")
    boolean json;

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /** Load the flow, printing diagnostics on failure. Empty when the caller should exit. */
    Optional<FlowDocument> loadFlow() throws IOException {
        LoadResult result = FlowLoader.loadFromFile(file);
        if (result instanceof LoadResult.Success success) {
            return Optional.of(success.document());
        }
        List<Diagnostic> diagnostics = ((LoadResult.Failure) result).diagnostics();
        log.warn("Failed to load flow {}: {} diagnostics", file, diagnostics.size());
        report(diagnostics);
        return Optional.empty();
    }

    void report(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        PrintWriter target = json ? out() : err();
        target.print(DiagnosticFormatter.format(diagnostics, json));
        target.flush();
    }

    static ComponentCatalog catalog(List<Path> manifests) {
        return manifests == null || manifests.isEmpty()
            ? InMemoryComponentCatalog.empty()
            : ManifestComponentCatalog.load(new ArrayList<>(manifests));
    }

    int ioFailure(IOException e) {
        log.warn("I/O failure on {}", file, e);
        err().println("Error: " + e.getMessage());
        return FlowCli.EXIT_IO;
    }
}
