package dev.flowgraph.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for flow-graph.
 */
@Command(
    name = "flow-graph",
    mixinStandardHelpOptions = true,
    description = "Lint, edit, bundle and run flow documents.",
    subcommands = {
        LintCommand.class,
        BundleCommand.class,
        AddStepCommand.class,
        AnswersCommand.class
    }
)
public class FlowCli implements Callable<Integer> {

    /** Input was readable but the flow has errors. */
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_USAGE = 2;
    /** Input could not be read or written. */
    public static final int EXIT_IO = 3;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Error: a subcommand is required.");
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }
}
