package dev.flowgraph;

import dev.flowgraph.cli.FlowCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowCli()).execute(args);
        System.exit(exitCode);
    }
}
