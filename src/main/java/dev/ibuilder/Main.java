package dev.ibuilder;

import dev.ibuilder.cli.InteractiveBuilderCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new InteractiveBuilderCli()).execute(args);
        System.exit(exitCode);
    }
}
