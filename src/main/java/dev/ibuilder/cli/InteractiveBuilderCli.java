package dev.ibuilder.cli;

import ch.qos.logback.classic.Level;
import dev.ibuilder.cli.demo.Demo;
import dev.ibuilder.engine.InteractiveBuilder;
import dev.ibuilder.io.InputScriptLoader;
import dev.ibuilder.model.Input;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry point: builds one of the demo types interactively on the console.
 */
@Command(
    name = "interactive-builder",
    mixinStandardHelpOptions = true,
    description = "Build a value step by step by choosing from menus and typing values."
)
public class InteractiveBuilderCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InteractiveBuilderCli.class);

    @Option(names = "--demo", defaultValue = "EXAMPLE",
        description = "Type to build: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Demo demo;

    @Option(names = "--script", description = "Replay the inputs of a JSON script instead of reading stdin")
    private Path script;

    @Option(names = "--json", description = "Show the current tree as JSON instead of text")
    private boolean json;

    @Option(names = "--verbose", description = "Log navigation and rejected inputs")
    private boolean verbose;

    private final PrintStream out;
    private final BufferedReader in;

    public InteractiveBuilderCli() {
        this(System.out, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    InteractiveBuilderCli(PrintStream out, BufferedReader in) {
        this.out = out;
        this.in = in;
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.ibuilder")).setLevel(Level.DEBUG);
        }
        log.debug("Starting session for demo {}", demo);
        return run(InteractiveBuilder.of(demo.factory()));
    }

    private <T> int run(InteractiveBuilder<T> builder) throws IOException {
        var session = new ConsoleSession<>(builder, out, json);
        Optional<T> value;
        if (script != null) {
            List<Input> inputs = InputScriptLoader.loadFromFile(script);
            value = session.replay(inputs);
        } else {
            value = session.run(in);
        }

        if (value.isEmpty()) {
            out.println("Session ended before the value was complete.");
            return 1;
        }
        out.println();
        out.println("Result: " + value.get());
        return 0;
    }
}
