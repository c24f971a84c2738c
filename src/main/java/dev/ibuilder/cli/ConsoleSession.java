package dev.ibuilder.cli;

import dev.ibuilder.display.DisplayNodeJson;
import dev.ibuilder.display.TreePrinter;
import dev.ibuilder.engine.InteractiveBuilder;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Drives an {@link InteractiveBuilder} from a text console: shows the tree and the menu, reads one
 * line, and repeats until the value is built.
 *
 * <p>A line starting with {@code >} is sent as text (without the {@code >}), any other line as the
 * id of a choice.
 */
public final class ConsoleSession<T> {

    private final InteractiveBuilder<T> builder;
    private final PrintStream out;
    private final boolean json;

    public ConsoleSession(InteractiveBuilder<T> builder, PrintStream out, boolean json) {
        this.builder = builder;
        this.out = out;
        this.json = json;
    }

    /**
     * Read the inputs from {@code in} until the value is built.
     *
     * @return the value, or empty if the input ended first
     */
    public Optional<T> run(BufferedReader in) throws IOException {
        while (true) {
            printState();
            String line = in.readLine();
            if (line == null) {
                return Optional.empty();
            }
            Optional<T> value = submit(parseLine(line));
            if (value.isPresent()) {
                return value;
            }
        }
    }

    /**
     * Send the inputs of a script, in order, until the value is built.
     *
     * @return the value, or empty if the script ended first
     */
    public Optional<T> replay(List<Input> inputs) {
        Iterator<Input> it = inputs.iterator();
        while (it.hasNext()) {
            printState();
            Input input = it.next();
            out.println("> " + describe(input));
            Optional<T> value = submit(input);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    static Input parseLine(String line) {
        if (line.startsWith(">")) {
            return new Input.Text(line.substring(1));
        }
        return new Input.Choice(line.trim());
    }

    private Optional<T> submit(Input input) {
        try {
            return builder.choose(input);
        } catch (ChooseException e) {
            out.println();
            out.println(e.getMessage());
            out.println();
            return Optional.empty();
        }
    }

    private void printState() {
        out.println();
        out.print(json ? DisplayNodeJson.toPrettyString(builder.render()) + "\n" : TreePrinter.print(builder.render()));
        Options options = builder.options();
        out.println();
        out.println("?: " + options.query());
        for (Choice choice : options.choices()) {
            out.printf("- %s%s (%s)%n", choice.text(), choice.needsAction() ? "*" : "", choice.choiceId());
        }
        if (options.textInput()) {
            out.println("- textual input (> followed by the content)");
        }
    }

    private static String describe(Input input) {
        if (input instanceof Input.Text text) {
            return ">" + text.text();
        }
        return ((Input.Choice) input).choiceId();
    }
}
