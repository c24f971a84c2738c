package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.time.DateTimeException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Leaf node holding a value parsed from free text: numbers, strings, chars and paths.
 */
public final class ScalarNode<T> implements Node<T> {

    /**
     * Converts the text typed by the user. Conversion failures are reported with an
     * {@link IllegalArgumentException} (e.g. {@link NumberFormatException}) or, for
     * {@code java.time} parsers, a {@link DateTimeException}; the message is shown to the user.
     */
    @FunctionalInterface
    public interface Parser<T> {
        T parse(String text);
    }

    private final Parser<T> parser;
    private final Function<T, String> formatter;
    private final String prompt;
    private T value;

    public ScalarNode(Parser<T> parser, Function<T, String> formatter, String prompt, T defaultValue) {
        this.parser = parser;
        this.formatter = formatter;
        this.prompt = prompt;
        this.value = defaultValue;
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        NodePaths.requireEmpty(path, "ScalarNode.apply()");
        if (!(input instanceof Input.Text textInput)) {
            throw ChooseException.unexpectedInputKind(input);
        }
        String text = textInput.text();
        try {
            value = parser.parse(text);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw ChooseException.invalidText(String.valueOf(e.getMessage()));
        }
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        return List.of();
    }

    @Override
    public Options options(List<String> path) {
        NodePaths.requireEmpty(path, "ScalarNode.options()");
        return Options.text(prompt);
    }

    @Override
    public DisplayNode render() {
        return value == null ? DisplayNode.missing() : DisplayNode.value(formatter.apply(value));
    }

    @Override
    public Optional<T> extract() {
        return Optional.ofNullable(value);
    }
}
