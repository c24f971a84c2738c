package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.List;
import java.util.Optional;

/**
 * Leaf node for booleans: no free text, just the two choices {@code true} and {@code false}.
 */
public final class BooleanNode implements Node<Boolean> {

    static final String DEFAULT_PROMPT = "True or false?";

    private final String prompt;
    private Boolean value;

    public BooleanNode(NodeConfig<Boolean> config) {
        this.prompt = config.promptOr(DEFAULT_PROMPT);
        this.value = config.defaultValue();
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        NodePaths.requireEmpty(path, "BooleanNode.apply()");
        if (input instanceof Input.Text) {
            throw ChooseException.unexpectedInputKind(input);
        }
        String choiceId = ((Input.Choice) input).choiceId();
        switch (choiceId) {
            case "true" -> value = true;
            case "false" -> value = false;
            default -> throw ChooseException.invalidChoice(choiceId);
        }
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        return List.of();
    }

    @Override
    public Options options(List<String> path) {
        NodePaths.requireEmpty(path, "BooleanNode.options()");
        return Options.choices(prompt, List.of(Choice.of("true", "true"), Choice.of("false", "false")));
    }

    @Override
    public DisplayNode render() {
        return value == null ? DisplayNode.missing() : DisplayNode.value(value.toString());
    }

    @Override
    public Optional<Boolean> extract() {
        return Optional.ofNullable(value);
    }
}
