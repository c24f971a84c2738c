package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.List;
import java.util.Optional;

/**
 * Node for a value that may be absent. When unset the only choice is {@code __set}; when set the
 * value can be removed or edited. As path segments both {@code __set} and {@code __edit} address
 * the inner value.
 */
public final class OptionalNode<T> implements Node<Optional<T>> {

    static final String DEFAULT_PROMPT = "Choose an option";
    static final String ABSENT = "None";

    private final NodeFactory<T> valueFactory;
    private final String prompt;
    private Node<T> value;

    public OptionalNode(NodeFactory<T> valueFactory, NodeConfig<Optional<T>> config) {
        this.valueFactory = valueFactory;
        this.prompt = config.promptOr(DEFAULT_PROMPT);
        if (config.defaultValue() != null && config.defaultValue().isPresent()) {
            this.value = valueFactory.create(NodeConfig.withDefault(config.defaultValue().get()));
        }
    }

    public static <T> NodeFactory<Optional<T>> of(NodeFactory<T> valueFactory) {
        return config -> new OptionalNode<>(valueFactory, config);
    }

    public boolean isSet() {
        return value != null;
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        if (!path.isEmpty()) {
            inner(path).apply(input, NodePaths.rest(path));
            return;
        }
        if (input instanceof Input.Text) {
            throw ChooseException.unexpectedInputKind(input);
        }
        String choiceId = ((Input.Choice) input).choiceId();
        switch (choiceId) {
            case ReservedIds.SET -> {
                if (value != null) {
                    throw ChooseException.invalidChoice(choiceId);
                }
                value = valueFactory.create();
            }
            case ReservedIds.REMOVE -> {
                if (value == null) {
                    throw ChooseException.invalidChoice(choiceId);
                }
                value = null;
            }
            case ReservedIds.EDIT -> {
                if (value == null) {
                    throw ChooseException.invalidChoice(choiceId);
                }
            }
            default -> throw ChooseException.invalidChoice(choiceId);
        }
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        if (path.isEmpty()) {
            return List.of(value != null ? ReservedIds.EDIT : ReservedIds.SET);
        }
        return inner(path).nextInputs(NodePaths.rest(path));
    }

    @Override
    public Options options(List<String> path) {
        if (!path.isEmpty()) {
            return inner(path).options(NodePaths.rest(path));
        }
        if (value == null) {
            return Options.choices(prompt, List.of(Choice.of(ReservedIds.SET, "Set value")));
        }
        return Options.choices(prompt, List.of(
            Choice.of(ReservedIds.REMOVE, "Remove value"),
            new Choice(ReservedIds.EDIT, "Edit value", !value.isComplete())
        ));
    }

    @Override
    public DisplayNode render() {
        return value == null ? DisplayNode.value(ABSENT) : value.render();
    }

    @Override
    public Optional<Optional<T>> extract() {
        if (value == null) {
            return Optional.of(Optional.empty());
        }
        return value.extract().map(Optional::of);
    }

    private Node<T> inner(List<String> path) {
        String field = NodePaths.head(path);
        if (!ReservedIds.SET.equals(field) && !ReservedIds.EDIT.equals(field)) {
            throw NodePaths.invalidSegment("OptionalNode", path);
        }
        if (value == null) {
            throw new IllegalStateException("OptionalNode: '%s' addressed while unset".formatted(field));
        }
        return value;
    }
}
