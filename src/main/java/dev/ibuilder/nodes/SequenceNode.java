package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayEntry;
import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Node for a growable list of elements, all built by the same element factory.
 *
 * <p>The node handles insertions, deletions and updates with this state machine:
 *
 * <pre>
 *                  |
 *                  v
 *             +-------------+    __new    +-------------+  element specific
 *   +-------> |  empty      | ----------> | not empty   | ------>>>
 *   |         |  main       |             | edit        |
 *   |         +-------------+             +-------------+
 *   |                                         ^    |
 *   |                                         |    |
 *   |         +-------------+  index / __new  |    | __back
 *   +-------> |  not empty  | ----------------+    |
 *   |         |  main       | &lt;--------------------+
 *   | index   +-------------+
 *   |            ^    |
 *   |     __back |    | __remove
 *   |            |    v
 *   |         +-------------+
 *   +-------- |  not empty  |
 *             |  remove     |
 *             +-------------+
 * </pre>
 *
 * Applying {@code __new} appends an element at the end; as a path segment {@code __new} refers to
 * the last element, so the caller does not need to know the index of the element just created.
 */
public final class SequenceNode<T> implements Node<List<T>> {

    static final String DEFAULT_PROMPT = "Select an action";
    static final String REMOVE_PROMPT = "Select the item to remove";

    private final NodeFactory<T> elementFactory;
    private final String prompt;
    private final List<Node<T>> items = new ArrayList<>();

    public SequenceNode(NodeFactory<T> elementFactory, NodeConfig<List<T>> config) {
        this.elementFactory = elementFactory;
        this.prompt = config.promptOr(DEFAULT_PROMPT);
        if (config.defaultValue() != null) {
            for (T item : config.defaultValue()) {
                items.add(elementFactory.create(NodeConfig.withDefault(item)));
            }
        }
    }

    public static <T> NodeFactory<List<T>> of(NodeFactory<T> elementFactory) {
        return config -> new SequenceNode<>(elementFactory, config);
    }

    public int size() {
        return items.size();
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        if (path.isEmpty()) {
            applyMainMenu(input);
            return;
        }
        String field = NodePaths.head(path);
        List<String> rest = NodePaths.rest(path);
        switch (field) {
            case ReservedIds.REMOVE -> {
                NodePaths.requireEmpty(rest, "SequenceNode.apply() in remove menu");
                if (input instanceof Input.Text) {
                    throw ChooseException.unexpectedInputKind(input);
                }
                String choiceId = ((Input.Choice) input).choiceId();
                items.remove(selectIndex(choiceId));
            }
            case ReservedIds.NEW -> lastItem().apply(input, rest);
            default -> items.get(pathIndex(field)).apply(input, rest);
        }
    }

    private void applyMainMenu(Input input) throws ChooseException {
        if (input instanceof Input.Text) {
            throw ChooseException.unexpectedInputKind(input);
        }
        String choiceId = ((Input.Choice) input).choiceId();
        if (ReservedIds.NEW.equals(choiceId)) {
            items.add(elementFactory.create());
        } else if (ReservedIds.REMOVE.equals(choiceId)) {
            if (items.isEmpty()) {
                throw ChooseException.invalidChoice(choiceId);
            }
        } else {
            // selecting an item to edit only checks the index, the engine descends into it
            selectIndex(choiceId);
        }
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        if (path.isEmpty()) {
            if (items.isEmpty()) {
                return List.of(ReservedIds.NEW);
            }
            var inputs = new ArrayList<String>();
            inputs.add(ReservedIds.NEW);
            inputs.add(ReservedIds.REMOVE);
            for (int i = 0; i < items.size(); i++) {
                inputs.add(Integer.toString(i));
            }
            return inputs;
        }
        String field = NodePaths.head(path);
        List<String> rest = NodePaths.rest(path);
        return switch (field) {
            case ReservedIds.REMOVE -> List.of();
            case ReservedIds.NEW -> lastItem().nextInputs(rest);
            default -> items.get(pathIndex(field)).nextInputs(rest);
        };
    }

    @Override
    public Options options(List<String> path) {
        if (path.isEmpty()) {
            var choices = new ArrayList<Choice>();
            choices.add(Choice.of(ReservedIds.NEW, "New element"));
            if (!items.isEmpty()) {
                choices.add(Choice.of(ReservedIds.REMOVE, "Remove element"));
                for (int i = 0; i < items.size(); i++) {
                    choices.add(new Choice(Integer.toString(i), "Edit item " + i, !items.get(i).isComplete()));
                }
            }
            return Options.choices(prompt, choices);
        }
        String field = NodePaths.head(path);
        List<String> rest = NodePaths.rest(path);
        return switch (field) {
            case ReservedIds.REMOVE -> {
                NodePaths.requireEmpty(rest, "SequenceNode.options() in remove menu");
                var choices = new ArrayList<Choice>();
                for (int i = 0; i < items.size(); i++) {
                    choices.add(Choice.of(Integer.toString(i), "Remove item " + i));
                }
                yield Options.choices(REMOVE_PROMPT, choices);
            }
            case ReservedIds.NEW -> lastItem().options(rest);
            default -> items.get(pathIndex(field)).options(rest);
        };
    }

    @Override
    public DisplayNode render() {
        var entries = new ArrayList<DisplayEntry>();
        for (Node<T> item : items) {
            entries.add(new DisplayEntry.Unnamed(item.render()));
        }
        return new DisplayNode.Composite("", entries);
    }

    @Override
    public Optional<List<T>> extract() {
        var values = new ArrayList<T>(items.size());
        for (Node<T> item : items) {
            Optional<T> value = item.extract();
            if (value.isEmpty()) {
                return Optional.empty();
            }
            values.add(value.get());
        }
        return Optional.of(Collections.unmodifiableList(values));
    }

    private Node<T> lastItem() {
        if (items.isEmpty()) {
            throw new IllegalStateException("SequenceNode: __new addressed but no element was appended");
        }
        return items.get(items.size() - 1);
    }

    /** An index chosen by the user: a bad one is an invalid choice. */
    private int selectIndex(String choiceId) throws ChooseException {
        int index;
        try {
            index = Integer.parseInt(choiceId);
        } catch (NumberFormatException e) {
            throw ChooseException.invalidChoice(choiceId);
        }
        if (index < 0 || index >= items.size()) {
            throw ChooseException.invalidChoice(choiceId);
        }
        return index;
    }

    /** An index found in a path: a bad one means the path is corrupted. */
    private int pathIndex(String segment) {
        int index;
        try {
            index = Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid index for sequence: " + segment, e);
        }
        if (index < 0 || index >= items.size()) {
            throw new IllegalStateException("Index %d out of bounds for sequence of %d elements"
                .formatted(index, items.size()));
        }
        return index;
    }
}
