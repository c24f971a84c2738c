package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayEntry;
import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node for a record with a fixed set of named fields. The main menu lets the user pick the field
 * to edit; hidden fields are never shown and take their value from their default.
 *
 * <p>Records are declared with {@link #builder(String)}:
 *
 * <pre>{@code
 * var builder = RecordNode.<Point>builder("Point");
 * var x = builder.field("x", Scalars.int32());
 * var y = builder.field("y", Scalars.int32(), RecordNode.FieldOptions.withDefault(0));
 * NodeFactory<Point> points = builder.build(values -> new Point(values.get(x), values.get(y)));
 * }</pre>
 */
public final class RecordNode<T> implements Node<T> {

    static final String DEFAULT_PROMPT = "Select the field to edit";

    /** Typed handle of a field, used by the assembler to read the field's value. */
    public record Field<V>(String id) {}

    /** The values of all the fields of a complete record. */
    public interface Values {
        <V> V get(Field<V> field);
    }

    /** Turns the values of the fields into the record. */
    @FunctionalInterface
    public interface Assembler<T> {
        T assemble(Values values);
    }

    /** How a field is shown and initialized. */
    public record FieldOptions<V>(
        String label,     // nullable, defaults to the field id
        String prompt,    // nullable, overrides the prompt of the field's node
        V defaultValue,   // nullable
        boolean hidden
    ) {
        public static <V> FieldOptions<V> defaults() {
            return new FieldOptions<>(null, null, null, false);
        }

        public static <V> FieldOptions<V> withDefault(V defaultValue) {
            return new FieldOptions<>(null, null, defaultValue, false);
        }

        public FieldOptions<V> label(String label) {
            return new FieldOptions<>(label, prompt, defaultValue, hidden);
        }

        public FieldOptions<V> prompt(String prompt) {
            return new FieldOptions<>(label, prompt, defaultValue, hidden);
        }

        public FieldOptions<V> defaultValue(V defaultValue) {
            return new FieldOptions<>(label, prompt, defaultValue, hidden);
        }

        public FieldOptions<V> asHidden() {
            return new FieldOptions<>(label, prompt, defaultValue, true);
        }
    }

    record FieldDefinition<V>(Field<V> key, NodeFactory<V> factory, FieldOptions<V> options) {
        String id() {
            return key.id();
        }

        String label() {
            return options.label() != null ? options.label() : key.id();
        }

        boolean hidden() {
            return options.hidden();
        }

        Node<V> create() {
            return factory.create(new NodeConfig<>(options.defaultValue(), options.prompt()));
        }
    }

    record Definition<T>(String name, String prompt, List<FieldDefinition<?>> fields, Assembler<T> assembler) {}

    private final Definition<T> definition;
    private final String prompt;
    private final Map<String, Node<?>> children = new LinkedHashMap<>();

    RecordNode(Definition<T> definition, String prompt) {
        this.definition = definition;
        this.prompt = prompt;
        for (FieldDefinition<?> field : definition.fields()) {
            Node<?> child = field.create();
            if (field.hidden() && !child.isComplete()) {
                throw new IllegalStateException("Hidden field '%s' of record '%s' has no default value"
                    .formatted(field.id(), definition.name()));
            }
            children.put(field.id(), child);
        }
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        if (path.isEmpty()) {
            if (input instanceof Input.Text) {
                throw ChooseException.unexpectedInputKind(input);
            }
            String choiceId = ((Input.Choice) input).choiceId();
            // selecting a field only checks it exists, the engine descends into it
            if (!isVisibleField(choiceId)) {
                throw ChooseException.invalidChoice(choiceId);
            }
            return;
        }
        visibleChild(path).apply(input, NodePaths.rest(path));
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        if (path.isEmpty()) {
            var ids = new ArrayList<String>();
            for (FieldDefinition<?> field : definition.fields()) {
                if (!field.hidden()) {
                    ids.add(field.id());
                }
            }
            return ids;
        }
        return visibleChild(path).nextInputs(NodePaths.rest(path));
    }

    @Override
    public Options options(List<String> path) {
        if (!path.isEmpty()) {
            return visibleChild(path).options(NodePaths.rest(path));
        }
        var choices = new ArrayList<Choice>();
        for (FieldDefinition<?> field : definition.fields()) {
            if (!field.hidden()) {
                boolean missing = !children.get(field.id()).isComplete();
                choices.add(new Choice(field.id(), "Edit " + field.label(), missing));
            }
        }
        return Options.choices(prompt, choices);
    }

    @Override
    public DisplayNode render() {
        return new DisplayNode.Composite(definition.name(), renderEntries());
    }

    List<DisplayEntry> renderEntries() {
        var entries = new ArrayList<DisplayEntry>();
        for (FieldDefinition<?> field : definition.fields()) {
            if (!field.hidden()) {
                entries.add(new DisplayEntry.Named(field.label(), children.get(field.id()).render()));
            }
        }
        return entries;
    }

    @Override
    public Optional<T> extract() {
        var values = new HashMap<String, Object>();
        for (var entry : children.entrySet()) {
            Optional<?> value = entry.getValue().extract();
            if (value.isEmpty()) {
                return Optional.empty();
            }
            values.put(entry.getKey(), value.get());
        }
        return Optional.of(definition.assembler().assemble(new ExtractedValues(definition.name(), values)));
    }

    private boolean isVisibleField(String id) {
        for (FieldDefinition<?> field : definition.fields()) {
            if (field.id().equals(id)) {
                return !field.hidden();
            }
        }
        return false;
    }

    private Node<?> visibleChild(List<String> path) {
        String field = NodePaths.head(path);
        if (!isVisibleField(field)) {
            throw NodePaths.invalidSegment("RecordNode '" + definition.name() + "'", path);
        }
        return children.get(field);
    }

    private record ExtractedValues(String recordName, Map<String, Object> values) implements Values {
        @Override
        @SuppressWarnings("unchecked")
        public <V> V get(Field<V> field) {
            if (!values.containsKey(field.id())) {
                throw new IllegalArgumentException("Record '%s' has no field '%s'".formatted(recordName, field.id()));
            }
            // the value was produced by the node created from the Field<V>'s own factory
            return (V) values.get(field.id());
        }
    }

    /**
     * Declares the fields of a record. Each declared field returns the handle used to read its
     * value when assembling the record.
     */
    public static final class Builder<T> {
        private final String name;
        private String prompt = DEFAULT_PROMPT;
        private final List<FieldDefinition<?>> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public <V> Field<V> field(String id, NodeFactory<V> factory) {
            return field(id, factory, FieldOptions.defaults());
        }

        public <V> Field<V> field(String id, NodeFactory<V> factory, FieldOptions<V> options) {
            var key = new Field<V>(id);
            fields.add(new FieldDefinition<>(key, factory, options));
            return key;
        }

        /** A hidden field that always takes the given value. */
        public <V> Field<V> constant(String id, V value) {
            return field(id, ConstantNode.factory(value), FieldOptions.withDefault(value).asHidden());
        }

        public NodeFactory<T> build(Assembler<T> assembler) {
            var definition = new Definition<>(name, prompt, List.copyOf(fields), assembler);
            List<String> errors = DefinitionValidator.validate(definition);
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid record '%s': %s".formatted(name, String.join("; ", errors)));
            }
            return config -> {
                if (config.defaultValue() != null) {
                    throw new IllegalArgumentException("Record '%s' does not accept a default value".formatted(name));
                }
                return new RecordNode<>(definition, config.promptOr(definition.prompt()));
            };
        }
    }
}
