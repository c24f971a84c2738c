package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayEntry;
import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Node for a choice among mutually exclusive variants. Empty variants carry a fixed value and are
 * complete as soon as they are selected; the other variants carry a payload node that has to be
 * completed.
 *
 * <p>Only the state of the selected variant is kept: selecting it again keeps its state, selecting
 * another variant discards it.
 */
public final class UnionNode<T> implements Node<T> {

    static final String DEFAULT_PROMPT = "Select a variant";

    /** How a variant is shown and whether it is selected from the start. */
    public record VariantOptions(
        String label,   // nullable, defaults to the variant id
        String prompt,  // nullable, overrides the prompt of the payload's node
        boolean hidden,
        boolean selectedByDefault
    ) {
        public static VariantOptions defaults() {
            return new VariantOptions(null, null, false, false);
        }

        public VariantOptions label(String label) {
            return new VariantOptions(label, prompt, hidden, selectedByDefault);
        }

        public VariantOptions prompt(String prompt) {
            return new VariantOptions(label, prompt, hidden, selectedByDefault);
        }

        public VariantOptions asHidden() {
            return new VariantOptions(label, prompt, true, selectedByDefault);
        }

        public VariantOptions asDefault() {
            return new VariantOptions(label, prompt, hidden, true);
        }
    }

    record Variant<T, P>(
        String id,
        VariantOptions options,
        NodeFactory<P> payload,  // null for empty variants
        Function<P, T> mapper,   // null for empty variants
        T constant               // the value of empty variants
    ) {
        String label() {
            return options.label() != null ? options.label() : id;
        }

        boolean hidden() {
            return options.hidden();
        }

        boolean isEmpty() {
            return payload == null;
        }

        Selected<T, P> select() {
            Node<P> node = payload == null ? null : payload.create(NodeConfig.withPrompt(options.prompt()));
            return new Selected<>(this, node);
        }
    }

    record Definition<T>(String name, String prompt, List<Variant<T, ?>> variants) {}

    /** The selected variant with the state of its payload. */
    private record Selected<T, P>(Variant<T, P> variant, Node<P> payload) {
        Optional<T> extract() {
            if (payload == null) {
                return Optional.of(variant.constant());
            }
            return payload.extract().map(variant.mapper());
        }

        DisplayNode render() {
            String label = variant.label();
            if (payload == null) {
                return DisplayNode.value(label);
            }
            Node<?> unboxed = payload;
            while (unboxed instanceof BoxNode<?> box) {
                unboxed = box.inner();
            }
            if (unboxed instanceof RecordNode<?> recordPayload) {
                return new DisplayNode.Composite(label, recordPayload.renderEntries());
            }
            return new DisplayNode.Composite(label, List.of(new DisplayEntry.Unnamed(payload.render())));
        }
    }

    private final Definition<T> definition;
    private final String prompt;
    private Selected<T, ?> selected;

    UnionNode(Definition<T> definition, String prompt) {
        this.definition = definition;
        this.prompt = prompt;
        for (Variant<T, ?> variant : definition.variants()) {
            if (variant.options().selectedByDefault()) {
                this.selected = variant.select();
            }
        }
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public Optional<String> selectedVariant() {
        return Optional.ofNullable(selected).map(s -> s.variant().id());
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        if (!path.isEmpty()) {
            payload(path).apply(input, NodePaths.rest(path));
            return;
        }
        if (input instanceof Input.Text) {
            throw ChooseException.unexpectedInputKind(input);
        }
        String choiceId = ((Input.Choice) input).choiceId();
        Variant<T, ?> variant = visibleVariant(choiceId)
            .orElseThrow(() -> ChooseException.invalidChoice(choiceId));
        // do not overwrite the state of the variant already selected
        if (selected == null || selected.variant() != variant) {
            selected = variant.select();
        }
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        if (!path.isEmpty()) {
            return payload(path).nextInputs(NodePaths.rest(path));
        }
        var ids = new ArrayList<String>();
        for (Variant<T, ?> variant : definition.variants()) {
            if (!variant.hidden() && !variant.isEmpty()) {
                ids.add(variant.id());
            }
        }
        return ids;
    }

    @Override
    public Options options(List<String> path) {
        if (!path.isEmpty()) {
            return payload(path).options(NodePaths.rest(path));
        }
        var choices = new ArrayList<Choice>();
        for (Variant<T, ?> variant : definition.variants()) {
            if (variant.hidden()) {
                continue;
            }
            boolean needsAction = selected != null
                && selected.variant() == variant
                && selected.payload() != null
                && !selected.payload().isComplete();
            choices.add(new Choice(variant.id(), variant.label(), needsAction));
        }
        return Options.choices(prompt, choices);
    }

    @Override
    public DisplayNode render() {
        return selected == null ? DisplayNode.missing() : selected.render();
    }

    @Override
    public Optional<T> extract() {
        return selected == null ? Optional.empty() : selected.extract();
    }

    private Optional<Variant<T, ?>> visibleVariant(String id) {
        for (Variant<T, ?> variant : definition.variants()) {
            if (!variant.hidden() && variant.id().equals(id)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    private Node<?> payload(List<String> path) {
        String field = NodePaths.head(path);
        if (selected == null || !selected.variant().id().equals(field) || selected.payload() == null) {
            throw NodePaths.invalidSegment("UnionNode '" + definition.name() + "'", path);
        }
        return selected.payload();
    }

    /**
     * Declares the variants of a union, in the order they are shown.
     */
    public static final class Builder<T> {
        private final String name;
        private String prompt = DEFAULT_PROMPT;
        private final List<Variant<T, ?>> variants = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        /** A variant without payload, always producing {@code value}. */
        public Builder<T> empty(String id, T value) {
            return empty(id, value, VariantOptions.defaults());
        }

        public Builder<T> empty(String id, T value, VariantOptions options) {
            variants.add(new Variant<T, Void>(id, options, null, null, value));
            return this;
        }

        /** A variant whose payload is built by {@code payload} and turned into the union's type. */
        public <P> Builder<T> variant(String id, NodeFactory<P> payload, Function<P, T> mapper) {
            return variant(id, payload, mapper, VariantOptions.defaults());
        }

        public <P> Builder<T> variant(String id, NodeFactory<P> payload, Function<P, T> mapper,
                                      VariantOptions options) {
            variants.add(new Variant<>(id, options, payload, mapper, null));
            return this;
        }

        public NodeFactory<T> build() {
            var definition = new Definition<>(name, prompt, List.copyOf(variants));
            List<String> errors = DefinitionValidator.validate(definition);
            if (!errors.isEmpty()) {
                throw new IllegalStateException("Invalid union '%s': %s".formatted(name, String.join("; ", errors)));
            }
            return config -> {
                if (config.defaultValue() != null) {
                    throw new IllegalArgumentException(
                        "Union '%s' does not accept a default value, mark a variant as default".formatted(name));
                }
                return new UnionNode<>(definition, config.promptOr(definition.prompt()));
            };
        }
    }
}
