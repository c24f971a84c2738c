package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transparent wrapper around exactly one child: every call is forwarded to it. It marks the
 * place where a type refers to itself, so that the nesting only goes as deep as the user builds
 * it (the child is usually reached through a {@link SequenceNode} or an {@link OptionalNode}).
 */
public final class BoxNode<T> implements Node<T> {

    private final Node<T> inner;

    public BoxNode(Node<T> inner) {
        this.inner = inner;
    }

    public static <T> NodeFactory<T> of(NodeFactory<T> innerFactory) {
        return config -> new BoxNode<>(innerFactory.create(config));
    }

    /**
     * Factory for self-referential definitions: the inner factory is looked up only when a node
     * is actually created, after the definition it belongs to has been completed.
     */
    public static <T> NodeFactory<T> lazy(Supplier<NodeFactory<T>> innerFactory) {
        return config -> new BoxNode<>(innerFactory.get().create(config));
    }

    Node<T> inner() {
        return inner;
    }

    @Override
    public void apply(Input input, List<String> path) throws ChooseException {
        inner.apply(input, path);
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        return inner.nextInputs(path);
    }

    @Override
    public Options options(List<String> path) {
        return inner.options(path);
    }

    @Override
    public DisplayNode render() {
        return inner.render();
    }

    @Override
    public Optional<T> extract() {
        return inner.extract();
    }
}
