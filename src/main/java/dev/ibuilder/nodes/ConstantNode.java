package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.List;
import java.util.Optional;

/**
 * A node that always holds the same value and cannot be interacted with. Used for hidden record
 * fields of types that have no interactive node of their own.
 */
public final class ConstantNode<T> implements Node<T> {

    private final T value;

    public ConstantNode(T value) {
        this.value = value;
    }

    public static <T> NodeFactory<T> factory(T value) {
        return config -> new ConstantNode<>(config.defaultValue() != null ? config.defaultValue() : value);
    }

    @Override
    public void apply(Input input, List<String> path) {
        throw new IllegalStateException("ConstantNode cannot be interacted with");
    }

    @Override
    public List<String> nextInputs(List<String> path) {
        return List.of();
    }

    @Override
    public Options options(List<String> path) {
        throw new IllegalStateException("ConstantNode has no menu");
    }

    @Override
    public DisplayNode render() {
        return value == null ? DisplayNode.missing() : DisplayNode.value(String.valueOf(value));
    }

    @Override
    public Optional<T> extract() {
        return Optional.ofNullable(value);
    }
}
