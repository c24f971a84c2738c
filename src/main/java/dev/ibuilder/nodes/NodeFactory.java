package dev.ibuilder.nodes;

/**
 * Creates fresh nodes building values of type {@code T}. Composite nodes keep a factory for their
 * children so that new elements can be created during the interaction.
 */
@FunctionalInterface
public interface NodeFactory<T> {

    Node<T> create(NodeConfig<T> config);

    default Node<T> create() {
        return create(NodeConfig.empty());
    }
}
