package dev.ibuilder.cli.demo;

import dev.ibuilder.nodes.NodeFactory;

import java.util.function.Supplier;

/**
 * The types that can be built from the command line.
 */
public enum Demo {
    EXAMPLE(DemoTypes::example),
    SERVER(DemoTypes::serverConfig),
    TREE(DemoTypes::tree);

    private final Supplier<NodeFactory<?>> factory;

    Demo(Supplier<NodeFactory<?>> factory) {
        this.factory = factory;
    }

    public NodeFactory<?> factory() {
        return factory.get();
    }
}
