package dev.ibuilder.display;

/**
 * An entry of a {@link DisplayNode.Composite}: named for record fields, unnamed for sequence items.
 */
public sealed interface DisplayEntry {

    DisplayNode node();

    record Named(String name, DisplayNode node) implements DisplayEntry {}

    record Unnamed(DisplayNode node) implements DisplayEntry {}
}
