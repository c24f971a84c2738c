package dev.ibuilder.display;

/**
 * The content of a {@link DisplayNode.Leaf}.
 */
public sealed interface DisplayField {

    /** The value is set, with its textual representation. */
    record Value(String text) implements DisplayField {}

    /** The value is not present yet. */
    enum Missing implements DisplayField {
        INSTANCE
    }
}
