package dev.ibuilder.display;

import java.util.List;

/**
 * Read-only snapshot of a builder's tree, used for displaying its current content. Only the
 * visible fields are present.
 */
public sealed interface DisplayNode {

    /** A node without inner fields, just a value. */
    record Leaf(DisplayField field) implements DisplayNode {}

    /** A node made of inner fields, like the fields of a record or the items of a sequence. */
    record Composite(String name, List<DisplayEntry> entries) implements DisplayNode {
        public Composite {
            entries = List.copyOf(entries);
        }
    }

    static DisplayNode value(String text) {
        return new Leaf(new DisplayField.Value(text));
    }

    static DisplayNode missing() {
        return new Leaf(DisplayField.Missing.INSTANCE);
    }
}
