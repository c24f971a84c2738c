package dev.ibuilder.display;

/**
 * Prints a {@link DisplayNode} as an indented tree:
 *
 * <pre>
 * Base
 * - integer: 123
 * - inner: Inner
 *   - string: missing
 * </pre>
 */
public final class TreePrinter {

    private static final String MISSING = "missing";

    private TreePrinter() {}

    public static String print(DisplayNode node) {
        var sb = new StringBuilder();
        write(node, sb, 0);
        return sb.toString();
    }

    private static void write(DisplayNode node, StringBuilder sb, int indent) {
        if (node instanceof DisplayNode.Leaf leaf) {
            if (leaf.field() instanceof DisplayField.Value value) {
                sb.append(value.text());
            } else {
                sb.append(MISSING);
            }
            sb.append('\n');
            return;
        }
        var composite = (DisplayNode.Composite) node;
        String pad = "  ".repeat(indent);
        sb.append(composite.name()).append('\n');
        for (DisplayEntry entry : composite.entries()) {
            sb.append(pad).append("- ");
            if (entry instanceof DisplayEntry.Named named) {
                sb.append(named.name()).append(": ");
            }
            write(entry.node(), sb, indent + 1);
        }
    }
}
