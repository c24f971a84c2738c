package dev.ibuilder.nodes;

import java.util.List;

/**
 * Helpers for walking the path suffix handed to a {@link Node}.
 */
final class NodePaths {

    private NodePaths() {}

    static String head(List<String> path) {
        return path.get(0);
    }

    static List<String> rest(List<String> path) {
        return path.subList(1, path.size());
    }

    static void requireEmpty(List<String> path, String owner) {
        if (!path.isEmpty()) {
            throw new IllegalStateException("%s called with non empty path: %s".formatted(owner, path));
        }
    }

    static IllegalStateException invalidSegment(String owner, List<String> path) {
        return new IllegalStateException("%s: invalid path segment '%s' (the rest is %s)"
            .formatted(owner, head(path), rest(path)));
    }
}
