package dev.ibuilder.nodes;

/**
 * Per-instance configuration of a node: an optional default value and an optional prompt that
 * replaces the node's own.
 */
public record NodeConfig<T>(
    T defaultValue, // nullable
    String prompt   // nullable
) {
    private static final NodeConfig<?> EMPTY = new NodeConfig<>(null, null);

    @SuppressWarnings("unchecked")
    public static <T> NodeConfig<T> empty() {
        return (NodeConfig<T>) EMPTY;
    }

    public static <T> NodeConfig<T> withDefault(T defaultValue) {
        return new NodeConfig<>(defaultValue, null);
    }

    public static <T> NodeConfig<T> withPrompt(String prompt) {
        return new NodeConfig<>(null, prompt);
    }

    public String promptOr(String fallback) {
        return prompt != null ? prompt : fallback;
    }
}
