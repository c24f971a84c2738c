package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;

import java.util.List;
import java.util.Optional;

/**
 * A node of the builder tree, able to build a value of type {@code T} one input at a time.
 *
 * <p>Every method taking a {@code path} receives the part of the path that is relative to this
 * node: an empty path means "this node", otherwise the first segment names a child and the call
 * is forwarded to it with the rest of the path. Paths are only ever built by the engine from
 * values returned by {@link #nextInputs(List)}, so a malformed path is a programming error and is
 * reported with {@link IllegalStateException}, never with a {@link ChooseException}.
 *
 * <p>A node with no value and no default is "empty": every method must still work on it.
 */
public interface Node<T> {

    /**
     * Apply the input to the node addressed by {@code path}. On failure nothing is changed.
     *
     * @throws ChooseException if the input is not valid for the addressed node
     */
    void apply(Input input, List<String> path) throws ChooseException;

    /**
     * The segments that can be appended to {@code path} to descend into a child. An empty list
     * means that the addressed node has to be interacted with directly.
     */
    List<String> nextInputs(List<String> path);

    /** The menu of the node addressed by {@code path}. */
    Options options(List<String> path);

    /** A snapshot of the visible content of this node and all its children. */
    DisplayNode render();

    /** The built value, or empty if this node or any node below it is still missing a value. */
    Optional<T> extract();

    default boolean isComplete() {
        return extract().isPresent();
    }
}
