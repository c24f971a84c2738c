package dev.ibuilder.engine;

import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;
import dev.ibuilder.nodes.Node;
import dev.ibuilder.nodes.NodeFactory;
import dev.ibuilder.nodes.ReservedIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds a value of type {@code T} interactively, one input at a time.
 *
 * <p>{@link #options()} returns the menu for the current state: the choices (like buttons to
 * press) and whether raw text is accepted (like a textbox). The user's input is sent back with
 * {@link #choose(Input)}, either as {@link Input.Text} or as the id of one of the choices. When
 * all the fields are filled the main menu offers the {@value #FINALIZE_ID} choice, and choosing
 * it makes {@code choose} return the built value.
 *
 * <p>An instance is a single session: it is not thread safe and must not be shared.
 */
public final class InteractiveBuilder<T> {

    private static final Logger log = LoggerFactory.getLogger(InteractiveBuilder.class);

    /** The identifier of the "Done" choice. */
    public static final String FINALIZE_ID = ReservedIds.FINALIZE;
    /** The identifier of the "Back" choice. */
    public static final String BACK_ID = ReservedIds.BACK;

    private final Node<T> root;
    private final NavigationState state;

    public InteractiveBuilder(Node<T> root) {
        this.root = root;
        this.state = new NavigationState();
    }

    public static <T> InteractiveBuilder<T> of(NodeFactory<T> factory) {
        return new InteractiveBuilder<>(factory.create());
    }

    /**
     * All the valid options in the current state.
     */
    public Options options() {
        List<String> path = state.path();
        Options options = root.options(path);
        if (path.isEmpty()) {
            if (isDone()) {
                options = options.withChoice(Choice.of(FINALIZE_ID, "Done"));
            }
            return options;
        }
        return options.withChoice(Choice.of(BACK_ID, "Go back"));
    }

    /**
     * Apply an input, moving to the next state. Call {@link #options()} again for the new menu.
     *
     * @return the built value when the user chose to finish, empty otherwise
     * @throws ChooseException if the input is not valid; the state is left unchanged
     */
    public Optional<T> choose(Input input) throws ChooseException {
        List<String> path = List.copyOf(state.path());

        if (input instanceof Input.Choice choice) {
            if (path.isEmpty() && FINALIZE_ID.equals(choice.choiceId())) {
                Optional<T> value = root.extract();
                if (value.isPresent()) {
                    state.recordInteraction();
                    log.debug("Finished after {} interactions in {} ms", state.interactionCount(), state.elapsedMillis());
                    return value;
                }
            }
            if (!path.isEmpty() && BACK_ID.equals(choice.choiceId())) {
                state.ascend();
                state.recordInteraction();
                log.debug("Back to {}", state.path());
                return Optional.empty();
            }
        }

        List<String> legal = root.nextInputs(path);
        try {
            if (input instanceof Input.Choice choice && legal.contains(choice.choiceId())) {
                root.apply(input, path);
                state.descend(choice.choiceId());
                log.debug("Descended to {}", state.path());
            } else {
                // a value was set or a terminal choice was made: back to the parent menu
                root.apply(input, path);
                state.ascend();
                log.debug("Applied {} at {}, back to {}", input, path, state.path());
            }
        } catch (ChooseException e) {
            state.recordRejected();
            log.debug("Rejected {} at {}: {}", input, path, e.getMessage());
            throw e;
        }
        state.recordInteraction();
        return Optional.empty();
    }

    /**
     * The built value, even if the user has not chosen to finish yet.
     *
     * @throws FinalizeException if a field is still missing
     */
    public T finalizeValue() throws FinalizeException {
        return root.extract().orElseThrow(FinalizeException::new);
    }

    /** Whether all the fields are set and {@link #finalizeValue()} will succeed. */
    public boolean isDone() {
        return root.extract().isPresent();
    }

    /** The tree structure of the current state, for display purposes only. */
    public DisplayNode render() {
        return root.render();
    }

    /** The path of the focused node, empty in the main menu. */
    public List<String> currentPath() {
        return state.path();
    }

    public NavigationState state() {
        return state;
    }
}
