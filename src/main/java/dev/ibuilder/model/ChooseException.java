package dev.ibuilder.model;

/**
 * Thrown when an {@link Input} cannot be applied. The builder is left exactly as it was before
 * the call.
 */
public class ChooseException extends Exception {

    private final ChooseError error;

    public ChooseException(ChooseError error) {
        super(error.message());
        this.error = error;
    }

    public ChooseError error() {
        return error;
    }

    public static ChooseException invalidChoice(String choiceId) {
        return new ChooseException(new ChooseError.InvalidChoice(choiceId));
    }

    public static ChooseException invalidText(String error) {
        return new ChooseException(new ChooseError.InvalidText(error));
    }

    /** The input is of the kind the node does not accept. */
    public static ChooseException unexpectedInputKind(Input input) {
        return new ChooseException(new ChooseError.UnexpectedInputKind(input instanceof Input.Text));
    }
}
