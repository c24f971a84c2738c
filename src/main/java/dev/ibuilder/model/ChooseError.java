package dev.ibuilder.model;

/**
 * Why an {@link Input} was rejected. Every form is recoverable: the state of the builder is left
 * untouched and the caller may simply ask again.
 */
public sealed interface ChooseError {

    String message();

    /** The text could not be converted to the target type. */
    record InvalidText(String error) implements ChooseError {
        @Override
        public String message() {
            return "Invalid input: " + error;
        }
    }

    /**
     * The input has the wrong kind: free text where only choices are accepted, or a choice where
     * only free text is.
     */
    record UnexpectedInputKind(boolean textGiven) implements ChooseError {
        @Override
        public String message() {
            return textGiven ? "Unexpected text" : "Unexpected choice, type the value instead";
        }
    }

    /** The identifier is not among the choices currently offered. */
    record InvalidChoice(String choiceId) implements ChooseError {
        @Override
        public String message() {
            return "Unexpected choice: " + choiceId;
        }
    }
}
