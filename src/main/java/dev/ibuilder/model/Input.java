package dev.ibuilder.model;

/**
 * A single input of the user. Exactly one of two forms: free text or one of the offered choices.
 */
public sealed interface Input {

    /** Raw textual content, valid only when the last {@link Options#textInput()} was true. */
    record Text(String text) implements Input {}

    /** The identifier of one of the {@link Choice}s of the last {@link Options}. */
    record Choice(String choiceId) implements Input {}

    static Input text(String text) {
        return new Text(text);
    }

    static Input choice(String choiceId) {
        return new Choice(choiceId);
    }
}
