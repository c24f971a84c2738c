package dev.ibuilder.model;

/**
 * A single choice that the user can select.
 *
 * @param choiceId    identifier to send back as {@link Input.Choice}, may not be shown to the user
 * @param text        message to show to the user for this choice
 * @param needsAction true when something below this choice is still missing; advisory only
 */
public record Choice(
    String choiceId,
    String text,
    boolean needsAction
) {
    public static Choice of(String choiceId, String text) {
        return new Choice(choiceId, text, false);
    }
}
