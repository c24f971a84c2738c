package dev.ibuilder.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The menu shown to the user for the next input: a query, whether free text is accepted and the
 * discrete choices available.
 */
public record Options(
    String query,
    boolean textInput,
    List<Choice> choices
) {
    public Options {
        choices = List.copyOf(choices);
    }

    public static Options text(String query) {
        return new Options(query, true, List.of());
    }

    public static Options choices(String query, List<Choice> choices) {
        return new Options(query, false, choices);
    }

    /** A copy of this menu with one more choice at the end. */
    public Options withChoice(Choice choice) {
        var extended = new ArrayList<>(choices);
        extended.add(choice);
        return new Options(query, textInput, extended);
    }

    public boolean hasChoice(String choiceId) {
        return choices.stream().anyMatch(c -> c.choiceId().equals(choiceId));
    }
}
