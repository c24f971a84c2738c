package dev.ibuilder.nodes;

import java.util.Set;

/**
 * Choice identifiers used by the engine and the generic nodes. They can never be used as the id
 * of a record field or of a union variant.
 */
public final class ReservedIds {

    /** The "Done" choice of the main menu. */
    public static final String FINALIZE = "__finalize";
    /** The "Go back" choice of every inner menu. */
    public static final String BACK = "__back";
    /** Append an element to a sequence; as a path segment, the last element. */
    public static final String NEW = "__new";
    /** Remove an element of a sequence, or clear an optional. */
    public static final String REMOVE = "__remove";
    /** Set an unset optional. */
    public static final String SET = "__set";
    /** Edit the value of a set optional. */
    public static final String EDIT = "__edit";

    public static final Set<String> ALL = Set.of(FINALIZE, BACK, NEW, REMOVE, SET, EDIT);

    private ReservedIds() {}

    public static boolean isReserved(String id) {
        return ALL.contains(id);
    }
}
