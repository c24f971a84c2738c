package dev.ibuilder.nodes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Validates record and union definitions before any node is created from them.
 */
public final class DefinitionValidator {

    private DefinitionValidator() {}

    /**
     * Validate a record definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(RecordNode.Definition<?> record) {
        var errors = new ArrayList<String>();

        // Rule 1: a record has at least one field
        if (record.fields().isEmpty()) {
            errors.add("Record '%s' must have at least one field".formatted(record.name()));
        }

        var ids = new ArrayList<String>();
        for (RecordNode.FieldDefinition<?> field : record.fields()) {
            ids.add(field.id());
            if (field.factory() == null) {
                errors.add("Field '%s' has no node factory".formatted(field.id()));
            }
            // Rule 3: hidden fields take their value from the default; nodes are checked again when created
            if (field.hidden() && field.options().defaultValue() == null) {
                errors.add("Hidden field '%s' must have a default value".formatted(field.id()));
            }
        }
        checkIds("field", ids, errors);

        return errors;
    }

    /**
     * Validate a union definition. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(UnionNode.Definition<?> union) {
        var errors = new ArrayList<String>();

        // Rule 4: at least one variant can be selected by the user
        if (union.variants().stream().allMatch(UnionNode.Variant::hidden)) {
            errors.add("Union '%s' must have at least one visible variant".formatted(union.name()));
        }

        // Rule 5: at most one default variant
        long defaults = union.variants().stream().filter(v -> v.options().selectedByDefault()).count();
        if (defaults > 1) {
            errors.add("Union '%s' has %d default variants, at most one is allowed".formatted(union.name(), defaults));
        }

        var ids = new ArrayList<String>();
        for (UnionNode.Variant<?, ?> variant : union.variants()) {
            ids.add(variant.id());
            if (!variant.isEmpty() && variant.mapper() == null) {
                errors.add("Variant '%s' has a payload but no mapper".formatted(variant.id()));
            }
        }
        checkIds("variant", ids, errors);

        return errors;
    }

    // Rule 2: ids are unique and never collide with the reserved identifiers
    private static void checkIds(String kind, List<String> ids, List<String> errors) {
        var seen = new HashSet<String>();
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                errors.add("A %s has a missing or empty id".formatted(kind));
                continue;
            }
            if (!seen.add(id)) {
                errors.add("Duplicated %s id '%s'".formatted(kind, id));
            }
            if (ReservedIds.isReserved(id)) {
                errors.add("The %s id '%s' is reserved".formatted(kind, id));
            }
        }
    }
}
