package dev.ibuilder.nodes;

import dev.ibuilder.nodes.RecordNode.FieldOptions;
import dev.ibuilder.nodes.UnionNode.VariantOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefinitionValidatorTest {

    @Test
    void validRecordHasNoErrors() {
        var definition = new RecordNode.Definition<String>("Valid", "prompt",
            List.of(field("a", Scalars.string(), FieldOptions.defaults())), v -> "");

        assertThat(DefinitionValidator.validate(definition)).isEmpty();
    }

    @Test
    void recordWithoutFields() {
        var definition = new RecordNode.Definition<String>("Empty", "prompt", List.of(), v -> "");

        assertThat(DefinitionValidator.validate(definition))
            .containsExactly("Record 'Empty' must have at least one field");
    }

    @Test
    void duplicatedAndReservedFieldIds() {
        var definition = new RecordNode.Definition<String>("Bad", "prompt", List.of(
            field("a", Scalars.string(), FieldOptions.defaults()),
            field("a", Scalars.string(), FieldOptions.defaults()),
            field("__new", Scalars.string(), FieldOptions.defaults()),
            field(" ", Scalars.string(), FieldOptions.defaults())), v -> "");

        assertThat(DefinitionValidator.validate(definition)).containsExactlyInAnyOrder(
            "Duplicated field id 'a'",
            "The field id '__new' is reserved",
            "A field has a missing or empty id");
    }

    @Test
    void hiddenFieldNeedsADefault() {
        var definition = new RecordNode.Definition<String>("Hidden", "prompt", List.of(
            field("visible", Scalars.string(), FieldOptions.defaults()),
            field("secret", Scalars.string(), FieldOptions.<String>defaults().asHidden())), v -> "");

        assertThat(DefinitionValidator.validate(definition))
            .containsExactly("Hidden field 'secret' must have a default value");
    }

    @Test
    void fieldWithoutFactory() {
        var definition = new RecordNode.Definition<String>("NoFactory", "prompt",
            List.of(field("a", null, FieldOptions.<String>defaults())), v -> "");

        assertThat(DefinitionValidator.validate(definition)).containsExactly("Field 'a' has no node factory");
    }

    @Test
    void recordBuilderRejectsInvalidDefinitions() {
        var builder = RecordNode.<String>builder("Clash");
        builder.field("__back", Scalars.string());

        assertThatThrownBy(() -> builder.build(v -> ""))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Invalid record 'Clash': The field id '__back' is reserved");
    }

    @Test
    void unionNeedsAVisibleVariant() {
        var definition = new UnionNode.Definition<String>("Hidden", "prompt", List.of(
            empty("A", VariantOptions.defaults().asHidden())));

        assertThat(DefinitionValidator.validate(definition))
            .containsExactly("Union 'Hidden' must have at least one visible variant");
    }

    @Test
    void unionWithTwoDefaults() {
        var definition = new UnionNode.Definition<String>("Twice", "prompt", List.of(
            empty("A", VariantOptions.defaults().asDefault()),
            empty("B", VariantOptions.defaults().asDefault())));

        assertThat(DefinitionValidator.validate(definition))
            .containsExactly("Union 'Twice' has 2 default variants, at most one is allowed");
    }

    @Test
    void payloadWithoutMapper() {
        List<UnionNode.Variant<String, ?>> variants = List.of(
            new UnionNode.Variant<String, Integer>("V", VariantOptions.defaults(), Scalars.int32(), null, null));
        var definition = new UnionNode.Definition<>("NoMapper", "prompt", variants);

        assertThat(DefinitionValidator.validate(definition))
            .containsExactly("Variant 'V' has a payload but no mapper");
    }

    @Test
    void unionBuilderRejectsDuplicatedVariants() {
        assertThatThrownBy(() -> UnionNode.<String>builder("Dup")
                .empty("A", "a")
                .empty("A", "b")
                .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Invalid union 'Dup': Duplicated variant id 'A'");
    }

    private static <V> RecordNode.FieldDefinition<?> field(String id, NodeFactory<V> factory, FieldOptions<V> options) {
        return new RecordNode.FieldDefinition<>(new RecordNode.Field<>(id), factory, options);
    }

    private static UnionNode.Variant<String, ?> empty(String id, VariantOptions options) {
        return new UnionNode.Variant<String, Void>(id, options, null, null, id.toLowerCase());
    }
}
