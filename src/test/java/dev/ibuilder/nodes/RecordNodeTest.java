package dev.ibuilder.nodes;

import dev.ibuilder.display.DisplayEntry;
import dev.ibuilder.display.DisplayNode;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.ChooseError;
import dev.ibuilder.model.ChooseException;
import dev.ibuilder.model.Input;
import dev.ibuilder.model.Options;
import dev.ibuilder.nodes.RecordNode.FieldOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordNodeTest {

    record Person(String name, int age, String team) {}

    private static NodeFactory<Person> person() {
        var builder = RecordNode.<Person>builder("Person");
        var name = builder.field("name", Scalars.string(), FieldOptions.<String>defaults().label("full name"));
        var age = builder.field("age", Scalars.int32(), FieldOptions.<Integer>defaults().prompt("How old?"));
        var team = builder.constant("team", "core");
        return builder.build(v -> new Person(v.get(name), v.get(age), v.get(team)));
    }

    @Test
    void mainMenuListsTheVisibleFields() {
        Node<Person> node = person().create();

        Options options = node.options(List.of());

        assertThat(options.query()).isEqualTo("Select the field to edit");
        assertThat(options.textInput()).isFalse();
        assertThat(options.choices()).containsExactly(
            new Choice("name", "Edit full name", true),
            new Choice("age", "Edit age", true));
        assertThat(node.nextInputs(List.of())).containsExactly("name", "age");
    }

    @Test
    void fieldsAreEditedThroughTheirPath() throws Exception {
        Node<Person> node = person().create();

        node.apply(Input.choice("name"), List.of());
        node.apply(Input.text("Ada"), List.of("name"));
        assertThat(node.extract()).isEmpty();

        assertThat(node.options(List.of("age")).query()).isEqualTo("How old?");
        node.apply(Input.text("36"), List.of("age"));

        assertThat(node.extract()).contains(new Person("Ada", 36, "core"));
        assertThat(node.options(List.of()).choices()).extracting(Choice::needsAction).containsExactly(false, false);
    }

    @Test
    void hiddenFieldsAreNotReachable() {
        Node<Person> node = person().create();

        assertThat(errorOf(node, Input.choice("team"))).isEqualTo(new ChooseError.InvalidChoice("team"));
        assertThat(errorOf(node, Input.choice("nope"))).isEqualTo(new ChooseError.InvalidChoice("nope"));
        assertThat(errorOf(node, Input.text("Ada"))).isInstanceOf(ChooseError.UnexpectedInputKind.class);
        assertThatThrownBy(() -> node.options(List.of("team"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rendersVisibleFieldsByLabel() throws Exception {
        Node<Person> node = person().create();
        node.apply(Input.text("Ada"), List.of("name"));

        assertThat(node.render()).isEqualTo(new DisplayNode.Composite("Person", List.of(
            new DisplayEntry.Named("full name", DisplayNode.value("Ada")),
            new DisplayEntry.Named("age", DisplayNode.missing()))));
    }

    @Test
    void customRecordPrompt() {
        var builder = RecordNode.<String>builder("Wrapper").prompt("Pick one");
        var value = builder.field("value", Scalars.string());
        NodeFactory<String> factory = builder.build(v -> v.get(value));

        assertThat(factory.create().options(List.of()).query()).isEqualTo("Pick one");
        assertThat(factory.create(NodeConfig.withPrompt("Override")).options(List.of()).query()).isEqualTo("Override");
    }

    @Test
    void nestedRecordsForwardPaths() throws Exception {
        var outer = RecordNode.<Person>builder("Outer");
        var inner = outer.field("person", person());
        Node<Person> node = outer.build(v -> v.get(inner)).create();

        assertThat(node.nextInputs(List.of("person"))).containsExactly("name", "age");
        node.apply(Input.text("Bob"), List.of("person", "name"));
        node.apply(Input.text("7"), List.of("person", "age"));

        assertThat(node.extract()).contains(new Person("Bob", 7, "core"));
    }

    @Test
    void recordsDoNotAcceptDefaults() {
        NodeFactory<Person> factory = person();

        assertThatThrownBy(() -> factory.create(NodeConfig.withDefault(new Person("a", 1, "b"))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hiddenFieldWhoseNodeStaysIncompleteIsRejectedOnCreation() {
        var builder = RecordNode.<String>builder("Broken");
        // the factory ignores the default value
        var ignored = builder.field("x", config -> Scalars.string().create(),
            FieldOptions.withDefault("value").asHidden());
        var visible = builder.field("y", Scalars.string());
        NodeFactory<String> factory = builder.build(v -> v.get(ignored) + v.get(visible));

        assertThatThrownBy(factory::create)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Hidden field 'x'");
    }

    private static ChooseError errorOf(Node<?> node, Input input) {
        try {
            node.apply(input, List.of());
        } catch (ChooseException e) {
            return e.error();
        }
        throw new AssertionError("Expected " + input + " to be rejected");
    }
}
