package dev.ibuilder.cli.demo;

import dev.ibuilder.cli.demo.DemoTypes.Auth;
import dev.ibuilder.cli.demo.DemoTypes.ServerConfig;
import dev.ibuilder.cli.demo.DemoTypes.Tree;
import dev.ibuilder.engine.InteractiveBuilder;
import dev.ibuilder.model.Choice;
import dev.ibuilder.model.Input;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DemoTypesTest {

    @Test
    void serverConfigIsCompleteWithItsDefaults() throws Exception {
        var builder = InteractiveBuilder.of(DemoTypes.serverConfig());

        assertThat(builder.options().query()).isEqualTo("What do you want to configure?");
        assertThat(builder.options().choices()).extracting(Choice::choiceId)
            .containsExactly("host", "port", "certificate", "endpoints", "auth", "__finalize");

        ServerConfig config = builder.finalizeValue();
        assertThat(config).isEqualTo(new ServerConfig("localhost", 8080, Optional.empty(), List.of(),
            new Auth.Anonymous(), "1"));
    }

    @Test
    void tokenAuthUsesItsOwnPrompt() throws Exception {
        var builder = InteractiveBuilder.of(DemoTypes.serverConfig());

        builder.choose(Input.choice("auth"));
        builder.choose(Input.choice("Token"));
        assertThat(builder.options().query()).isEqualTo("Type the token");
        builder.choose(Input.text("secret"));

        assertThat(builder.finalizeValue().auth()).isEqualTo(new Auth.Token("secret"));
    }

    @Test
    void treeNestsItself() throws Exception {
        var builder = InteractiveBuilder.of(DemoTypes.tree());

        builder.choose(Input.choice("label"));
        builder.choose(Input.text("root"));
        builder.choose(Input.choice("children"));
        builder.choose(Input.choice("__new"));
        builder.choose(Input.choice("label"));
        builder.choose(Input.text("leaf"));

        assertThat(builder.currentPath()).containsExactly("children", "__new");
        builder.choose(Input.choice("__back"));
        builder.choose(Input.choice("__back"));

        assertThat(builder.finalizeValue()).isEqualTo(new Tree("root", List.of(new Tree("leaf", List.of()))));
    }

    @Test
    void everyDemoCanBeCreated() {
        for (Demo demo : Demo.values()) {
            assertThat(InteractiveBuilder.of(demo.factory()).options().choices()).isNotEmpty();
        }
    }
}
