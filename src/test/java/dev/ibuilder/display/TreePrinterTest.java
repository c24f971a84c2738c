package dev.ibuilder.display;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TreePrinterTest {

    @Test
    void printsLeaves() {
        assertThat(TreePrinter.print(DisplayNode.value("42"))).isEqualTo("42\n");
        assertThat(TreePrinter.print(DisplayNode.missing())).isEqualTo("missing\n");
    }

    @Test
    void printsNestedComposites() {
        DisplayNode inner = new DisplayNode.Composite("Inner", List.of(
            new DisplayEntry.Named("string", DisplayNode.missing()),
            new DisplayEntry.Named("defaulted", DisplayNode.value("lol"))));
        DisplayNode base = new DisplayNode.Composite("Base", List.of(
            new DisplayEntry.Named("integer", DisplayNode.value("123")),
            new DisplayEntry.Named("inner", inner)));

        assertThat(TreePrinter.print(base)).isEqualTo("""
            Base
            - integer: 123
            - inner: Inner
              - string: missing
              - defaulted: lol
            """);
    }

    @Test
    void unnamedEntriesHaveOnlyTheBullet() {
        DisplayNode list = new DisplayNode.Composite("", List.of(
            new DisplayEntry.Unnamed(DisplayNode.value("1")),
            new DisplayEntry.Unnamed(DisplayNode.missing())));

        assertThat(TreePrinter.print(list)).isEqualTo("\n- 1\n- missing\n");
    }
}
