package dev.ibuilder.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class InteractiveBuilderCliTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void buildsTheDefaultDemoFromStdin() {
        int exitCode = execute("""
            int_field
            >5
            string_field
            >x
            __finalize
            """);

        assertThat(exitCode).isZero();
        assertThat(output()).contains("Result: Example[intField=5, stringField=x, defaulted=123]");
    }

    @Test
    void endOfInputBeforeFinishingFails() {
        int exitCode = execute("int_field\n>5\n");

        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).contains("Session ended before the value was complete.");
    }

    @Test
    void replaysAScriptForTheServerDemo(@TempDir Path dir) throws Exception {
        Path script = dir.resolve("server.json");
        Files.writeString(script, """
            [
              {"choice": "endpoints"},
              {"choice": "__new"},
              {"choice": "path"},
              {"text": "/health"},
              {"choice": "authenticated"},
              {"choice": "false"},
              {"choice": "__back"},
              {"choice": "__back"},
              {"choice": "__finalize"}
            ]
            """);

        int exitCode = execute("", "--demo", "SERVER", "--script", script.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("Result: ServerConfig[host=localhost, port=8080")
            .contains("Endpoint[path=/health, method=GET, authenticated=false]")
            .contains("auth=Anonymous[]");
    }

    @Test
    void unknownDemoIsAUsageError() {
        int exitCode = execute("", "--demo", "NOPE");

        assertThat(exitCode).isEqualTo(2);
    }

    private int execute(String stdin, String... args) {
        var cli = new InteractiveBuilderCli(out, new BufferedReader(new StringReader(stdin)));
        return new CommandLine(cli).execute(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
