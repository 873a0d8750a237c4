package com.localization.toolkit.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the command end to end against files in a temporary directory.
 */
class FluentCommandTest {

    private static final String MESSY = """
            # Greeting
            hello = Hello
              .title =   Welcome
            items = { $n ->
              [one] One item
             *[other] { $n } items
            }
            """;

    private static final String CANONICAL = """
            # Greeting
            hello = Hello
                .title = Welcome
            items =
                { $n ->
                    [one] One item
                   *[other] { $n } items
                }
            """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void testWritesCanonicalFormToStdout() throws IOException {
        Path input = write("app.ftl", MESSY);

        int exitCode = execute(input.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_OK);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(CANONICAL);
        assertThat(input).hasContent(MESSY);
    }

    @Test
    void testCheckWritesNothing() throws IOException {
        Path input = write("app.ftl", MESSY);

        int exitCode = execute("--check", input.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_OK);
        assertThat(stdout.size()).isZero();
        assertThat(input).hasContent(MESSY);
    }

    @Test
    void testInPlace() throws IOException {
        Path first = write("first.ftl", MESSY);
        Path second = write("second.ftl", "-brand   =   Firefox\n");

        int exitCode = execute("--in-place", first.toString(), second.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_OK);
        assertThat(first).hasContent(CANONICAL);
        assertThat(second).hasContent("-brand = Firefox\n");
        assertThat(stdout.size()).isZero();
    }

    @Test
    void testOutputFile() throws IOException {
        Path input = write("app.ftl", MESSY);
        Path target = tempDir.resolve("out.ftl");

        int exitCode = execute("-o", target.toString(), input.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_OK);
        assertThat(target).hasContent(CANONICAL);
    }

    @Test
    void testListOnlyPrintsNoFileContent() throws IOException {
        Path input = write("app.ftl", MESSY);

        int exitCode = execute("--list", input.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_OK);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void testBrokenFileFails() throws IOException {
        Path broken = write("broken.ftl", "key = { $n\n");
        Path good = write("good.ftl", "ok = fine\n");

        int exitCode = execute("--in-place", broken.toString(), good.toString());

        assertThat(exitCode).isEqualTo(FluentCommand.EXIT_FILE_FAILURE);
        assertThat(broken).hasContent("key = { $n\n");
        assertThat(good).hasContent("ok = fine\n");
    }

    @Test
    void testInvalidOptions() throws IOException {
        Path input = write("app.ftl", MESSY);

        assertThat(execute()).isEqualTo(FluentCommand.EXIT_INVALID_OPTIONS);
        assertThat(execute("--check", "--in-place", input.toString())).isEqualTo(FluentCommand.EXIT_INVALID_OPTIONS);
        assertThat(execute("--no-such-option", input.toString())).isEqualTo(FluentCommand.EXIT_INVALID_OPTIONS);
        assertThat(input).hasContent(MESSY);
    }

    @Test
    void testHelp() {
        assertThat(execute("--help")).isEqualTo(FluentCommand.EXIT_OK);
    }

    private int execute(String... args) {
        return new CommandLine(new FluentCommand(stdout)).execute(args);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
