package com.localization.toolkit.tool;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FluentToolTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void testStdoutConcatenatesFiles() throws IOException {
        Path first = write("first.ftl", "a   = A\n");
        Path second = write("second.ftl", "## Group\nb = B\n");

        FluentToolResult result = run(OutputMode.STDOUT, false, first, second);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReports()).hasSize(2);
        assertThat(result.getUnitsRead()).isEqualTo(3);
        assertThat(result.getReports()).extracting(FileReport::getWrittenTo).containsOnlyNulls();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo("a = A\n## Group\n\nb = B\n");
    }

    @Test
    void testFailureIsReportedPerFile() throws IOException {
        Path broken = write("broken.ftl", "bad line\n");
        Path good = write("good.ftl", "ok = fine\n");

        FluentToolResult result = run(OutputMode.NONE, false, broken, good);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFilesFailed()).isEqualTo(1);
        assertThat(result.getFilesSkipped()).isZero();

        FileReport failed = result.getReports().get(0);
        assertThat(failed.isSuccess()).isFalse();
        assertThat(failed.getStore()).isNull();
        assertThat(failed.getErrorMessage()).startsWith("Parsing error for fluent source: bad line");
        assertThat(result.getReports().get(1).isSuccess()).isTrue();
    }

    @Test
    void testFailFastSkipsRemainingFiles() throws IOException {
        Path good = write("good.ftl", "ok = fine\n");
        Path broken = write("broken.ftl", "bad line\n");
        Path other = write("other.ftl", "other = fine\n");

        FluentToolResult result = run(OutputMode.IN_PLACE, true, good, broken, other);

        assertThat(result.getReports()).hasSize(2);
        assertThat(result.getFilesSkipped()).isEqualTo(1);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReports().get(0).getWrittenTo()).isEqualTo(good);
    }

    @Test
    void testMissingFileIsIoError() {
        Path missing = tempDir.resolve("missing.ftl");

        FluentToolResult result = run(OutputMode.NONE, false, missing);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReports().get(0).getErrorMessage()).startsWith("I/O error: ");
    }

    @Test
    void testOutputFileIsCompressedWhenNamedGz() throws IOException {
        Path input = write("app.ftl", "key = value\n");
        Path target = tempDir.resolve("app-out.ftl.gz");

        FluentToolConfig config = FluentToolConfig.builder()
                .inputs(List.of(input))
                .outputMode(OutputMode.FILE)
                .outputFile(target)
                .build();
        FluentToolResult result = new FluentTool(config, stdout).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReports().get(0).getWrittenTo()).isEqualTo(target);
        byte[] written = Files.readAllBytes(target);
        assertThat(written[0]).isEqualTo((byte) 0x1f);
        assertThat(written[1]).isEqualTo((byte) 0x8b);
    }

    private FluentToolResult run(OutputMode outputMode, boolean failFast, Path... inputs) {
        FluentToolConfig config = FluentToolConfig.builder()
                .inputs(List.of(inputs))
                .outputMode(outputMode)
                .failFast(failFast)
                .build();
        return new FluentTool(config, stdout).run();
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
