package com.sol2clarity.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.sol2clarity.exception.OutputException;
import com.sol2clarity.model.output.GeneratedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class GeneratedFileWriterTest {

    @TempDir
    Path tempDir;

    private final GeneratedFileWriter writer = new GeneratedFileWriter();

    private static GeneratedFile file(String name, String contents) {
        return GeneratedFile.builder()
                .contractName(name)
                .fileName(name.toLowerCase() + ".clar")
                .contents(contents)
                .build();
    }

    @Test
    void testWritesEveryFileInOrder() throws IOException {
        List<Path> written = writer.writeAll(List.of(file("A", ";; a\n"), file("B", ";; b\n")), tempDir);

        assertThat(written).containsExactly(tempDir.resolve("a.clar"), tempDir.resolve("b.clar"));
        assertThat(Files.readString(tempDir.resolve("a.clar"), StandardCharsets.UTF_8)).isEqualTo(";; a\n");
        assertThat(Files.readString(tempDir.resolve("b.clar"), StandardCharsets.UTF_8)).isEqualTo(";; b\n");
    }

    @Test
    void testCreatesMissingOutputDirectory() throws IOException {
        Path outputDir = tempDir.resolve("nested").resolve("out");

        Path written = writer.write(file("Token", ";; token\n"), outputDir);

        assertThat(written).isEqualTo(outputDir.resolve("token.clar"));
        assertThat(Files.readString(written)).isEqualTo(";; token\n");
    }

    @Test
    void testOverwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("token.clar"), "stale");

        writer.write(file("Token", ";; fresh\n"), tempDir);

        assertThat(Files.readString(tempDir.resolve("token.clar"))).isEqualTo(";; fresh\n");
    }

    @Test
    void testUnwritableTargetRaisesOutputException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> writer.write(file("Token", ";; token\n"), blocker))
                .isInstanceOf(OutputException.class)
                .satisfies(e -> assertThat(((OutputException) e).getPath()).isEqualTo(blocker.resolve("token.clar")));
    }

    @Test
    void testEmptyListWritesNothing() throws IOException {
        assertThat(writer.writeAll(List.of(), tempDir)).isEmpty();
        try (var entries = Files.list(tempDir)) {
            assertThat(entries).isEmpty();
        }
    }
}
