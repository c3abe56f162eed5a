package dev.ionfusion.fuusak.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FusionFormatterTest {
    private static final FusionConfig CONFIG = FusionConfig.defaults();

    private static Path write(Path path, String contents) throws IOException {
        Files.createDirectories(path.getParent());
        return Files.writeString(path, contents, StandardCharsets.UTF_8);
    }

    @Test
    void formatsSource() {
        assertEquals("(a\n  b)\n", FusionFormatter.formatSource("t.fusion", "(a\n   b\n)", CONFIG));
    }

    @Test
    void reportsParseFailureWithFileName() {
        FusionException error = assertThrows(FusionException.class,
            () -> FusionFormatter.formatSource("t.fusion", "(a", CONFIG));
        assertTrue(error.getMessage().startsWith("Failed to parse t.fusion:\n"));
    }

    @Test
    void rewritesChangedFile(@TempDir Path dir) throws IOException {
        Path file = write(dir.resolve("a.fusion"), "(a\n)");
        FormatResult result = FusionFormatter.formatFile(file, CONFIG, FormatMode.WRITE);
        assertEquals(FormatResult.Status.REFORMATTED, result.status());
        assertEquals("(a)\n", Files.readString(file, StandardCharsets.UTF_8));

        FormatResult again = FusionFormatter.formatFile(file, CONFIG, FormatMode.WRITE);
        assertEquals(FormatResult.Status.UNCHANGED, again.status());
    }

    @Test
    void checkModeLeavesFileAlone(@TempDir Path dir) throws IOException {
        Path file = write(dir.resolve("a.fusion"), "(a\n)");
        FormatResult result = FusionFormatter.formatFile(file, CONFIG, FormatMode.CHECK);
        assertEquals(FormatResult.Status.WOULD_REFORMAT, result.status());
        assertEquals("(a)\n", result.formatted().orElseThrow());
        assertEquals("(a\n)", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void reportsFailuresInResult(@TempDir Path dir) throws IOException {
        Path file = write(dir.resolve("bad.fusion"), "(a");
        FormatResult result = FusionFormatter.formatFile(file, CONFIG, FormatMode.WRITE);
        assertEquals(FormatResult.Status.FAILED, result.status());
        assertTrue(result.message().orElseThrow().contains("expected value or ')'"));
        assertEquals("(a", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void formatsEveryFusionFileBelowRoot(@TempDir Path dir) throws IOException {
        write(dir.resolve("a.fusion"), "(a)\n");
        write(dir.resolve("nested/b.fusion"), "[1,2]");
        write(dir.resolve("nested/c.fusion"), "(c");
        write(dir.resolve("notes.txt"), "(ignored");

        List<FormatResult> results = FusionFormatter.formatAll(dir, CONFIG, FormatMode.WRITE);
        assertEquals(
            List.of(FormatResult.Status.UNCHANGED, FormatResult.Status.REFORMATTED, FormatResult.Status.FAILED),
            results.stream().map(FormatResult::status).toList());
        assertEquals("[1, 2]\n", Files.readString(dir.resolve("nested/b.fusion"), StandardCharsets.UTF_8));
        assertEquals(1, FormatResult.exitCode(results));
    }

    @Test
    void replacesFileWithoutLeavingTemporaries(@TempDir Path dir) throws IOException {
        Path file = write(dir.resolve("a.fusion"), "old");
        FusionFormatter.writeReplacing(file, "new");
        assertEquals("new", Files.readString(file, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
    }
}
