package dev.ionfusion.fuusak.api;

import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.format.FixUp;
import dev.ionfusion.fuusak.format.Formatter;
import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Public entry point: source text in, formatted text out.
 */
public final class FusionFormatter {
    private FusionFormatter() {}

    /**
     * Runs the fix-up pass when the configuration asks for it, then renders the tree.
     */
    public static String format(FusionConfig config, IntermediateSyntaxTree tree) {
        IntermediateSyntaxTree input = config.newlineFixUpMode() ? FixUp.fixup(tree) : tree;
        return Formatter.render(config, input);
    }

    /**
     * Parses, lowers and formats {@code source}.
     *
     * @throws FusionException when the source does not parse
     */
    public static String formatSource(String fileName, String source, FusionConfig config) {
        FusionFile file = new FusionFileContent(fileName, source).parse();
        return format(config, file.ist());
    }

    /**
     * Formats one file; failures are reported in the result rather than thrown.
     */
    public static FormatResult formatFile(Path path, FusionConfig config, FormatMode mode) {
        String fileName = path.toString();
        try {
            FusionFileContent content = FusionFileContent.load(path);
            String formatted = format(config, content.parse().ist());
            if (formatted.equals(content.contents())) {
                return FormatResult.unchanged(fileName, formatted);
            }
            if (mode == FormatMode.CHECK) {
                return FormatResult.wouldReformat(fileName, formatted);
            }
            writeReplacing(path, formatted);
            return FormatResult.reformatted(fileName, formatted);
        } catch (FusionException ex) {
            return FormatResult.failed(fileName, ex.getMessage());
        }
    }

    /**
     * Formats every {@code .fusion} file below {@code root}; one failure does not stop the others.
     */
    public static List<FormatResult> formatAll(Path root, FusionConfig config, FormatMode mode) {
        List<FormatResult> results = new ArrayList<>();
        for (Path path : FusionFile.findFusionFiles(root)) {
            results.add(formatFile(path, config, mode));
        }
        return results;
    }

    /**
     * Writes through a temporary sibling file that is then moved over {@code target}.
     */
    static void writeReplacing(Path target, String contents) {
        Path directory = target.toAbsolutePath().getParent();
        Path temporary = null;
        try {
            temporary = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
            Files.writeString(temporary, contents, StandardCharsets.UTF_8);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(temporary, ex);
            throw FusionException.generic("Failed to write " + target + ": " + ex.getMessage(), ex);
        }
    }

    private static void deleteQuietly(Path temporary, IOException failure) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanup) {
            failure.addSuppressed(cleanup);
        }
    }
}
