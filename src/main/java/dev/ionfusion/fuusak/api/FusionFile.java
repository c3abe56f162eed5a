package dev.ionfusion.fuusak.api;

import dev.ionfusion.fuusak.cst.Expr;
import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Parsed file: name, source text and concrete syntax tree. Spans in the tree index into {@code contents}.
 */
public record FusionFile(String fileName, String contents, List<Expr> cst) {
    public static final String EXTENSION = ".fusion";

    public FusionFile {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(contents, "contents");
        cst = List.copyOf(cst);
    }

    public static FusionFile load(Path path) {
        return FusionFileContent.load(path).parse();
    }

    /**
     * Regular {@code .fusion} files below {@code root}, following links, sorted by path.
     */
    public static List<Path> findFusionFiles(Path root) {
        if (!Files.exists(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root, FileVisitOption.FOLLOW_LINKS)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .sorted()
                .toList();
        } catch (IOException | UncheckedIOException ex) {
            throw FusionException.generic("Failed to read input files under " + root + ": " + ex.getMessage(), ex);
        }
    }

    public IntermediateSyntaxTree ist() {
        return IntermediateSyntaxTree.fromCst(cst);
    }

    public String debugAst(DebugView.Format format) {
        return DebugView.render(DebugView.cst(cst, contents), format);
    }

    public String debugIst(DebugView.Format format) {
        return DebugView.render(DebugView.ist(ist().expressions(), contents), format);
    }
}
