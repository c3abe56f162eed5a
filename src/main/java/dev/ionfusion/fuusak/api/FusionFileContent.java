package dev.ionfusion.fuusak.api;

import dev.ionfusion.fuusak.cst.CstBuilder;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Source text of one file, not parsed yet.
 */
public record FusionFileContent(String fileName, String contents) {
    public static final String STDIN_NAME = "<stdin>";

    public FusionFileContent {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(contents, "contents");
    }

    public static FusionFileContent load(Path path) {
        try {
            return new FusionFileContent(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw FusionException.generic("Failed to load file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static FusionFileContent loadStdin(InputStream in) {
        try {
            return new FusionFileContent(STDIN_NAME, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw FusionException.generic("Failed to load stdin: " + ex.getMessage(), ex);
        }
    }

    public FusionFile parse() {
        try {
            return new FusionFile(fileName, contents, CstBuilder.parse(fileName, contents));
        } catch (FusionException ex) {
            throw FusionException.generic("Failed to parse " + fileName + ":\n" + ex.getMessage(), ex);
        }
    }
}
