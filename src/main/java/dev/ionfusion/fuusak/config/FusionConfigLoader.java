package dev.ionfusion.fuusak.config;

import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@code fuusak.toml}. Missing keys keep their defaults.
 */
public final class FusionConfigLoader {
    public static final String DEFAULT_FILE_NAME = "fuusak.toml";
    private static final String DEFAULT_RESOURCE = "/fuusak-default.toml";

    private FusionConfigLoader() {}

    /**
     * Loads a configuration file that must exist.
     */
    public static FusionConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw FusionException.generic("Config file not found: " + path);
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException ex) {
            throw FusionException.generic("Unable to read config file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Loads {@code path} when it exists, the built-in defaults otherwise.
     */
    public static FusionConfig loadOrDefault(Path path) {
        return Files.isRegularFile(path) ? load(path) : FusionConfig.defaults();
    }

    public static FusionConfig parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(error -> error.toString())
                .collect(Collectors.joining("\n"));
            throw FusionException.generic("Invalid config " + origin + ":\n" + errors);
        }

        FusionConfig.Builder builder = FusionConfig.builder();
        TomlTable fusion = result.getTable("fusion");
        if (fusion != null) {
            readFusionTable(fusion, builder, origin);
        }
        TomlTable check = result.getTable("check");
        if (check != null) {
            builder.check(readCheckTable(check, origin));
        }
        return builder.build();
    }

    public static String defaultConfigText() {
        try (InputStream stream = FusionConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (stream == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULT_RESOURCE);
            }
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read bundled resource " + DEFAULT_RESOURCE, ex);
        }
    }

    /**
     * Writes the default configuration to {@code target}; an existing file is only replaced when
     * {@code overwrite} is set.
     */
    public static void writeDefault(Path target, boolean overwrite) {
        if (Files.exists(target) && !overwrite) {
            throw FusionException.generic(target + " already exists; use --force to overwrite it");
        }
        try {
            Files.writeString(target, defaultConfigText(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw FusionException.generic("Unable to write " + target + ": " + ex.getMessage(), ex);
        }
    }

    private static void readFusionTable(TomlTable fusion, FusionConfig.Builder builder, String origin) {
        if (fusion.contains("format_multiline_string_contents")) {
            builder.formatMultilineStringContents(
                requireBoolean(fusion, "format_multiline_string_contents", origin)
            );
        }
        if (fusion.contains("newline_mode")) {
            String raw = requireString(fusion, "newline_mode", origin);
            try {
                builder.newlineMode(NewlineMode.from(raw));
            } catch (IllegalArgumentException ex) {
                throw FusionException.generic(
                    "Invalid config " + origin + ": fusion.newline_mode must be \"no-change\" or \"fix-up\", got \""
                        + raw + "\""
                );
            }
        } else if (fusion.contains("preserve_newlines")) {
            boolean preserve = requireBoolean(fusion, "preserve_newlines", origin);
            builder.newlineMode(preserve ? NewlineMode.NO_CHANGE : NewlineMode.FIX_UP);
        }
        if (fusion.contains("fixed_indent_symbols")) {
            builder.fixedIndentSymbols(requireStrings(fusion, "fixed_indent_symbols", "fusion", origin));
        }
        if (fusion.contains("smart_indent_symbols")) {
            builder.smartIndentSymbols(requireStrings(fusion, "smart_indent_symbols", "fusion", origin));
        }
    }

    private static CheckConfig readCheckTable(TomlTable check, String origin) {
        CheckConfig defaults = CheckConfig.defaults();
        List<String> modulePaths = check.contains("module_paths")
            ? requireStrings(check, "module_paths", "check", origin)
            : defaults.modulePaths();
        List<String> testPaths = check.contains("test_paths")
            ? requireStrings(check, "test_paths", "check", origin)
            : defaults.testPaths();
        List<String> topLevelModules = check.contains("top_level_modules")
            ? requireStrings(check, "top_level_modules", "check", origin)
            : defaults.topLevelModules();
        List<String> globalBindings = check.contains("global_bindings")
            ? requireStrings(check, "global_bindings", "check", origin)
            : List.copyOf(defaults.globalBindings());
        return new CheckConfig(modulePaths, testPaths, topLevelModules, new LinkedHashSet<>(globalBindings));
    }

    private static boolean requireBoolean(TomlTable table, String key, String origin) {
        if (!table.isBoolean(key)) {
            throw typeError(origin, "fusion." + key, "a boolean");
        }
        return table.getBoolean(key);
    }

    private static String requireString(TomlTable table, String key, String origin) {
        if (!table.isString(key)) {
            throw typeError(origin, "fusion." + key, "a string");
        }
        return table.getString(key);
    }

    private static List<String> requireStrings(TomlTable table, String key, String section, String origin) {
        if (!table.isArray(key)) {
            throw typeError(origin, section + "." + key, "an array of strings");
        }
        TomlArray array = table.getArray(key);
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String text)) {
                throw typeError(origin, section + "." + key, "an array of strings");
            }
            values.add(text);
        }
        return values;
    }

    private static FusionException typeError(String origin, String key, String expected) {
        return FusionException.generic("Invalid config " + origin + ": " + key + " must be " + expected);
    }
}
