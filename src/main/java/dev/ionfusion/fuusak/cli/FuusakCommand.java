package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.LogLevel;
import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.config.FusionConfigLoader;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "fuusak",
    description = "Format and check Fusion source files.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true,
    subcommands = {
        FormatCommand.class,
        FormatAllCommand.class,
        CheckCommand.class,
        DebugAstCommand.class,
        DebugIstCommand.class,
        CreateConfigCommand.class
    }
)
final class FuusakCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "Configuration file (default: " + FusionConfigLoader.DEFAULT_FILE_NAME + " if present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostics threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = "info"
    )
    private String logLevelRaw;

    InputStream stdin = System.in;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    FusionConfig config() {
        if (configPath != null) {
            return FusionConfigLoader.load(configPath);
        }
        return FusionConfigLoader.loadOrDefault(Path.of(FusionConfigLoader.DEFAULT_FILE_NAME));
    }

    Path configTarget() {
        return configPath != null ? configPath : Path.of(FusionConfigLoader.DEFAULT_FILE_NAME);
    }

    CliReporter reporter(CommandLine commandLine) {
        LogLevel threshold;
        try {
            threshold = LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex, null, logLevelRaw);
        }
        return new CliReporter(commandLine, threshold);
    }
}
