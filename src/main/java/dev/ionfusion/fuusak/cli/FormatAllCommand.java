package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.FormatMode;
import dev.ionfusion.fuusak.api.FormatResult;
import dev.ionfusion.fuusak.api.FusionFormatter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "format-all",
    description = "Recursively format every .fusion file under a directory.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class FormatAllCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private FuusakCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "0..1", paramLabel = "DIR", defaultValue = ".", description = "Root directory.")
    private Path directory;

    @CommandLine.Option(names = "--check", description = "Only report files whose formatting would change.")
    private boolean check;

    @CommandLine.Option(names = "--json", description = "Print the per-file results as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        CliReporter reporter = parent.reporter(spec.commandLine());
        FormatMode mode = check ? FormatMode.CHECK : FormatMode.WRITE;
        List<FormatResult> results = FusionFormatter.formatAll(directory, parent.config(), mode);
        if (json) {
            reporter.result(FormatResult.toPrettyJson(results));
        } else {
            results.forEach(result -> Reports.report(reporter, result));
        }
        reporter.info(Reports.summary(results));
        return FormatResult.exitCode(results);
    }
}
