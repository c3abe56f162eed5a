package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.FormatMode;
import dev.ionfusion.fuusak.api.FormatResult;
import dev.ionfusion.fuusak.api.FusionFileContent;
import dev.ionfusion.fuusak.api.FusionFormatter;
import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.shared.FusionException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "format",
    description = "Format files in place; '-' formats stdin to stdout.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class FormatCommand implements Callable<Integer> {
    static final String STDIN_ARGUMENT = "-";

    @CommandLine.ParentCommand
    private FuusakCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to format.")
    private List<String> files = new ArrayList<>();

    @CommandLine.Option(names = "--check", description = "Only report files whose formatting would change.")
    private boolean check;

    @CommandLine.Option(names = "--diff", description = "Print a unified diff instead of writing files.")
    private boolean diff;

    @Override
    public Integer call() {
        FusionConfig config = parent.config();
        CliReporter reporter = parent.reporter(spec.commandLine());
        var results = new ArrayList<FormatResult>();
        for (String file : files) {
            FormatResult result = STDIN_ARGUMENT.equals(file)
                ? formatStdin(config, reporter)
                : formatPath(Path.of(file), config, reporter);
            Reports.report(reporter, result);
            results.add(result);
        }
        return FormatResult.exitCode(results);
    }

    private FormatResult formatStdin(FusionConfig config, CliReporter reporter) {
        FusionFileContent content = FusionFileContent.loadStdin(parent.stdin);
        FormatResult result = formatContent(content, config, reporter);
        if (!check && !diff) {
            result.formatted().ifPresent(reporter::result);
        }
        return result;
    }

    private FormatResult formatPath(Path path, FusionConfig config, CliReporter reporter) {
        if (!check && !diff) {
            return FusionFormatter.formatFile(path, config, FormatMode.WRITE);
        }
        try {
            return formatContent(FusionFileContent.load(path), config, reporter);
        } catch (FusionException ex) {
            return FormatResult.failed(path.toString(), ex.getMessage());
        }
    }

    /**
     * Formats without writing anything back. With {@code --diff} a change counts as a file that would be
     * reformatted.
     */
    private FormatResult formatContent(FusionFileContent content, FusionConfig config, CliReporter reporter) {
        String formatted;
        try {
            formatted = FusionFormatter.format(config, content.parse().ist());
        } catch (FusionException ex) {
            return FormatResult.failed(content.fileName(), ex.getMessage());
        }
        if (formatted.equals(content.contents())) {
            return FormatResult.unchanged(content.fileName(), formatted);
        }
        if (diff) {
            reporter.result(DiffPrinter.unifiedDiff(
                content.fileName(), content.contents(), formatted, CommandLine.Help.Ansi.AUTO.enabled()));
        }
        return check || diff
            ? FormatResult.wouldReformat(content.fileName(), formatted)
            : FormatResult.reformatted(content.fileName(), formatted);
    }
}
