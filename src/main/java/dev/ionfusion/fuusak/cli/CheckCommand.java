package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.check.FusionChecker;
import dev.ionfusion.fuusak.shared.FusionException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "check",
    description = "Report unbound identifiers in a Fusion package.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private FuusakCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "0..1", paramLabel = "DIR", defaultValue = ".", description = "Package directory.")
    private Path directory;

    @Override
    public Integer call() {
        CliReporter reporter = parent.reporter(spec.commandLine());
        List<FusionException> errors = FusionChecker.checkPackage(directory, parent.config().check(), reporter::debug);
        for (FusionException error : errors) {
            reporter.result(error.getMessage() + "\n");
        }
        if (errors.isEmpty()) {
            reporter.info("No unbound identifiers found");
            return 0;
        }
        reporter.error("Found " + errors.size() + " error(s)");
        return 1;
    }
}
