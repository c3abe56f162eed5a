package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.DebugView;
import dev.ionfusion.fuusak.api.FusionFile;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/**
 * Shared options of the tree dump commands.
 */
abstract class DebugCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private FuusakCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Fusion source file.")
    private Path file;

    @CommandLine.Option(names = "--yaml", description = "Print YAML instead of JSON.")
    private boolean yaml;

    @Override
    public Integer call() {
        CliReporter reporter = parent.reporter(spec.commandLine());
        DebugView.Format format = yaml ? DebugView.Format.YAML : DebugView.Format.JSON;
        reporter.result(render(FusionFile.load(file), format));
        return 0;
    }

    abstract String render(FusionFile file, DebugView.Format format);
}
