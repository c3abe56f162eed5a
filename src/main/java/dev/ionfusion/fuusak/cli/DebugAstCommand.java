package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.DebugView;
import dev.ionfusion.fuusak.api.FusionFile;
import picocli.CommandLine;

@CommandLine.Command(
    name = "debug-ast",
    description = "Print the concrete syntax tree of a file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class DebugAstCommand extends DebugCommand {
    @Override
    String render(FusionFile file, DebugView.Format format) {
        return file.debugAst(format);
    }
}
