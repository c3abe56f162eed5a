package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.DebugView;
import dev.ionfusion.fuusak.api.FusionFile;
import picocli.CommandLine;

@CommandLine.Command(
    name = "debug-ist",
    description = "Print the intermediate syntax tree the formatter works on.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class DebugIstCommand extends DebugCommand {
    @Override
    String render(FusionFile file, DebugView.Format format) {
        return file.debugIst(format);
    }
}
