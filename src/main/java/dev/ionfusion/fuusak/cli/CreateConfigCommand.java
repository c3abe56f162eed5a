package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.config.FusionConfigLoader;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "create-config",
    description = "Write the default configuration file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class CreateConfigCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private FuusakCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--force", description = "Overwrite an existing file.")
    private boolean force;

    @Override
    public Integer call() {
        Path target = parent.configTarget();
        FusionConfigLoader.writeDefault(target, force);
        parent.reporter(spec.commandLine()).info("Wrote " + target);
        return 0;
    }
}
