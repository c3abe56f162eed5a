package dev.ionfusion.fuusak.check;

import dev.ionfusion.fuusak.config.CheckConfig;
import dev.ionfusion.fuusak.index.FusionIndex;
import dev.ionfusion.fuusak.index.FusionLoader;
import dev.ionfusion.fuusak.index.Module;
import dev.ionfusion.fuusak.index.ModuleHandle;
import dev.ionfusion.fuusak.index.Script;
import dev.ionfusion.fuusak.shared.FusionException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Unbound-identifier check of a whole package.
 */
public final class FusionChecker {
    private FusionChecker() {}

    /**
     * Indexes the package at {@code packagePath} and checks every module it defines and every script.
     *
     * @throws FusionException when the package cannot be indexed
     */
    public static List<FusionException> checkPackage(Path packagePath, CheckConfig config, Consumer<String> progress) {
        FusionIndex index = FusionLoader.loadIndex(packagePath, config, progress);
        var checker = new UnboundChecker(index);
        var errors = new ArrayList<FusionException>();
        for (ModuleHandle handle : index.moduleHandles()) {
            Module module = index.module(handle);
            if (FusionIndex.KERNEL_MODULE_NAME.equals(module.name())) {
                continue;
            }
            progress.accept("Checking module " + module.name());
            errors.addAll(checker.check(module));
        }
        for (Script script : index.scripts()) {
            progress.accept("Checking " + script.name());
            errors.addAll(checker.check(script));
        }
        return errors;
    }
}
