package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.api.FusionFile;
import java.util.List;
import java.util.Objects;

/**
 * Test or script files checked against the provides of a fixed set of top-level modules.
 */
public record Script(String name, List<String> topLevelModules, List<String> globalBindings, List<FusionFile> files) {
    public Script {
        Objects.requireNonNull(name, "name");
        topLevelModules = List.copyOf(topLevelModules);
        globalBindings = List.copyOf(globalBindings);
        files = List.copyOf(files);
    }
}
