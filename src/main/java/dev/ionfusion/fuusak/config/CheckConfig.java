package dev.ionfusion.fuusak.config;

import java.util.List;
import java.util.Set;

/**
 * Layout of a Fusion package for the unbound-identifier check.
 *
 * @param modulePaths directories whose {@code .fusion} files are modules
 * @param testPaths directories whose {@code .fusion} files are checked as scripts
 * @param topLevelModules modules whose provides are visible to every script
 * @param globalBindings names treated as bound in every script
 */
public record CheckConfig(
    List<String> modulePaths,
    List<String> testPaths,
    List<String> topLevelModules,
    Set<String> globalBindings
) {
    public CheckConfig {
        modulePaths = List.copyOf(modulePaths);
        testPaths = List.copyOf(testPaths);
        topLevelModules = List.copyOf(topLevelModules);
        globalBindings = Set.copyOf(globalBindings);
    }

    public static CheckConfig defaults() {
        return new CheckConfig(List.of("fusion/src"), List.of("ftst"), List.of("/fusion"), Set.of());
    }
}
