package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.api.FusionFile;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Modules and scripts of one package. Modules live in an arena addressed by {@link ModuleHandle}.
 */
public final class FusionIndex {
    public static final String KERNEL_MODULE_NAME = "/fusion/private/kernel";

    private final Path packagePath;
    private final List<Path> modulePaths;
    private final List<Module> modules = new ArrayList<>();
    private final Map<String, ModuleHandle> modulesByName = new TreeMap<>();
    private final Map<String, Script> scripts = new TreeMap<>();

    public FusionIndex(Path packagePath, List<String> modulePaths) {
        this.packagePath = realPath(packagePath);
        var resolved = new ArrayList<Path>();
        for (String modulePath : modulePaths) {
            resolved.add(this.packagePath.resolve(modulePath).normalize());
        }
        this.modulePaths = List.copyOf(resolved);
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            throw FusionException.generic("Failed to resolve package path " + path + ": " + ex.getMessage(), ex);
        }
    }

    public Path packagePath() {
        return packagePath;
    }

    public List<Path> modulePaths() {
        return modulePaths;
    }

    /**
     * The kernel module, created on first use. It provides nothing and is its own language.
     */
    public ModuleHandle rootModule() {
        return findModule(KERNEL_MODULE_NAME).orElseGet(() -> putModule(new Module(
            KERNEL_MODULE_NAME,
            KERNEL_MODULE_NAME,
            new FusionFile(KERNEL_MODULE_NAME, "", List.of()),
            List.of(),
            Map.of())));
    }

    public Module module(ModuleHandle handle) {
        return modules.get(handle.index());
    }

    public Optional<ModuleHandle> findModule(String name) {
        return Optional.ofNullable(modulesByName.get(name));
    }

    /**
     * Adds {@code module}, replacing a module of the same name in place.
     */
    public ModuleHandle putModule(Module module) {
        ModuleHandle existing = modulesByName.get(module.name());
        if (existing != null) {
            modules.set(existing.index(), module);
            return existing;
        }
        ModuleHandle handle = new ModuleHandle(modules.size());
        modules.add(module);
        modulesByName.put(module.name(), handle);
        return handle;
    }

    /**
     * Module handles sorted by module name.
     */
    public Collection<ModuleHandle> moduleHandles() {
        return Collections.unmodifiableCollection(modulesByName.values());
    }

    public Optional<Script> findScript(String name) {
        return Optional.ofNullable(scripts.get(name));
    }

    public void putScript(Script script) {
        scripts.put(script.name(), script);
    }

    /**
     * Scripts sorted by name.
     */
    public Collection<Script> scripts() {
        return Collections.unmodifiableCollection(scripts.values());
    }

    /**
     * File of module {@code /a/b}: the first existing {@code a/b.fusion} below a module path.
     */
    public Optional<Path> findModuleFile(String moduleName) {
        String relative = (moduleName.startsWith("/") ? moduleName.substring(1) : moduleName) + FusionFile.EXTENSION;
        for (Path modulePath : modulePaths) {
            Path candidate = modulePath.resolve(relative);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Module path that contains {@code file}.
     */
    public Optional<Path> findParentPath(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        return modulePaths.stream().filter(normalized::startsWith).findFirst();
    }
}
