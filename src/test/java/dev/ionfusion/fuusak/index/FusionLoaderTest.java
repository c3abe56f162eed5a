package dev.ionfusion.fuusak.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ionfusion.fuusak.config.CheckConfig;
import dev.ionfusion.fuusak.shared.FusionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FusionLoaderTest {
    @TempDir
    Path dir;

    private final List<String> progress = new ArrayList<>();

    private void write(String relative, String contents) throws IOException {
        Path path = dir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, contents, StandardCharsets.UTF_8);
    }

    private void writeBasePackage() throws IOException {
        write("fusion/src/fusion.fusion", "(module fusion \"/fusion/private/kernel\"\n  (provide define lambda +))\n");
        write("fusion/src/util.fusion", "(module util \"/fusion\"\n  (defpub (double x) (+ x x)))\n");
    }

    private FusionIndex load() {
        return FusionLoader.loadIndex(dir, CheckConfig.defaults(), progress::add);
    }

    private Module module(FusionIndex index, String name) {
        return index.module(index.findModule(name).orElseThrow());
    }

    @Test
    void indexesModulesByPath() throws IOException {
        writeBasePackage();
        FusionIndex index = load();

        Module fusion = module(index, "/fusion");
        assertEquals(FusionIndex.KERNEL_MODULE_NAME, fusion.language());
        assertTrue(fusion.hasLanguage());
        assertEquals(List.of("+", "define", "lambda"), List.copyOf(fusion.provides().keySet()));

        Module util = module(index, "/util");
        assertEquals("/fusion", util.language());
        assertEquals(Set.of("double"), util.provides().keySet());
        assertEquals("fusion/src/util.fusion", util.file().fileName());

        assertTrue(index.findModule(FusionIndex.KERNEL_MODULE_NAME).isPresent());
        assertTrue(progress.contains("Loaded module: /util"));
    }

    @Test
    void namesModulesRelativeToModulePath() throws IOException {
        writeBasePackage();
        write("fusion/src/list/extra.fusion", "(module extra \"/fusion\")\n");
        FusionIndex index = load();
        var loader = new FusionLoader(CheckConfig.defaults(), index, progress::add);
        assertEquals("/list/extra", loader.moduleName(index.modulePaths().get(0).resolve("list/extra.fusion")));
        assertTrue(index.findModule("/list/extra").isPresent());
    }

    @Test
    void recordsRequireForms() throws IOException {
        writeBasePackage();
        write("fusion/src/user.fusion", """
            (module user "/fusion"
              (require "/util" (only_in "/fusion" lambda) (rename_in "/util" (double twice)))
              (define (f) 1)
              (provide (all_defined_out) (rename_out (f g))))
            """);
        FusionIndex index = load();

        Module user = module(index, "/user");
        assertEquals(List.of("f", "g"), List.copyOf(user.provides().keySet()));
        assertEquals(user.provides().get("f"), user.provides().get("g"));

        List<RequireForm> requires = user.requires();
        assertEquals(3, requires.size());
        assertInstanceOf(RequireType.All.class, requires.get(0).required());
        RequireType.Names names = assertInstanceOf(RequireType.Names.class, requires.get(1).required());
        assertEquals("lambda", names.origins().get(0).name());
        RequireType.Mapped mapped = assertInstanceOf(RequireType.Mapped.class, requires.get(2).required());
        assertEquals("twice", mapped.mapping().get("double").name());

        assertTrue(requires.get(0).findOrigin("double", index).isPresent());
        assertTrue(requires.get(2).findOrigin("twice", index).isPresent());
        assertTrue(requires.get(2).findOrigin("double", index).isEmpty());
    }

    @Test
    void renamesRequiredBindingsOut() throws IOException {
        writeBasePackage();
        write("fusion/src/reexport.fusion", "(module reexport \"/fusion\"\n"
            + "  (require \"/util\")\n"
            + "  (provide (rename_out (double twice))))\n");
        Module reexport = module(load(), "/reexport");
        assertEquals(Set.of("twice"), reexport.provides().keySet());
    }

    @Test
    void loadsTestScripts() throws IOException {
        writeBasePackage();
        write("ftst/test.fusion", "(require \"/util\")\n(double 1)\n");
        FusionIndex index = load();

        Script script = index.findScript("ftst/test.fusion").orElseThrow();
        assertEquals(List.of("/fusion"), script.topLevelModules());
        assertEquals(1, script.files().size());
        assertTrue(progress.contains("Loaded test: ftst/test.fusion"));
    }

    @Test
    void detectsCyclicDependencies() throws IOException {
        write("fusion/src/a.fusion", "(module a \"/fusion/private/kernel\" (require \"/b\"))\n");
        write("fusion/src/b.fusion", "(module b \"/fusion/private/kernel\" (require \"/a\"))\n");
        FusionException error = assertThrows(FusionException.class, this::load);
        assertEquals("Cyclic module dependency: /a -> /b -> /a", error.getMessage());
    }

    @Test
    void reportsMissingModules() throws IOException {
        write("fusion/src/a.fusion", "(module a \"/fusion/private/kernel\" (require \"/nope\"))\n");
        FusionException error = assertThrows(FusionException.class, this::load);
        assertEquals("Cannot load module named /nope: no module file found in module paths", error.getMessage());
    }

    @Test
    void reportsMalformedFormsWithLocation() throws IOException {
        write("fusion/src/a.fusion", "(module a \"/fusion/private/kernel\"\n  (provide (rename_out (zz yy))))\n");
        FusionException error = assertThrows(FusionException.class, this::load);
        assertTrue(error.getMessage().contains("--> fusion/src/a.fusion:2:24"), error.getMessage());
        assertTrue(error.getMessage().endsWith("rename_out of zz, which is neither defined nor required"));
    }

    @Test
    void rejectsPrefixIn() throws IOException {
        write("fusion/src/a.fusion", "(module a \"/fusion/private/kernel\" (require (prefix_in p \"/b\")))\n");
        FusionException error = assertThrows(FusionException.class, this::load);
        assertTrue(error.getMessage().contains("prefix_in"));
    }

    @Test
    void requiresModuleLanguage() throws IOException {
        write("fusion/src/a.fusion", "(module a)\n");
        FusionException error = assertThrows(FusionException.class, this::load);
        assertTrue(error.getMessage().endsWith("= missing module language"));
    }

    @Test
    void failsOnMissingPackage() {
        FusionException error = assertThrows(FusionException.class,
            () -> FusionLoader.loadIndex(dir.resolve("missing"), CheckConfig.defaults(), progress::add));
        assertTrue(error.getMessage().startsWith("Failed to resolve package path"));
    }
}
