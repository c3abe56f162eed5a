package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.api.FusionFile;
import dev.ionfusion.fuusak.api.FusionFileContent;
import dev.ionfusion.fuusak.config.CheckConfig;
import dev.ionfusion.fuusak.ist.Atom;
import dev.ionfusion.fuusak.ist.AtomicType;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Fills a {@link FusionIndex} from the files of a package: which module each file defines, its language,
 * what it requires and what it provides. Required modules are loaded on demand.
 */
public final class FusionLoader {
    private final CheckConfig config;
    private final FusionIndex index;
    private final Consumer<String> progress;
    private final Set<String> loading = new LinkedHashSet<>();

    public FusionLoader(CheckConfig config, FusionIndex index, Consumer<String> progress) {
        this.config = Objects.requireNonNull(config, "config");
        this.index = Objects.requireNonNull(index, "index");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    /**
     * Indexes the package at {@code packagePath} as laid out by {@code config}.
     */
    public static FusionIndex loadIndex(Path packagePath, CheckConfig config, Consumer<String> progress) {
        var index = new FusionIndex(packagePath, config.modulePaths());
        new FusionLoader(config, index, progress).loadConfiguredPaths();
        return index;
    }

    /**
     * Loads every module file under the module paths and every test file under the test paths.
     */
    public void loadConfiguredPaths() {
        for (Path modulePath : index.modulePaths()) {
            if (Files.isDirectory(modulePath)) {
                for (Path file : FusionFile.findFusionFiles(modulePath)) {
                    loadModuleFile(file);
                }
            }
        }
        for (String testPath : config.testPaths()) {
            Path root = index.packagePath().resolve(testPath).normalize();
            if (!Files.isDirectory(root)) {
                continue;
            }
            for (Path file : FusionFile.findFusionFiles(root)) {
                String name = displayName(file);
                loadScript(name, config.topLevelModules(), List.copyOf(config.globalBindings()), List.of(file));
                progress.accept("Loaded test: " + name);
            }
        }
    }

    public ModuleHandle loadModuleFile(Path file) {
        Path absolute = resolve(file);
        String moduleName = moduleName(absolute);
        return index.findModule(moduleName).orElseGet(() -> reloadModuleFile(moduleName, absolute));
    }

    /**
     * Parses {@code file} again and replaces the indexed module named {@code moduleName}.
     */
    public ModuleHandle reloadModuleFile(String moduleName, Path file) {
        if (!loading.add(moduleName)) {
            var chain = new ArrayList<>(loading);
            chain.add(moduleName);
            throw FusionException.generic("Cyclic module dependency: " + String.join(" -> ", chain));
        }
        try {
            FusionFile parsed = parse(resolve(file));
            ModuleHandle handle = index.putModule(processFile(moduleName, parsed));
            progress.accept("Loaded module: " + moduleName);
            return handle;
        } finally {
            loading.remove(moduleName);
        }
    }

    public ModuleHandle loadModule(String moduleName) {
        if (FusionIndex.KERNEL_MODULE_NAME.equals(moduleName)) {
            return index.rootModule();
        }
        var existing = index.findModule(moduleName);
        if (existing.isPresent()) {
            return existing.get();
        }
        Path file = index.findModuleFile(moduleName).orElseThrow(() -> FusionException.generic(
            "Cannot load module named " + moduleName + ": no module file found in module paths"));
        return loadModuleFile(file);
    }

    public Script loadScript(String name, List<String> topLevelModules, List<String> globalBindings, List<Path> files) {
        topLevelModules.forEach(this::loadModule);
        var parsed = new ArrayList<FusionFile>();
        for (Path file : files) {
            FusionFile fusionFile = parse(resolve(file));
            var processed = new ProcessedFile();
            visitFile(processed, fusionFile);
            parsed.add(fusionFile);
        }
        var script = new Script(name, topLevelModules, globalBindings, parsed);
        index.putScript(script);
        return script;
    }

    private Path resolve(Path file) {
        return file.isAbsolute() ? file.normalize() : index.packagePath().resolve(file).normalize();
    }

    private String displayName(Path file) {
        Path absolute = resolve(file);
        if (absolute.startsWith(index.packagePath())) {
            return index.packagePath().relativize(absolute).toString().replace(File.separatorChar, '/');
        }
        return absolute.toString();
    }

    private FusionFile parse(Path file) {
        FusionFileContent content = FusionFileContent.load(file);
        return new FusionFileContent(displayName(file), content.contents()).parse();
    }

    /**
     * {@code /a/b} for {@code <module path>/a/b.fusion}.
     */
    String moduleName(Path file) {
        Path parent = index.findParentPath(file)
            .orElseThrow(() -> FusionException.generic("Failed to find the module path containing " + file));
        String relative = parent.relativize(file.toAbsolutePath().normalize()).toString().replace(File.separatorChar, '/');
        if (relative.endsWith(FusionFile.EXTENSION)) {
            relative = relative.substring(0, relative.length() - FusionFile.EXTENSION.length());
        }
        return "/" + relative;
    }

    private Module processFile(String moduleName, FusionFile file) {
        var processed = new ProcessedFile();
        visitFile(processed, file);
        try {
            return processed.toModule(moduleName, file, index);
        } catch (FusionException ex) {
            throw ex.resolve(file.fileName(), file.contents());
        }
    }

    private void visitFile(ProcessedFile processed, FusionFile file) {
        try {
            for (Node node : file.ist().expressions()) {
                visit(processed, node, false);
            }
        } catch (FusionException ex) {
            throw ex.resolve(file.fileName(), file.contents());
        }
    }

    private void visit(ProcessedFile processed, Node node, boolean quoted) {
        if (node.isSExpr()) {
            visitSExpr(processed, (Sequence) node, quoted);
        } else if (node.isSequence()) {
            for (Node item : Forms.values(node)) {
                visit(processed, item, quoted);
            }
        }
    }

    private void visitSExpr(ProcessedFile processed, Sequence sexpr, boolean quoted) {
        List<Node> items = Forms.values(sexpr);
        if (items.isEmpty()) {
            return;
        }
        var call = items.get(0).symbolValue();
        List<Node> rest = items.subList(1, items.size());
        if (call.isEmpty()) {
            items.forEach(item -> visit(processed, item, quoted));
            return;
        }
        if (quoted) {
            if (call.get().equals("unquote")) {
                rest.forEach(item -> visit(processed, item, false));
            } else {
                items.forEach(item -> visit(processed, item, true));
            }
            return;
        }
        switch (call.get()) {
            case "define" -> definedName(rest).ifPresent(name -> processed.defined.put(name.text, name.span));
            case "define_syntax", "defpub", "defpub_j", "defpub_syntax" ->
                definedName(rest).ifPresent(name -> processed.provides.put(name.text, name.span));
            case "module" -> visitModule(processed, sexpr.span(), rest);
            case "provide" -> visitProvide(processed, rest);
            case "quasiquote" -> rest.forEach(item -> visit(processed, item, true));
            case "quote" -> {
            }
            case "require" -> visitRequire(processed, rest);
            default -> items.forEach(item -> visit(processed, item, false));
        }
    }

    private void visitModule(ProcessedFile processed, Span span, List<Node> rest) {
        if (rest.isEmpty()) {
            throw FusionException.spanned(span, "missing module name");
        }
        String language = rest.size() > 1
            ? Forms.stringValue(rest.get(1)).or(() -> Forms.strippedSymbol(rest.get(1))).orElse(null)
            : null;
        if (language == null) {
            throw FusionException.spanned(span, "missing module language");
        }
        processed.language = language;
        loadModule(language);
        rest.subList(2, rest.size()).forEach(item -> visit(processed, item, false));
    }

    private void visitRequire(ProcessedFile processed, List<Node> rest) {
        for (Node argument : rest) {
            if (argument instanceof Atom atom && atom.type() == AtomicType.QUOTED_STRING) {
                processed.requires.add(new RequireForm(loadModule(atom.value()), new RequireType.All()));
            } else if (argument.isSExpr()) {
                visitRequireSExpr(processed, (Sequence) argument);
            } else {
                throw FusionException.spanned(argument.span(), "argument 0 to require must be string or s-expr");
            }
        }
    }

    private void visitRequireSExpr(ProcessedFile processed, Sequence sexpr) {
        List<Node> items = Forms.values(sexpr);
        if (items.isEmpty() || !Forms.isSymbol(items.get(0))) {
            return;
        }
        Node first = items.get(0);
        List<Node> rest = items.subList(1, items.size());
        switch (first.symbolValue().orElseThrow()) {
            case "only_in" -> visitOnlyIn(processed, sexpr.span(), rest);
            case "rename_in" -> visitRenameIn(processed, sexpr.span(), rest);
            case "prefix_in" -> throw FusionException.spanned(first.span(),
                "support for `(require (prefix_in ...))` is not implemented");
            default -> throw FusionException.spanned(first.span(), "invalid argument to require");
        }
    }

    private void visitOnlyIn(ProcessedFile processed, Span span, List<Node> rest) {
        ModuleHandle module = loadModule(requiredModuleName(span, rest));
        var origins = new ArrayList<Origin>();
        for (Node item : rest.subList(1, rest.size())) {
            String name = Forms.strippedSymbol(item).orElseThrow(() ->
                FusionException.spanned(item.span(), "non-symbol found in require only_in list"));
            origins.add(new Origin(name, item.span()));
        }
        processed.requires.add(new RequireForm(module, new RequireType.Names(origins)));
    }

    private void visitRenameIn(ProcessedFile processed, Span span, List<Node> rest) {
        ModuleHandle module = loadModule(requiredModuleName(span, rest));
        var mapping = new TreeMap<String, Origin>();
        for (Node item : rest.subList(1, rest.size())) {
            Sequence pair = Forms.sexpr(item)
                .orElseThrow(() -> FusionException.spanned(item.span(), "expected s-expression"));
            var names = new ArrayList<String>();
            for (Node name : Forms.values(pair)) {
                names.add(Forms.strippedSymbol(name)
                    .orElseThrow(() -> FusionException.spanned(name.span(), "expected symbol")));
            }
            if (names.size() != 2) {
                throw FusionException.spanned(item.span(), "invalid rename_in mapping");
            }
            mapping.put(names.get(0), new Origin(names.get(1), item.span()));
        }
        processed.requires.add(new RequireForm(module, new RequireType.Mapped(mapping)));
    }

    private static String requiredModuleName(Span span, List<Node> rest) {
        return rest.stream()
            .findFirst()
            .flatMap(Forms::stringValue)
            .orElseThrow(() -> FusionException.spanned(span, "missing module name"));
    }

    private void visitProvide(ProcessedFile processed, List<Node> rest) {
        for (Node provided : rest) {
            var symbol = Forms.strippedSymbol(provided);
            if (symbol.isPresent()) {
                processed.provides.put(symbol.get(), provided.span());
                continue;
            }
            if (!provided.isSExpr()) {
                continue;
            }
            List<Node> items = Forms.values(provided);
            if (items.isEmpty()) {
                throw FusionException.spanned(provided.span(), "unexpected s-expression");
            }
            String call = items.get(0).symbolValue().orElse("");
            switch (call) {
                case "all_defined_out" -> processed.allDefinedOut = true;
                case "rename_out" -> visitRenameOut(processed, items.get(0).span(), items.subList(1, items.size()));
                default -> throw FusionException.spanned(provided.span(), "expected all_defined_out or rename_out");
            }
        }
    }

    private static void visitRenameOut(ProcessedFile processed, Span renameOutSpan, List<Node> pairs) {
        if (pairs.isEmpty() || !pairs.get(0).isSExpr()) {
            throw FusionException.spanned(renameOutSpan, "rename_out expected s-expression");
        }
        for (Node pair : pairs) {
            List<Node> names = Forms.values(pair);
            String local = !names.isEmpty() ? names.get(0).symbolValue().orElse(null) : null;
            if (local == null) {
                throw FusionException.spanned(renameOutSpan, "rename_out requires a local name");
            }
            String provided = names.size() > 1 ? names.get(1).symbolValue().orElse(null) : null;
            if (provided == null) {
                throw FusionException.spanned(renameOutSpan, "rename_out requires a provided name");
            }
            processed.renamedOut.add(new Rename(local, provided, pair.span()));
        }
    }

    private static Optional<Name> definedName(List<Node> rest) {
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        Node target = rest.get(0);
        if (target.isSExpr()) {
            List<Node> signature = Forms.values(target);
            if (signature.isEmpty()) {
                return Optional.empty();
            }
            target = signature.get(0);
        }
        Span span = target.span();
        return target.symbolValue().map(text -> new Name(text, span));
    }

    private record Name(String text, Span span) {}

    private record Rename(String local, String provided, Span span) {}

    private static final class ProcessedFile {
        private String language = "";
        private boolean allDefinedOut;
        private final Map<String, Span> defined = new TreeMap<>();
        private final List<RequireForm> requires = new ArrayList<>();
        private final Map<String, Span> provides = new LinkedHashMap<>();
        private final List<Rename> renamedOut = new ArrayList<>();

        private Module toModule(String name, FusionFile file, FusionIndex index) {
            var allProvides = new TreeMap<>(provides);
            if (allDefinedOut) {
                allProvides.putAll(defined);
            }
            for (Rename rename : renamedOut) {
                Span origin = defined.get(rename.local());
                if (origin == null) {
                    origin = requires.stream()
                        .map(require -> require.findOrigin(rename.local(), index))
                        .flatMap(Optional::stream)
                        .findFirst()
                        .orElseThrow(() -> FusionException.spanned(rename.span(),
                            "rename_out of " + rename.local() + ", which is neither defined nor required"));
                }
                allProvides.put(rename.provided(), origin);
            }
            return new Module(name, language, file, requires, allProvides);
        }
    }
}
