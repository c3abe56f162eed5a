package dev.ionfusion.fuusak.check;

import dev.ionfusion.fuusak.api.FusionFile;
import dev.ionfusion.fuusak.index.Forms;
import dev.ionfusion.fuusak.index.FusionIndex;
import dev.ionfusion.fuusak.index.Module;
import dev.ionfusion.fuusak.index.Script;
import dev.ionfusion.fuusak.ist.Atom;
import dev.ionfusion.fuusak.ist.AtomicType;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reports symbols that are used without being bound.
 *
 * <p>Each file is walked twice against the same scope: the first walk only collects top-level
 * definitions so that uses may precede definitions, the second reports.
 */
public final class UnboundChecker {
    private static final Set<String> DEFINE_FORMS = Set.of("define", "define_syntax", "defpub", "defpub_j", "defpub_syntax");

    private final FusionIndex index;

    public UnboundChecker(FusionIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    public List<FusionException> check(Module module) {
        return check(List.of(module.file()), new BindingEnv(allProvides(module, new HashSet<>())).scope());
    }

    public List<FusionException> check(Script script) {
        var initial = new HashSet<String>();
        for (String moduleName : script.topLevelModules()) {
            index.findModule(moduleName).ifPresent(handle -> initial.addAll(allProvides(index.module(handle), new HashSet<>())));
        }
        initial.addAll(script.globalBindings());
        return check(script.files(), new BindingEnv(initial).scope());
    }

    private List<FusionException> check(List<FusionFile> files, Scope scope) {
        for (FusionFile file : files) {
            new FileChecker(file).checkAll(scope);
        }
        var errors = new ArrayList<FusionException>();
        for (FusionFile file : files) {
            errors.addAll(new FileChecker(file).checkAll(scope));
        }
        return errors;
    }

    /**
     * Provides of {@code module} and of its language chain down to the kernel.
     */
    private Set<String> allProvides(Module module, Set<String> visited) {
        var provides = new HashSet<>(module.provides().keySet());
        if (visited.add(module.name()) && module.hasLanguage()) {
            index.findModule(module.language())
                .map(index::module)
                .ifPresent(language -> provides.addAll(allProvides(language, visited)));
        }
        return provides;
    }

    private final class FileChecker {
        private final FusionFile file;
        private final ErrorTracker errors;

        private FileChecker(FusionFile file) {
            this.file = file;
            this.errors = new ErrorTracker(file);
        }

        private List<FusionException> checkAll(Scope scope) {
            for (Node node : file.ist().expressions()) {
                check(node, scope, false);
            }
            return errors.errors();
        }

        private void check(Node node, Scope scope, boolean quoted) {
            if (node instanceof Atom atom && atom.type() == AtomicType.SYMBOL) {
                if (!quoted && !scope.contains(Forms.strippedSymbol(atom).orElseThrow())) {
                    errors.unboundIdentifier(atom.value(), atom.span());
                }
            } else if (node.isSExpr()) {
                checkSExpr((Sequence) node, scope, quoted);
            } else if (node.isSequence()) {
                Forms.values(node).forEach(item -> check(item, scope, quoted));
            }
        }

        private void checkSExpr(Sequence sexpr, Scope scope, boolean quoted) {
            List<Node> items = Forms.values(sexpr);
            if (items.isEmpty()) {
                return;
            }
            Node first = items.get(0);
            List<Node> rest = items.subList(1, items.size());
            var call = Forms.strippedSymbol(first);
            if (call.isEmpty()) {
                items.forEach(item -> check(item, scope, quoted));
                return;
            }
            if (quoted) {
                boolean unquote = call.get().equals("unquote");
                rest.forEach(item -> check(item, scope, !unquote));
                return;
            }
            String name = call.get();
            if (DEFINE_FORMS.contains(name)) {
                checkDefine(rest, scope);
                return;
            }
            switch (name) {
                case "lambda" -> checkLambda(rest, scope);
                case "let" -> checkLet(rest, scope, false);
                case "lets" -> checkLet(rest, scope, true);
                case "module" -> rest.stream().skip(2).forEach(item -> check(item, scope, false));
                case "provide" -> checkProvide(rest, scope);
                case "require" -> checkRequire(rest, scope);
                case "quasiquote" -> rest.forEach(item -> check(item, scope, true));
                case "quote" -> {
                }
                case "|" -> checkPipeLambda(rest, scope);
                default -> {
                    if (!scope.contains(name)) {
                        errors.unboundIdentifier(first.symbolValue().orElseThrow(), first.span());
                    }
                    rest.forEach(item -> check(item, scope, false));
                }
            }
        }

        private void checkDefine(List<Node> rest, Scope scope) {
            if (rest.isEmpty()) {
                return;
            }
            Scope inner = scope.newScope();
            Node target = rest.get(0);
            var name = Forms.strippedSymbol(target);
            if (name.isPresent()) {
                inner.bindTopLevel(name.get());
            } else if (target.isSExpr()) {
                List<Node> signature = Forms.values(target);
                if (!signature.isEmpty() && Forms.isSymbol(signature.get(0))) {
                    inner.bindTopLevel(Forms.strippedSymbol(signature.get(0)).orElseThrow());
                    bindSymbols(signature.subList(1, signature.size()), inner);
                }
            }
            rest.subList(1, rest.size()).forEach(item -> check(item, inner, false));
        }

        private void checkLambda(List<Node> rest, Scope scope) {
            if (rest.isEmpty()) {
                return;
            }
            Scope inner = scope.newScope();
            Node parameters = rest.get(0);
            var name = Forms.strippedSymbol(parameters);
            if (name.isPresent()) {
                inner.bind(name.get());
            } else if (parameters.isSExpr()) {
                bindSymbols(Forms.values(parameters), inner);
            }
            rest.subList(1, rest.size()).forEach(item -> check(item, inner, false));
        }

        /**
         * {@code let} evaluates every initializer in the enclosing scope, {@code lets} in the scope that
         * already holds the earlier bindings.
         */
        private void checkLet(List<Node> rest, Scope scope, boolean sequential) {
            if (rest.isEmpty()) {
                return;
            }
            Scope inner = scope.newScope();
            Node bindings = rest.get(0);
            if (bindings.isSequence()) {
                for (Node binding : Forms.values(bindings)) {
                    if (!binding.isSExpr()) {
                        continue;
                    }
                    List<Node> definition = Forms.values(binding);
                    if (definition.size() > 1) {
                        Forms.strippedSymbol(definition.get(0)).ifPresent(inner::bind);
                    }
                    Scope initializerScope = sequential ? inner : scope;
                    definition.stream().skip(1).forEach(item -> check(item, initializerScope, false));
                }
            }
            rest.subList(1, rest.size()).forEach(item -> check(item, inner, false));
        }

        private void checkPipeLambda(List<Node> rest, Scope scope) {
            Scope inner = scope.newScope();
            boolean inArguments = true;
            for (Node item : rest) {
                if (inArguments && Forms.isSymbol(item)) {
                    String symbol = Forms.strippedSymbol(item).orElseThrow();
                    if (symbol.equals("|")) {
                        inArguments = false;
                    } else {
                        inner.bind(symbol);
                    }
                } else if (!inArguments) {
                    check(item, inner, false);
                }
            }
        }

        private void checkProvide(List<Node> rest, Scope scope) {
            for (Node provided : rest) {
                if (Forms.isSymbol(provided)) {
                    check(provided, scope, false);
                } else if (provided.isSExpr()) {
                    List<Node> items = Forms.values(provided);
                    boolean renameOut = !items.isEmpty()
                        && items.get(0).symbolValue().filter("rename_out"::equals).isPresent();
                    if (renameOut) {
                        items.stream().skip(1)
                            .map(Forms::values)
                            .filter(pair -> !pair.isEmpty())
                            .forEach(pair -> check(pair.get(0), scope, false));
                    }
                }
            }
        }

        private void checkRequire(List<Node> rest, Scope scope) {
            for (Node argument : rest) {
                if (argument instanceof Atom atom && atom.type() == AtomicType.QUOTED_STRING) {
                    var module = index.findModule(atom.value());
                    if (module.isPresent()) {
                        index.module(module.get()).provides().keySet().forEach(scope::bind);
                    } else {
                        errors.customError("cannot find module named " + atom.value(), atom.span());
                    }
                } else if (argument.isSExpr()) {
                    checkRequireSExpr((Sequence) argument, scope);
                } else {
                    errors.customError("arguments to require must be string or s-expr", argument.span());
                }
            }
        }

        private void checkRequireSExpr(Sequence sexpr, Scope scope) {
            List<Node> items = Forms.values(sexpr);
            if (items.isEmpty() || !Forms.isSymbol(items.get(0))) {
                return;
            }
            Node first = items.get(0);
            List<Node> rest = items.subList(1, items.size());
            switch (first.symbolValue().orElseThrow()) {
                case "only_in" -> checkOnlyIn(rest, sexpr.span(), scope);
                case "rename_in" -> checkRenameIn(rest, sexpr.span(), scope);
                case "prefix_in" -> errors.customError(
                    "support for `(require (prefix_in ...))` is not implemented", first.span());
                default -> errors.customError("invalid argument to require", first.span());
            }
        }

        private void checkOnlyIn(List<Node> rest, Span span, Scope scope) {
            if (rest.isEmpty()) {
                errors.customError("expected module name in only_in", span);
                return;
            }
            for (Node item : rest.subList(1, rest.size())) {
                var name = Forms.strippedSymbol(item);
                if (name.isPresent()) {
                    scope.bindTopLevel(name.get());
                } else {
                    errors.customError("expected symbol", item.span());
                }
            }
        }

        private void checkRenameIn(List<Node> rest, Span span, Scope scope) {
            if (rest.isEmpty()) {
                errors.customError("expected module name in rename_in", span);
                return;
            }
            if (rest.size() == 1) {
                errors.customError("expected s-expression after module name", rest.get(0).span());
                return;
            }
            for (Node item : rest.subList(1, rest.size())) {
                if (!item.isSExpr()) {
                    errors.customError("expected s-expression", item.span());
                    continue;
                }
                List<Node> pair = Forms.values(item);
                var to = pair.size() == 2 ? Forms.strippedSymbol(pair.get(1)) : Optional.<String>empty();
                if (pair.size() != 2 || Forms.strippedSymbol(pair.get(0)).isEmpty() || to.isEmpty()) {
                    errors.customError("expected two symbols in rename_in pair", item.span());
                } else {
                    scope.bind(to.get());
                }
            }
        }

        private void bindSymbols(List<Node> nodes, Scope scope) {
            for (Node node : nodes) {
                Forms.strippedSymbol(node).ifPresent(scope::bind);
            }
        }
    }
}
