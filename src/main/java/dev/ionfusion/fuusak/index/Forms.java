package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.ist.Atom;
import dev.ionfusion.fuusak.ist.AtomicType;
import dev.ionfusion.fuusak.ist.MultilineText;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import java.util.List;
import java.util.Optional;

/**
 * Accessors for reading Fusion forms out of the intermediate syntax tree.
 */
public final class Forms {
    private Forms() {}

    /**
     * Items of a sequence without comments, newline runs and struct keys; empty for anything else.
     */
    public static List<Node> values(Node node) {
        if (node instanceof Sequence sequence) {
            return sequence.items().stream().filter(Node::isValue).toList();
        }
        return List.of();
    }

    public static boolean isSymbol(Node node) {
        return node.symbolValue().isPresent();
    }

    /**
     * Symbol text with the quotes of a {@code 'quoted symbol'} removed.
     */
    public static Optional<String> strippedSymbol(Node node) {
        return node.symbolValue().map(Forms::stripQuotes);
    }

    public static Optional<String> stringValue(Node node) {
        if (node instanceof Atom atom && atom.type() == AtomicType.QUOTED_STRING) {
            return Optional.of(atom.value());
        }
        if (node instanceof MultilineText text) {
            return Optional.of(text.value());
        }
        return Optional.empty();
    }

    public static Optional<Sequence> sexpr(Node node) {
        return node.isSExpr() ? Optional.of((Sequence) node) : Optional.empty();
    }

    static String stripQuotes(String symbol) {
        if (symbol.length() >= 2 && symbol.startsWith("'") && symbol.endsWith("'")) {
            return symbol.substring(1, symbol.length() - 1);
        }
        return symbol;
    }
}
