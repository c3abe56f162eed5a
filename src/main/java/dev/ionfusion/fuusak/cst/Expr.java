package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;

/**
 * Node of the concrete syntax tree. Comments and newline runs are nodes too, in source order.
 */
public interface Expr {
    ExprKind kind();

    Span span();

    default List<String> annotations() {
        return List.of();
    }

    /**
     * Children of a compound node, including comments and newline runs.
     */
    default List<Expr> items() {
        return List.of();
    }

    default Expr withAnnotations(List<String> annotations) {
        throw new IllegalStateException(kind() + " cannot carry annotations");
    }

    default boolean isNewlines() {
        return kind() == ExprKind.NEWLINES;
    }
}
