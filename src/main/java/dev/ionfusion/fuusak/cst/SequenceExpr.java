package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

/**
 * List, s-expression, struct, clob or struct member with its children in source order.
 */
public record SequenceExpr(ExprKind kind, Span span, List<String> annotations, List<Expr> items) implements Expr {
    public SequenceExpr {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        if (!kind.isSequence()) {
            throw new IllegalArgumentException("Not a sequence kind: " + kind);
        }
        annotations = List.copyOf(annotations);
        items = List.copyOf(items);
    }

    public static SequenceExpr of(ExprKind kind, Span span, List<Expr> items) {
        return new SequenceExpr(kind, span, List.of(), items);
    }

    @Override
    public SequenceExpr withAnnotations(List<String> annotations) {
        if (kind == ExprKind.STRUCT_MEMBER) {
            throw new IllegalStateException("Struct members cannot carry annotations");
        }
        return new SequenceExpr(kind, span, annotations, items);
    }
}
