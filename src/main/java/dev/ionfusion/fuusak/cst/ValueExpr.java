package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

/**
 * Atomic value or multi-line string; {@code value} is the raw source text without string delimiters.
 */
public record ValueExpr(ExprKind kind, Span span, List<String> annotations, String value) implements Expr {
    public ValueExpr {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
        if (!kind.isAtomic() && kind != ExprKind.MULTILINE_STRING) {
            throw new IllegalArgumentException("Not a value kind: " + kind);
        }
        annotations = List.copyOf(annotations);
    }

    public static ValueExpr of(ExprKind kind, Span span, String value) {
        return new ValueExpr(kind, span, List.of(), value);
    }

    @Override
    public ValueExpr withAnnotations(List<String> annotations) {
        return new ValueExpr(kind, span, annotations, value);
    }
}
