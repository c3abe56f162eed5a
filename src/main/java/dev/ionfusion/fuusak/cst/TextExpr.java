package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

/**
 * Line comment (raw text including {@code //}) or struct key (raw key text).
 */
public record TextExpr(ExprKind kind, Span span, String value) implements Expr {
    public TextExpr {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
        if (kind != ExprKind.COMMENT_LINE && kind != ExprKind.STRUCT_KEY) {
            throw new IllegalArgumentException("Not a text kind: " + kind);
        }
    }
}
