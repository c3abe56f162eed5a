package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

/**
 * Run of whitespace containing {@code count} line breaks.
 */
public record NewlinesExpr(Span span, int count) implements Expr {
    public NewlinesExpr {
        Objects.requireNonNull(span, "span");
        if (count < 1) {
            throw new IllegalArgumentException("Newline runs hold at least one line break");
        }
    }

    @Override
    public ExprKind kind() {
        return ExprKind.NEWLINES;
    }
}
