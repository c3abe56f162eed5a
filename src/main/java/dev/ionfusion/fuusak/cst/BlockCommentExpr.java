package dev.ionfusion.fuusak.cst;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

public record BlockCommentExpr(Span span, List<String> lines) implements Expr {
    public BlockCommentExpr {
        Objects.requireNonNull(span, "span");
        lines = List.copyOf(lines);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.COMMENT_BLOCK;
    }
}
