package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

public record LineComment(Span span, String value) implements Node {
    public LineComment {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LINE_COMMENT;
    }

    @Override
    public int countNewlines() {
        return 1;
    }
}
