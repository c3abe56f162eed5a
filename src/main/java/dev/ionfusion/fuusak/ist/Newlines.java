package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

public record Newlines(Span span, int count) implements Node {
    public Newlines {
        Objects.requireNonNull(span, "span");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NEWLINES;
    }

    @Override
    public int countNewlines() {
        return count;
    }
}
