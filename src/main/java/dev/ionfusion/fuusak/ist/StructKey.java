package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

public record StructKey(Span span, String value) implements Node {
    public StructKey {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRUCT_KEY;
    }

    @Override
    public int countNewlines() {
        return 0;
    }
}
