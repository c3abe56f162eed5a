package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Atom(AtomicType type, Span span, List<String> annotations, String value) implements Node {
    public Atom {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
        annotations = List.copyOf(annotations);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATOM;
    }

    @Override
    public int countNewlines() {
        return 0;
    }

    @Override
    public Optional<String> symbolValue() {
        return type == AtomicType.SYMBOL ? Optional.of(value) : Optional.empty();
    }
}
