package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

/**
 * Character large object; parts are quoted-string atoms, multi-line strings and newline runs.
 */
public record Clob(Span span, List<String> annotations, List<Node> parts) implements Node {
    public Clob {
        Objects.requireNonNull(span, "span");
        annotations = List.copyOf(annotations);
        parts = List.copyOf(parts);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLOB;
    }

    @Override
    public int countNewlines() {
        return Nodes.countNewlines(parts);
    }
}
