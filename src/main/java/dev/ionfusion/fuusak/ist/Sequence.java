package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

/**
 * List, s-expression or struct. Struct items interleave keys, values, comments and newline runs.
 */
public record Sequence(NodeKind kind, Span span, List<String> annotations, List<Node> items) implements Node {
    public Sequence {
        Objects.requireNonNull(span, "span");
        if (kind != NodeKind.LIST && kind != NodeKind.SEXPR && kind != NodeKind.STRUCT) {
            throw new IllegalArgumentException("Not a sequence kind: " + kind);
        }
        annotations = List.copyOf(annotations);
        items = List.copyOf(items);
    }

    public Sequence withItems(List<Node> newItems) {
        return new Sequence(kind, span, annotations, newItems);
    }

    @Override
    public int countNewlines() {
        return Nodes.countNewlines(items);
    }
}
