package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

public record BlockComment(Span span, List<String> lines) implements Node {
    public BlockComment {
        Objects.requireNonNull(span, "span");
        lines = List.copyOf(lines);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK_COMMENT;
    }

    @Override
    public int countNewlines() {
        return lines.size();
    }
}
