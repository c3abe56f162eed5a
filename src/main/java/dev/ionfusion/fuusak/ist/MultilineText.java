package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import dev.ionfusion.fuusak.shared.TextUtil;
import java.util.List;
import java.util.Objects;

/**
 * {@code '''...'''} string; {@code value} excludes the delimiters.
 */
public record MultilineText(Span span, List<String> annotations, String value) implements Node {
    public MultilineText {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(value, "value");
        annotations = List.copyOf(annotations);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MULTILINE_STRING;
    }

    @Override
    public int countNewlines() {
        return TextUtil.countNewlines(value);
    }
}
