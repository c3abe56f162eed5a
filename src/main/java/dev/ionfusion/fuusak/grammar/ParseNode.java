package dev.ionfusion.fuusak.grammar;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Objects;

/**
 * Node of the generic parse tree: the rule that matched, the matched range and the nested matches.
 */
public record ParseNode(Rule rule, Span span, List<ParseNode> children) {
    public ParseNode {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(span, "span");
        children = List.copyOf(children);
    }

    public String text(String source) {
        return span.text(source);
    }

    public ParseNode child(int index) {
        return children.get(index);
    }
}
