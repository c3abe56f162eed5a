package dev.ionfusion.fuusak.ist;

import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import java.util.Optional;

/**
 * Node of the intermediate syntax tree, the formatter's input.
 */
public interface Node {
    NodeKind kind();

    Span span();

    /**
     * Line breaks held by this node and its descendants.
     */
    int countNewlines();

    default List<String> annotations() {
        return List.of();
    }

    default boolean isNewlines() {
        return kind() == NodeKind.NEWLINES;
    }

    default boolean isComment() {
        return kind() == NodeKind.LINE_COMMENT || kind() == NodeKind.BLOCK_COMMENT;
    }

    default boolean isCommentLine() {
        return kind() == NodeKind.LINE_COMMENT;
    }

    default boolean isStructKey() {
        return kind() == NodeKind.STRUCT_KEY;
    }

    default boolean isNotCommentOrNewlines() {
        return !isComment() && !isNewlines();
    }

    /**
     * True for nodes that are printed as values: everything but comments, newline runs and struct keys.
     */
    default boolean isValue() {
        return isNotCommentOrNewlines() && !isStructKey();
    }

    default boolean isSExpr() {
        return kind() == NodeKind.SEXPR;
    }

    default boolean isStruct() {
        return kind() == NodeKind.STRUCT;
    }

    /**
     * True for lists, s-expressions and structs.
     */
    default boolean isSequence() {
        return kind() == NodeKind.LIST || kind() == NodeKind.SEXPR || kind() == NodeKind.STRUCT;
    }

    default Optional<String> symbolValue() {
        return Optional.empty();
    }
}
