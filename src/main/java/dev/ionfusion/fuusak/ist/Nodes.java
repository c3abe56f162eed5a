package dev.ionfusion.fuusak.ist;

import java.util.List;
import java.util.function.Predicate;

/**
 * Counting helpers over child lists.
 */
public final class Nodes {
    private Nodes() {}

    public static int countNewlines(List<? extends Node> nodes) {
        return nodes.stream().mapToInt(Node::countNewlines).sum();
    }

    /**
     * Number of items that are neither comments nor newline runs before the first newline run.
     */
    public static int countItemsBeforeNewline(List<? extends Node> nodes) {
        return countUntil(nodes, Node::isNotCommentOrNewlines, Node::isNewlines);
    }

    /**
     * Counts items matching {@code counted}, stopping at the first item matching {@code until}.
     */
    public static int countUntil(List<? extends Node> nodes, Predicate<Node> counted, Predicate<Node> until) {
        int count = 0;
        for (Node node : nodes) {
            if (until.test(node)) {
                break;
            }
            if (counted.test(node)) {
                count++;
            }
        }
        return count;
    }
}
