package dev.ionfusion.fuusak.format;

import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.ist.Newlines;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes newline runs inside lists, s-expressions and structs. Top-level runs are left alone.
 *
 * <ul>
 *   <li>a form holding only newline runs becomes empty;</li>
 *   <li>a leading newline run is dropped;</li>
 *   <li>a trailing newline run is dropped unless a line comment precedes it;</li>
 *   <li>a nested form whose body starts on a new line is moved onto its own line.</li>
 * </ul>
 */
public final class FixUp {
    private FixUp() {}

    public static IntermediateSyntaxTree fixup(IntermediateSyntaxTree tree) {
        return new IntermediateSyntaxTree(tree.expressions().stream().map(FixUp::fixupNode).toList());
    }

    static Node fixupNode(Node node) {
        if (!(node instanceof Sequence sequence)) {
            return node;
        }
        List<Node> items = new ArrayList<>(clearEmpty(sequence.items()));
        fixupItems(items);

        List<Node> fixed = new ArrayList<>(items.size());
        for (Node item : items) {
            boolean lastIsNewlines = fixed.isEmpty() || fixed.get(fixed.size() - 1).isNewlines();
            if (item instanceof Sequence child) {
                List<Node> childItems = new ArrayList<>(child.items());
                if (fixupItems(childItems) && !lastIsNewlines) {
                    fixed.add(new Newlines(child.span(), 1));
                }
                fixed.add(fixupNode(child.withItems(childItems)));
            } else {
                fixed.add(item);
            }
        }
        return sequence.withItems(fixed);
    }

    private static List<Node> clearEmpty(List<Node> items) {
        return items.stream().allMatch(Node::isNewlines) ? List.of() : items;
    }

    /**
     * Drops the leading and trailing newline runs of {@code items} in place.
     *
     * @return whether the form had values and started with a newline run
     */
    static boolean fixupItems(List<Node> items) {
        boolean hasValues = items.stream().anyMatch(Node::isNotCommentOrNewlines);
        boolean startsWithNewline = !items.isEmpty() && items.get(0).isNewlines();
        boolean addPrecedingNewline = hasValues && startsWithNewline;

        if (startsWithNewline) {
            items.remove(0);
        }
        int size = items.size();
        if (size >= 2 && !items.get(size - 2).isCommentLine() && items.get(size - 1).isNewlines()) {
            items.remove(size - 1);
        }
        return addPrecedingNewline;
    }
}
