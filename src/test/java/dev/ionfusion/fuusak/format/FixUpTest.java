package dev.ionfusion.fuusak.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ionfusion.fuusak.cst.CstBuilder;
import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.NodeKind;
import dev.ionfusion.fuusak.ist.Sequence;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FixUpTest {
    private static Sequence fixFirst(String source) {
        IntermediateSyntaxTree tree = IntermediateSyntaxTree.fromCst(CstBuilder.parse("t.fusion", source));
        return (Sequence) FixUp.fixup(tree).expressions().get(0);
    }

    private static List<NodeKind> kinds(List<Node> nodes) {
        return nodes.stream().map(Node::kind).toList();
    }

    @Test
    void emptiesFormsHoldingOnlyNewlines() {
        assertTrue(fixFirst("(\n\n)").items().isEmpty());
        assertTrue(fixFirst("[\n]").items().isEmpty());
    }

    @Test
    void dropsLeadingAndTrailingNewlines() {
        Sequence list = fixFirst("[\n1,\n2\n]");
        assertEquals(List.of(NodeKind.ATOM, NodeKind.NEWLINES, NodeKind.ATOM), kinds(list.items()));
    }

    @Test
    void keepsNewlineAfterTrailingLineComment() {
        Sequence sexpr = fixFirst("(a // c\n)");
        assertEquals(List.of(NodeKind.ATOM, NodeKind.LINE_COMMENT, NodeKind.NEWLINES), kinds(sexpr.items()));
    }

    @Test
    void movesNestedFormsStartingOnNewLine() {
        Sequence outer = fixFirst("(a (\nb))");
        assertEquals(List.of(NodeKind.ATOM, NodeKind.NEWLINES, NodeKind.SEXPR), kinds(outer.items()));
        Sequence inner = (Sequence) outer.items().get(2);
        assertEquals(List.of(NodeKind.ATOM), kinds(inner.items()));
    }

    @Test
    void doesNotDoubleNewlinesBeforeNestedForm() {
        Sequence outer = fixFirst("(a\n(\nb))");
        assertEquals(List.of(NodeKind.ATOM, NodeKind.NEWLINES, NodeKind.SEXPR), kinds(outer.items()));
    }

    @Test
    void leavesTopLevelNewlinesAlone() {
        IntermediateSyntaxTree tree = IntermediateSyntaxTree.fromCst(CstBuilder.parse("t.fusion", "\n\n(a)\n\n"));
        assertEquals(
            List.of(NodeKind.NEWLINES, NodeKind.SEXPR, NodeKind.NEWLINES),
            kinds(FixUp.fixup(tree).expressions()));
    }

    @Test
    void isIdempotent() {
        for (String source : List.of("(a (\nb))", "[\n\n1,\n2\n\n]", "(a // c\n)", "{\n a: (\n b)\n}")) {
            IntermediateSyntaxTree once = FixUp.fixup(
                IntermediateSyntaxTree.fromCst(CstBuilder.parse("t.fusion", source)));
            assertEquals(once, FixUp.fixup(once), source);
        }
    }

    @Test
    void reportsWhetherFormStartedOnNewLine() {
        List<Node> items = new ArrayList<>(fixFirst("[1]").items());
        assertFalse(FixUp.fixupItems(items));
        assertEquals(1, items.size());
    }
}
