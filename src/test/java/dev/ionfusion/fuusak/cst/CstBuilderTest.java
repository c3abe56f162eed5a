package dev.ionfusion.fuusak.cst;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.ionfusion.fuusak.grammar.FusionGrammar;
import dev.ionfusion.fuusak.shared.FusionException;
import java.util.List;
import org.junit.jupiter.api.Test;

class CstBuilderTest {
    @Test
    void splitsBlockCommentLines() {
        assertEquals(List.of("foo"), CstBuilder.blockCommentLines("/* foo */"));
        assertEquals(List.of("", "foo", ""), CstBuilder.blockCommentLines("/**\n * foo\n */"));
        assertEquals(List.of("", "foo", "  bar", ""), CstBuilder.blockCommentLines("/*\n * foo\n *   bar\n */"));
    }

    @Test
    void lineCommentIsFollowedByItsLineBreak() {
        List<Expr> exprs = CstBuilder.parse("t.fusion", "// hi  \n");
        assertEquals(2, exprs.size());
        TextExpr comment = assertInstanceOf(TextExpr.class, exprs.get(0));
        assertEquals(ExprKind.COMMENT_LINE, comment.kind());
        assertEquals("// hi", comment.value());
        assertEquals(1, assertInstanceOf(NewlinesExpr.class, exprs.get(1)).count());
    }

    @Test
    void attachesAnnotationsToValues() {
        List<Expr> exprs = CstBuilder.parse("t.fusion", "a::b::c");
        ValueExpr symbol = assertInstanceOf(ValueExpr.class, exprs.get(0));
        assertEquals(ExprKind.SYMBOL, symbol.kind());
        assertEquals("c", symbol.value());
        assertEquals(List.of("a::", "b::"), symbol.annotations());
    }

    @Test
    void stripsStringDelimiters() {
        List<Expr> exprs = CstBuilder.parse("t.fusion", "\"x\" '''y'''");
        assertEquals(ExprKind.QUOTED_STRING, exprs.get(0).kind());
        assertEquals("x", ((ValueExpr) exprs.get(0)).value());
        assertEquals(ExprKind.MULTILINE_STRING, exprs.get(1).kind());
        assertEquals("y", ((ValueExpr) exprs.get(1)).value());
    }

    @Test
    void keepsAtomsRaw() {
        List<Expr> exprs = CstBuilder.parse("t.fusion", "[0x1F, 1.50, 2007-02-23, 'a b', {{ aGk= }}]");
        List<String> values = exprs.get(0).items().stream().map(expr -> ((ValueExpr) expr).value()).toList();
        assertEquals(List.of("0x1F", "1.50", "2007-02-23", "'a b'", "{{ aGk= }}"), values);
    }

    @Test
    void wrapsStructMembers() {
        List<Expr> exprs = CstBuilder.parse("t.fusion", "{a: 1}");
        SequenceExpr struct = assertInstanceOf(SequenceExpr.class, exprs.get(0));
        assertEquals(ExprKind.STRUCT, struct.kind());
        Expr member = struct.items().get(0);
        assertEquals(ExprKind.STRUCT_MEMBER, member.kind());
        assertEquals(ExprKind.STRUCT_KEY, member.items().get(0).kind());
        assertEquals("a", ((TextExpr) member.items().get(0)).value());
        assertEquals(ExprKind.INTEGER, member.items().get(1).kind());
    }

    @Test
    void keepsOnlyWhitespaceWithLineBreaks() {
        List<Expr> items = CstBuilder.parse("t.fusion", "(a  b\r\n\n c)").get(0).items();
        assertEquals(4, items.size());
        NewlinesExpr newlines = assertInstanceOf(NewlinesExpr.class, items.get(2));
        assertEquals(2, newlines.count());
        assertTrue(items.get(2).isNewlines());
        assertFalse(items.get(1).isNewlines());
    }

    @Test
    void reportsParseErrorsWithLocation() {
        FusionException error = assertThrows(FusionException.class, () -> CstBuilder.parse("x.fusion", "(a"));
        assertTrue(error.getMessage().contains("--> x.fusion:1:3"));
        assertTrue(error.getMessage().endsWith("= expected value or ')'"));
    }

    @Test
    void rejectsNestingBeyondLimit() {
        int limit = FusionGrammar.MAX_DEPTH;
        List<Expr> nested = CstBuilder.parse("deep.fusion", "(".repeat(limit) + ")".repeat(limit));
        assertEquals(1, nested.size());

        String tooDeep = "(".repeat(3000) + ")".repeat(3000);
        FusionException error = assertThrows(FusionException.class, () -> CstBuilder.parse("deep.fusion", tooDeep));
        assertTrue(error.getMessage().contains("--> deep.fusion:1:" + (limit + 1)));
        assertTrue(error.getMessage().endsWith("= nesting deeper than " + limit + " levels"));
    }
}
