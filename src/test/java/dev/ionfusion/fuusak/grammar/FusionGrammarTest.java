package dev.ionfusion.fuusak.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import java.util.List;
import org.junit.jupiter.api.Test;

class FusionGrammarTest {
    @Test
    void matchesNulls() {
        assertMatches(Rule.NULL, "null");
        assertMatches(Rule.NULL, "null.struct");
        assertRejects(Rule.NULL, "null.foo");
        assertRejects(Rule.NULL, "nullable");
    }

    @Test
    void matchesBooleans() {
        assertMatches(Rule.BOOLEAN, "true");
        assertMatches(Rule.BOOLEAN, "false");
        assertRejects(Rule.BOOLEAN, "trueish");
    }

    @Test
    void matchesNumbers() {
        assertMatches(Rule.INTEGER, "123");
        assertMatches(Rule.INTEGER, "-1_000");
        assertMatches(Rule.INTEGER, "0xBEEF");
        assertMatches(Rule.INTEGER, "0b1010");
        assertRejects(Rule.INTEGER, "123abc");
        assertMatches(Rule.REAL, "1.5e3");
        assertMatches(Rule.REAL, "-0.25");
        assertMatches(Rule.REAL, "1d-2");
        assertMatches(Rule.REAL, "nan");
        assertMatches(Rule.REAL, "+inf");
        assertRejects(Rule.REAL, "12");
    }

    @Test
    void matchesTimestamps() {
        assertMatches(Rule.TIMESTAMP, "2007T");
        assertMatches(Rule.TIMESTAMP, "2007-02T");
        assertMatches(Rule.TIMESTAMP, "2007-02-23");
        assertMatches(Rule.TIMESTAMP, "2007-02-23T12:14Z");
        assertMatches(Rule.TIMESTAMP, "2007-02-23T12:14:33.079-08:00");
        assertRejects(Rule.TIMESTAMP, "2007");
    }

    @Test
    void matchesSymbols() {
        assertMatches(Rule.SYMBOL, "$foo_1");
        assertMatches(Rule.SYMBOL, "'hello world'");
        assertMatches(Rule.SYMBOL, "+");
        assertMatches(Rule.SYMBOL, "<=");
        assertRejects(Rule.SYMBOL, "1abc");
    }

    @Test
    void matchesStringsAndLobs() {
        assertMatches(Rule.SHORT_STRING, "\"a \\\" b\"");
        assertMatches(Rule.LONG_STRING, "'''multi\nline'''");
        assertMatches(Rule.BLOB, "{{ aGVsbG8= }}");
        assertMatches(Rule.CLOB, "{{ \"abc\" }}");
        assertRejects(Rule.SHORT_STRING, "\"open");
        assertRejects(Rule.CLOB, "{{ }}");
    }

    @Test
    void keepsClobWhitespace() {
        ParseNode clob = FusionGrammar.parse(Rule.CLOB, "{{ \"a\"\n '''b''' }}");
        List<Rule> rules = clob.children().stream().map(ParseNode::rule).toList();
        assertEquals(List.of(Rule.WHITESPACE, Rule.SHORT_STRING, Rule.WHITESPACE, Rule.LONG_STRING, Rule.WHITESPACE),
            rules);
    }

    @Test
    void matchesContainers() {
        assertMatches(Rule.LIST, "[1, 2, 3]");
        assertMatches(Rule.LIST, "[1, 2,]");
        assertMatches(Rule.STRUCTURE, "{a: 1, 'b': 2, \"c\": 3}");
        assertMatches(Rule.SEXPR, "(a (b c) [d] {e: f})");
        assertRejects(Rule.LIST, "[1 2]");
        assertRejects(Rule.STRUCTURE, "{a 1}");
    }

    @Test
    void matchesAnnotations() {
        ParseNode expr = FusionGrammar.parse(Rule.EXPR, "a::'b'::c");
        assertEquals(2, expr.children().size());
        assertEquals(Rule.ANNOTATIONS, expr.child(0).rule());
        assertEquals(2, expr.child(0).children().size());
        assertEquals(Rule.SYMBOL, expr.child(1).rule());
    }

    @Test
    void matchesComments() {
        assertMatches(Rule.LINE_COMMENT, "// hello");
        assertMatches(Rule.BLOCK_COMMENT, "/* a\n b */");
        ParseNode line = FusionGrammar.parse(Rule.ANY_COMMENT, "// hi\n(a)");
        assertEquals(new Span(0, 6), line.span());
    }

    @Test
    void keepsTriviaInFiles() {
        ParseNode file = FusionGrammar.parseFile("// c\n(a) /* b */\n");
        List<Rule> rules = file.children().stream().map(ParseNode::rule).toList();
        assertEquals(List.of(Rule.LINE_COMMENT, Rule.EXPR, Rule.WHITESPACE, Rule.BLOCK_COMMENT, Rule.WHITESPACE),
            rules);
    }

    @Test
    void reportsFurthestFailure() {
        FusionException error = assertThrows(FusionException.class, () -> FusionGrammar.parseFile("(a"));
        assertEquals("expected value or ')'", error.getMessage());
        assertEquals(new Span(2, 2), error.span().orElseThrow());
    }

    private static void assertMatches(Rule rule, String input) {
        ParseNode node = FusionGrammar.parse(rule, input);
        assertEquals(new Span(0, input.length()), node.span(), () -> rule + " should match all of " + input);
    }

    private static void assertRejects(Rule rule, String input) {
        int matched;
        try {
            matched = FusionGrammar.parse(rule, input).span().end();
        } catch (FusionException ex) {
            return;
        }
        assertEquals(-1, matched, () -> rule + " should not match " + input);
    }
}
