package dev.ionfusion.fuusak.format;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.ionfusion.fuusak.config.FusionConfig;
import dev.ionfusion.fuusak.config.NewlineMode;
import dev.ionfusion.fuusak.cst.CstBuilder;
import dev.ionfusion.fuusak.ist.IntermediateSyntaxTree;
import dev.ionfusion.fuusak.ist.Node;
import dev.ionfusion.fuusak.ist.Sequence;
import java.util.List;
import org.junit.jupiter.api.Test;

class FormatterTest {
    private static final FusionConfig DEFAULTS = FusionConfig.defaults();
    private static final FusionConfig NO_CHANGE = DEFAULTS.toBuilder().newlineMode(NewlineMode.NO_CHANGE).build();

    private static String format(String source, FusionConfig config) {
        IntermediateSyntaxTree tree = IntermediateSyntaxTree.fromCst(CstBuilder.parse("t.fusion", source));
        return Formatter.render(config, config.newlineFixUpMode() ? FixUp.fixup(tree) : tree);
    }

    private static String format(String source) {
        return format(source, DEFAULTS);
    }

    @Test
    void formatsSimpleForms() {
        assertEquals("(+ 1 2)\n", format("(+   1 2)"));
        assertEquals("[1, 2, 3]\n", format("[1,2,3]"));
        assertEquals("{ foo: 1, bar: 2 }\n", format("{foo:1,bar:2}"));
        assertEquals("{ a: { b: 1 }}\n", format("{a: {b: 1}}"));
        assertEquals("a::b\n", format("a::b"));
        assertEquals("{{ \"a\" }}\n", format("{{\"a\"}}"));
    }

    @Test
    void leavesFormattedCodeAlone() {
        String source = "(define (foo x)\n  (+ x 1))\n";
        assertEquals(source, format(source));
        assertEquals("// hi\n(a)\n", format("// hi\n(a)\n"));
        assertEquals("(a)\n\n\n(b)\n", format("(a)\n\n\n(b)\n"));
    }

    @Test
    void alignsUnderFirstArgument() {
        assertEquals("(foo a\n     b)\n", format("(foo a\nb)"));
        assertEquals("(if a\n    b\n    c)\n", format("(if a\nb\nc)"));
    }

    @Test
    void switchesSmartIndentToFixedForLongBodies() {
        assertEquals("(if a\n  b\n  c\n  d\n  e)\n", format("(if a\nb\nc\nd\ne)"));
    }

    @Test
    void usesConfiguredFixedIndentSymbols() {
        FusionConfig config = DEFAULTS.toBuilder().fixedIndentSymbols(List.of("foo")).build();
        assertEquals("(foo a\n  b)\n", format("(foo a\nb)", config));
        assertEquals("(define a\n        b)\n", format("(define a\nb)", config));
    }

    @Test
    void indentsFormsWithoutLeadingSymbol() {
        assertEquals("(1 2\n 3)\n", format("(1 2\n3)"));
        assertEquals("((a) b\n  c)\n", format("((a) b\nc)"));
    }

    @Test
    void printsLambdaArgumentListsTight() {
        assertEquals("(|x y| (+ x y))\n", format("(|x y|   (+ x y))"));
    }

    @Test
    void keepsBlankLinesInsideForms() {
        assertEquals("(foo\n\n  a b)\n", format("(foo\n\n  a b\n)"));
        assertEquals("(foo\n\n  a b\n  )\n", format("(foo\n\n  a b\n)", NO_CHANGE));
        assertEquals("[1,\n\n\n\n 2]\n", format("[\n\n\n1,\n\n\n\n2\n\n\n]"));
    }

    @Test
    void indentsStructKeys() {
        assertEquals("{ foo: 1,\n  bar: 2 }\n", format("{\n  foo: 1,\n  bar: 2\n}"));
    }

    @Test
    void rendersComments() {
        assertEquals("/* hi */\n", format("/*    hi */"));
        assertEquals("/*\n * foo\n */\n", format("/**\n * foo\n */"));
        assertEquals("(a // c\n  )\n", format("(a // c\n)"));
    }

    @Test
    void reindentsMultilineStrings() {
        String formatted = format("(a '''\nfoo\n  bar\n''')");
        assertEquals("(a '''\n   foo\n     bar\n   ''')\n", formatted);
        assertEquals(formatted, format(formatted));
    }

    @Test
    void separatesTopLevelValuesOnOneLine() {
        assertEquals("a b\n", format("a b"));
        assertEquals("1 2\n", format("1   2"));
        assertEquals("(a) b\n", format("(a)b"));
        assertEquals("'''a''' '''b'''\n", format("'''a''' '''b'''"));
        assertEquals("/* c */ a\n", format("/* c */a"));
        assertEquals("(a) // c\n(b)\n", format("(a) // c\n(b)"));

        String atoms = "0x1F 1_000 -5 1.5e3 +inf nan";
        String formatted = format(atoms);
        assertEquals(atoms + "\n", formatted);
        assertEquals(6, CstBuilder.parse("t.fusion", formatted).stream().filter(expr -> !expr.isNewlines()).count());
    }

    @Test
    void placesCommasAroundComments() {
        assertEquals("[1, // c\n 2]\n", format("[1, // c\n2]"));
        assertEquals("[1, // c\n 2]\n", format("[1 // c\n, 2]"));
        assertEquals("{ a: // c\n    1, b: 2 }\n", format("{a: // c\n1, b: 2}"));
        assertEquals("{ a: 1, // c\n  b: 2 }\n", format("{a: 1, // c\nb: 2}"));
    }

    @Test
    void keepsMultilineStringWithTextOnOpeningLineStable() {
        String once = format("(a '''x\n   y''' b)");
        assertEquals("(a '''x\n   y''' b)\n", once);
        assertEquals(once, format(once));
        assertEquals("(a '''x\n   y\n     z''')\n", format("(a '''x\n      y\n        z''')"));
    }

    @Test
    void isIdempotent() {
        List<String> sources = List.of(
            "(define (foo x)\n(if x\n(bar x)\n(baz x)))",
            "{a: [1,\n2], b: {c: \"d\"}}",
            "(a\n  (b\n    c))\n// trailing\n",
            "[\n\n\n1,\n\n\n\n2\n\n\n]"
        );
        for (String source : sources) {
            String once = format(source);
            assertEquals(once, format(once), source);
        }
    }

    @Test
    void bindsWhitespaceAroundArgumentLists() {
        Sequence lambda = (Sequence) IntermediateSyntaxTree.fromCst(CstBuilder.parse("t.fusion", "(|x| x)"))
            .expressions().get(0);
        List<Node> items = lambda.items();
        assertArrayEquals(new boolean[] {false, false, true, false}, Formatter.bindWhitespace(items));
    }
}
