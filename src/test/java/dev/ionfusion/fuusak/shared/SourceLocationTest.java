package dev.ionfusion.fuusak.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SourceLocationTest {
    @Test
    void resolvesLineAndColumn() {
        SourceLocation location = SourceLocation.of("(a)\n(bcd e)\n", 6);
        assertEquals(2, location.line());
        assertEquals(3, location.column());
        assertEquals("(bcd e)", location.lineText());
    }

    @Test
    void rendersSnippetWithMarker() {
        String source = "(a)\n(triple 2)\n";
        String message = SourceLocation.describe("test.fusion", source, new Span(5, 11), "Unbound identifier triple");
        assertEquals(
            " --> test.fusion:2:2\n"
                + "  |\n"
                + "2 | (triple 2)\n"
                + "  |  ^----^\n"
                + "  |\n"
                + "  = Unbound identifier triple",
            message);
    }

    @Test
    void marksSingleCharacterAndOverlongSpans() {
        String single = SourceLocation.describe("f", "(a", new Span(2, 2), "expected ')'");
        assertTrue(single.contains("1 | (a\n  |   ^\n"));

        String overlong = SourceLocation.describe("f", "(abc\n)", new Span(1, 6), "oops");
        assertTrue(overlong.contains("  |  ^--\n"));
    }

    @Test
    void resolvesSpannedExceptions() {
        FusionException spanned = FusionException.spanned(new Span(1, 2), "bad");
        assertTrue(spanned.isSpanned());

        FusionException resolved = spanned.resolve("x.fusion", "(a)");
        assertFalse(resolved.isSpanned());
        assertTrue(resolved.getMessage().contains("--> x.fusion:1:2"));
        assertTrue(resolved.getMessage().endsWith("= bad"));

        FusionException generic = FusionException.generic("plain");
        assertSame(generic, generic.resolve("x.fusion", "(a)"));
    }

    @Test
    void excerptsSpans() {
        Span span = new Span(0, 5);
        assertEquals("ab...", new Span(0, 5).excerpt("abcdef", 2));
        assertTrue(span.isTruncated(2));
        assertEquals("abcde", span.excerpt("abcdef", 10));
    }
}
