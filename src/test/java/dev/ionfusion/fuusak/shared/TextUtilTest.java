package dev.ionfusion.fuusak.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextUtilTest {
    @Test
    void countsEveryLineBreakStyleOnce() {
        assertEquals(0, TextUtil.countNewlines("  \t"));
        assertEquals(1, TextUtil.countNewlines("\r\n"));
        assertEquals(3, TextUtil.countNewlines("a\r\nb\rc\n"));
        assertEquals(2, TextUtil.countNewlines("\n\n"));
        assertEquals(3, TextUtil.countNewlines("\r\n\n\r\n"));
        assertEquals(3, TextUtil.countNewlines("\r\n\r\r\n"));
    }

    @Test
    void findsCursorColumn() {
        assertEquals(3, TextUtil.findCursorPos("abc"));
        assertEquals(3, TextUtil.findCursorPos("ab\ncde"));
        assertEquals(0, TextUtil.findCursorPos("abc\n"));
    }

    @Test
    void detectsWhitespaceBeforeCursor() {
        assertTrue(TextUtil.alreadyHasWhitespaceBeforeCursor("a "));
        assertTrue(TextUtil.alreadyHasWhitespaceBeforeCursor("a\n"));
        assertFalse(TextUtil.alreadyHasWhitespaceBeforeCursor("ab"));
        assertFalse(TextUtil.alreadyHasWhitespaceBeforeCursor(" "));
    }

    @Test
    void measuresIndentation() {
        assertEquals(3, TextUtil.indentLen("  \tx"));
        assertEquals(0, TextUtil.minIndentLen("foo"));
        assertEquals(0, TextUtil.minIndentLen("\n"));
        assertEquals(2, TextUtil.minIndentLen("\n  foo\n  bar"));
        assertEquals(1, TextUtil.minIndentLen("  \n foo\n  bar"));
        assertEquals(1, TextUtil.minIndentLen("foo  \n foo\n  bar"));
        assertEquals(3, TextUtil.minIndentLen("x\n   y"));
    }

    @Test
    void trimsCommonIndent() {
        assertEquals("foo\nbar", TextUtil.trimIndent("foo\nbar"));
        assertEquals("  foo\nbar", TextUtil.trimIndent("  foo\n  bar"));
        assertEquals(" foo\nbar", TextUtil.trimIndent(" foo\n  bar"));
        assertEquals("x y\nz\n w", TextUtil.trimIndent("x y\n   z\n    w"));
        assertEquals("\nfoo\n  bar\nbaz\n", TextUtil.trimIndent("\n  foo\n    bar\n  baz\n"));
    }

    @Test
    void indentsContinuationLines() {
        assertEquals("foo", TextUtil.formatIndentedMultiline("foo", 3));
        assertEquals("foo\n   bar", TextUtil.formatIndentedMultiline("foo\nbar", 3));
        assertEquals("foo\n\n\n   bar", TextUtil.formatIndentedMultiline("foo\n\n\nbar", 3));
        assertEquals("foo\n   bar\n     baz\n   bin", TextUtil.formatIndentedMultiline("foo\nbar\n  baz\nbin", 3));
    }

    @Test
    void splitsLines() {
        assertEquals(List.of("a", "b"), TextUtil.lines("a\r\nb\n"));
        assertEquals(List.of("a", "", "b"), TextUtil.lines("a\n\nb"));
        assertEquals(List.of(), TextUtil.lines(""));
    }

    @Test
    void checksLastCharacter() {
        assertTrue(TextUtil.lastIsOneOf("ab", 'x', 'b'));
        assertFalse(TextUtil.lastIsOneOf("ab", 'a'));
        assertFalse(TextUtil.lastIsOneOf("", 'a'));
    }
}
