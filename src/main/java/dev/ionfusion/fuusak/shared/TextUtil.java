package dev.ionfusion.fuusak.shared;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column and indentation helpers shared by the parser and the formatter.
 */
public final class TextUtil {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?|\\n");

    private TextUtil() {}

    /**
     * Counts line breaks, where {@code \n}, {@code \r} and {@code \r\n} each count once.
     */
    public static int countNewlines(String input) {
        Matcher matcher = LINE_BREAK.matcher(input);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public static String spaces(int count) {
        return " ".repeat(Math.max(0, count));
    }

    /**
     * Column of the cursor after {@code value} has been written: characters since the last {@code \n}.
     */
    public static int findCursorPos(CharSequence value) {
        int length = value.length();
        for (int i = length - 1; i >= 0; i--) {
            if (value.charAt(i) == '\n') {
                return length - i - 1;
            }
        }
        return length;
    }

    public static boolean alreadyHasWhitespaceBeforeCursor(CharSequence value) {
        int index = value.length() - 1;
        return index > 0 && (value.charAt(index) == ' ' || value.charAt(index) == '\n');
    }

    /**
     * Number of leading spaces and tabs.
     */
    public static int indentLen(String value) {
        int count = 0;
        while (count < value.length() && (value.charAt(count) == ' ' || value.charAt(count) == '\t')) {
            count++;
        }
        return count;
    }

    /**
     * Smallest indentation among non-blank lines after the first, 0 when there are none. The first line
     * continues the opening delimiter and is not counted.
     */
    public static int minIndentLen(String value) {
        return lines(value).stream()
            .skip(1)
            .filter(line -> !line.isBlank())
            .mapToInt(TextUtil::indentLen)
            .min()
            .orElse(0);
    }

    /**
     * Removes the common indentation from every line after the first.
     */
    public static String trimIndent(String value) {
        int minIndent = minIndentLen(value);
        StringBuilder output = new StringBuilder(value.length());
        boolean leading = false;
        int whitespace = 0;
        for (int i = 0; i < value.length(); i++) {
            char chr = value.charAt(i);
            if (chr == '\n') {
                leading = true;
                whitespace = 0;
                output.append(chr);
            } else if (leading && (chr == ' ' || chr == '\t')) {
                whitespace++;
                if (whitespace > minIndent) {
                    output.append(chr);
                }
            } else {
                leading = false;
                output.append(chr);
            }
        }
        return output.toString();
    }

    /**
     * Indents every line after the first by {@code continuationIndent} spaces; empty lines stay empty.
     */
    public static String formatIndentedMultiline(String value, int continuationIndent) {
        String indent = spaces(continuationIndent);
        StringBuilder output = new StringBuilder(value.length());
        boolean indentNext = false;
        for (int i = 0; i < value.length(); i++) {
            char chr = value.charAt(i);
            if (indentNext && chr != '\n') {
                output.append(indent);
                indentNext = false;
            }
            output.append(chr);
            if (chr == '\n') {
                indentNext = true;
            }
        }
        return output.toString();
    }

    public static boolean lastIsOneOf(CharSequence value, char... chars) {
        if (value.length() == 0) {
            return false;
        }
        char last = value.charAt(value.length() - 1);
        for (char chr : chars) {
            if (last == chr) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits on {@code \n}, dropping one trailing {@code \r} per line and the empty remainder after a final
     * line break.
     */
    public static List<String> lines(String value) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < value.length()) {
            int end = value.indexOf('\n', start);
            int next = end < 0 ? value.length() : end + 1;
            int lineEnd = end < 0 ? value.length() : end;
            if (lineEnd > start && value.charAt(lineEnd - 1) == '\r') {
                lineEnd--;
            }
            lines.add(value.substring(start, lineEnd));
            start = next;
        }
        return lines;
    }
}
