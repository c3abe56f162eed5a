package dev.ionfusion.fuusak.shared;

/**
 * Line/column lookup and caret snippets for error messages.
 */
public record SourceLocation(int line, int column, String lineText) {
    /**
     * Resolves a character offset to a 1-based line and column.
     */
    public static SourceLocation of(String source, int offset) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < clamped; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int lineEnd = source.indexOf('\n', lineStart);
        if (lineEnd < 0) {
            lineEnd = source.length();
        }
        String text = source.substring(lineStart, lineEnd);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return new SourceLocation(line, clamped - lineStart + 1, text);
    }

    /**
     * Renders a message pointing at {@code span}:
     *
     * <pre>
     *  --&gt; file.fusion:1:2
     *   |
     * 1 | (foo bar)
     *   |  ^-^
     *   |
     *   = message
     * </pre>
     */
    public static String describe(String fileName, String source, Span span, String message) {
        SourceLocation location = of(source, span.start());
        int width = Math.max(0, Math.min(span.end(), source.length()) - span.start());
        int available = location.lineText().length() - (location.column() - 1);
        String marker;
        if (width <= 1) {
            marker = "^";
        } else if (width > available) {
            marker = "^" + "-".repeat(Math.max(0, available - 1));
        } else {
            marker = "^" + "-".repeat(width - 2) + "^";
        }
        return location.render(fileName, marker, message);
    }

    /**
     * Same layout as {@link #describe} for a single position.
     */
    public static String describePosition(String fileName, String source, int offset, String message) {
        return of(source, offset).render(fileName, "^---", message);
    }

    private String render(String fileName, String marker, String message) {
        String number = Integer.toString(line);
        String gutter = TextUtil.spaces(number.length());
        String prefix = fileName == null ? "" : fileName + ":";
        StringBuilder out = new StringBuilder();
        out.append(gutter).append("--> ").append(prefix).append(line).append(':').append(column).append('\n');
        out.append(gutter).append(" |\n");
        out.append(number).append(" | ").append(lineText).append('\n');
        out.append(gutter).append(" | ").append(TextUtil.spaces(column - 1)).append(marker).append('\n');
        out.append(gutter).append(" |\n");
        out.append(gutter).append(" = ").append(message);
        return out.toString();
    }
}
