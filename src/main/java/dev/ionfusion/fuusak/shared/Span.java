package dev.ionfusion.fuusak.shared;

/**
 * Half-open range {@code [start, end)} of character offsets into a source text.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public String text(String source) {
        return source.substring(start, Math.min(end, source.length()));
    }

    /**
     * Source text covered by this span, truncated to {@code max} characters with a trailing {@code ...}.
     */
    public String excerpt(String source, int max) {
        String text = text(source);
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    public boolean isTruncated(int max) {
        return length() > max;
    }
}
