package dev.ionfusion.fuusak.format;

/**
 * How the lines after the first line of an s-expression are indented.
 */
public enum IndentType {
    /**
     * One column past the opening parenthesis.
     * <pre>
     * (
     *  1 2)
     * </pre>
     */
    END_OF_OPENING,
    /**
     * Under the first argument.
     * <pre>
     * (foo (bar)
     *      (baz))
     * </pre>
     */
    END_OF_OPENING_SYMBOL,
    /**
     * Two columns past the opening parenthesis.
     * <pre>
     * (define (foo)
     *   (baz))
     * </pre>
     */
    FIXED,
    UNDETERMINED
}
