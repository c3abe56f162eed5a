package dev.ionfusion.fuusak.api;

/**
 * What {@link FusionFormatter#formatFile} does with a file whose formatting changes.
 */
public enum FormatMode {
    /** Replace the file with its formatted text. */
    WRITE,
    /** Leave the file alone and report {@link FormatResult.Status#WOULD_REFORMAT}. */
    CHECK
}
