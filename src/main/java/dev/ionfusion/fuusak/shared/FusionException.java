package dev.ionfusion.fuusak.shared;

import java.util.Optional;

/**
 * User-facing failure: a parse, load, configuration or check error.
 *
 * <p>A spanned error points into a source file it does not know about yet; {@link #resolve(String, String)}
 * turns it into a plain error whose message shows the file, line and column.
 */
public final class FusionException extends RuntimeException {
    private final Span span;

    private FusionException(String message, Span span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    public static FusionException generic(String message) {
        return new FusionException(message, null, null);
    }

    public static FusionException generic(String message, Throwable cause) {
        return new FusionException(message, null, cause);
    }

    public static FusionException spanned(Span span, String message) {
        return new FusionException(message, span, null);
    }

    public Optional<Span> span() {
        return Optional.ofNullable(span);
    }

    public boolean isSpanned() {
        return span != null;
    }

    public FusionException resolve(String fileName, String contents) {
        if (span == null) {
            return this;
        }
        return new FusionException(SourceLocation.describe(fileName, contents, span, getMessage()), null, getCause());
    }
}
