package dev.ionfusion.fuusak.check;

import dev.ionfusion.fuusak.api.FusionFile;
import dev.ionfusion.fuusak.shared.FusionException;
import dev.ionfusion.fuusak.shared.Span;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects check findings for one file as located {@link FusionException}s.
 */
final class ErrorTracker {
    private final FusionFile file;
    private final List<FusionException> errors = new ArrayList<>();

    ErrorTracker(FusionFile file) {
        this.file = file;
    }

    void unboundIdentifier(String name, Span span) {
        customError("Unbound identifier " + name, span);
    }

    void customError(String message, Span span) {
        errors.add(FusionException.spanned(span, message).resolve(file.fileName(), file.contents()));
    }

    List<FusionException> errors() {
        return List.copyOf(errors);
    }
}
