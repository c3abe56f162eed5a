package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;

/**
 * A name brought in by a require form, with the span of the form element that introduced it.
 */
public record Origin(String name, Span originatesFrom) {
    public Origin {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(originatesFrom, "originatesFrom");
    }
}
