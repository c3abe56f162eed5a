package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.api.FusionFile;
import dev.ionfusion.fuusak.shared.Span;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Indexed module.
 *
 * @param name absolute module name such as {@code /fusion/list}
 * @param language name of the module whose bindings the body starts with; empty when the file has no
 *     {@code module} form
 * @param file parsed source, empty for the built-in kernel
 * @param requires require forms in source order
 * @param provides provided names mapped to the span they originate from, sorted by name
 */
public record Module(String name, String language, FusionFile file, List<RequireForm> requires,
                     Map<String, Span> provides) {
    public Module {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(file, "file");
        requires = List.copyOf(requires);
        provides = Collections.unmodifiableMap(new TreeMap<>(provides));
    }

    public boolean hasLanguage() {
        return !language.isEmpty() && !language.equals(name);
    }
}
