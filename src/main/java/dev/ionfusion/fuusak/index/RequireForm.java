package dev.ionfusion.fuusak.index;

import dev.ionfusion.fuusak.shared.Span;
import java.util.Objects;
import java.util.Optional;

public record RequireForm(ModuleHandle module, RequireType required) {
    public RequireForm {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(required, "required");
    }

    /**
     * Span that {@code name} originates from when this form binds it locally.
     */
    public Optional<Span> findOrigin(String name, FusionIndex index) {
        if (required instanceof RequireType.Names names) {
            return names.origins().stream()
                .filter(origin -> origin.name().equals(name))
                .map(Origin::originatesFrom)
                .findFirst();
        }
        if (required instanceof RequireType.Mapped mapped) {
            return mapped.mapping().values().stream()
                .filter(origin -> origin.name().equals(name))
                .map(Origin::originatesFrom)
                .findFirst();
        }
        return Optional.ofNullable(index.module(module).provides().get(name));
    }
}
