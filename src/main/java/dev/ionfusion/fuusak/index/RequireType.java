package dev.ionfusion.fuusak.index;

import java.util.List;
import java.util.Map;

/**
 * Which names a require form imports from its module.
 */
public interface RequireType {
    /** {@code (require "module")}: every provide. */
    record All() implements RequireType {}

    /** {@code (require (only_in "module" a b))}. */
    record Names(List<Origin> origins) implements RequireType {
        public Names {
            origins = List.copyOf(origins);
        }
    }

    /** {@code (require (rename_in "module" (from to)))}, keyed by the module's name for the binding. */
    record Mapped(Map<String, Origin> mapping) implements RequireType {
        public Mapped {
            mapping = Map.copyOf(mapping);
        }
    }
}
