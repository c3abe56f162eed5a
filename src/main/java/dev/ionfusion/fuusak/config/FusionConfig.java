package dev.ionfusion.fuusak.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable formatter and checker settings, usually read from {@code fuusak.toml}.
 */
public record FusionConfig(
    boolean formatMultilineStringContents,
    NewlineMode newlineMode,
    Set<String> fixedIndentSymbols,
    Set<String> smartIndentSymbols,
    CheckConfig check
) {
    public static final Set<String> DEFAULT_FIXED_INDENT_SYMBOLS = Set.of(
        "begin", "define", "define_syntax", "defpub", "defpub_j", "defpub_syntax",
        "lambda", "let", "letrec", "lets", "module", "unless", "when"
    );
    public static final Set<String> DEFAULT_SMART_INDENT_SYMBOLS = Set.of("and", "cond", "if", "or");

    public FusionConfig {
        Objects.requireNonNull(newlineMode, "newlineMode");
        Objects.requireNonNull(check, "check");
        fixedIndentSymbols = Set.copyOf(fixedIndentSymbols);
        smartIndentSymbols = Set.copyOf(smartIndentSymbols);
    }

    public static FusionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean newlineFixUpMode() {
        return newlineMode == NewlineMode.FIX_UP;
    }

    public Builder toBuilder() {
        return new Builder()
            .formatMultilineStringContents(formatMultilineStringContents)
            .newlineMode(newlineMode)
            .fixedIndentSymbols(fixedIndentSymbols)
            .smartIndentSymbols(smartIndentSymbols)
            .check(check);
    }

    public static final class Builder {
        private boolean formatMultilineStringContents = true;
        private NewlineMode newlineMode = NewlineMode.FIX_UP;
        private Set<String> fixedIndentSymbols = new LinkedHashSet<>(DEFAULT_FIXED_INDENT_SYMBOLS);
        private Set<String> smartIndentSymbols = new LinkedHashSet<>(DEFAULT_SMART_INDENT_SYMBOLS);
        private CheckConfig check = CheckConfig.defaults();

        public Builder formatMultilineStringContents(boolean formatMultilineStringContents) {
            this.formatMultilineStringContents = formatMultilineStringContents;
            return this;
        }

        public Builder newlineMode(NewlineMode newlineMode) {
            this.newlineMode = newlineMode;
            return this;
        }

        public Builder fixedIndentSymbols(Collection<String> fixedIndentSymbols) {
            this.fixedIndentSymbols = new LinkedHashSet<>(fixedIndentSymbols);
            return this;
        }

        public Builder smartIndentSymbols(Collection<String> smartIndentSymbols) {
            this.smartIndentSymbols = new LinkedHashSet<>(smartIndentSymbols);
            return this;
        }

        public Builder check(CheckConfig check) {
            this.check = check;
            return this;
        }

        public FusionConfig build() {
            return new FusionConfig(
                formatMultilineStringContents,
                newlineMode,
                fixedIndentSymbols,
                smartIndentSymbols,
                check
            );
        }
    }
}
