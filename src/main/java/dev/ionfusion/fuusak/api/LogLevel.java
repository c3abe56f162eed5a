package dev.ionfusion.fuusak.api;

import java.util.Locale;

/**
 * Verbosity threshold for command line diagnostics. Levels above {@code INFO} prefix their messages.
 */
public enum LogLevel {
    TRACE("trace: "),
    DEBUG("debug: "),
    INFO(""),
    WARN("warning: "),
    ERROR("error: "),
    FATAL("fatal: ");

    private final String prefix;

    LogLevel(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Case-insensitive level name; {@code warning} is accepted for {@code WARN}. Blank means {@code INFO}.
     */
    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + value);
    }

    public boolean enables(LogLevel level) {
        return level.compareTo(this) >= 0;
    }

    public String decorate(String message) {
        return prefix + message;
    }
}
