package dev.ionfusion.fuusak.config;

import java.util.Locale;

/**
 * Whether the fix-up pass runs before formatting.
 */
public enum NewlineMode {
    NO_CHANGE("no-change"),
    FIX_UP("fix-up");

    private final String configName;

    NewlineMode(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static NewlineMode from(String value) {
        if (value == null || value.isBlank()) {
            return FIX_UP;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (NewlineMode mode : values()) {
            if (mode.configName.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported newline mode: " + value);
    }
}
