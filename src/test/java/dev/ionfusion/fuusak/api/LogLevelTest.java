package dev.ionfusion.fuusak.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {
    @Test
    void parsesNamesCaseInsensitively() {
        assertEquals(LogLevel.WARN, LogLevel.from(" warn "));
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertEquals(LogLevel.INFO, LogLevel.from(""));
        assertEquals(LogLevel.WARN, LogLevel.from("Warning"));
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertEquals("Unsupported log level: loud", error.getMessage());
    }

    @Test
    void enablesLevelsAtOrAboveThreshold() {
        assertTrue(LogLevel.INFO.enables(LogLevel.ERROR));
        assertTrue(LogLevel.INFO.enables(LogLevel.INFO));
        assertFalse(LogLevel.INFO.enables(LogLevel.DEBUG));
    }

    @Test
    void prefixesAllButInfo() {
        assertEquals("Reformatted a.fusion", LogLevel.INFO.decorate("Reformatted a.fusion"));
        assertEquals("warning: Would reformat a.fusion", LogLevel.WARN.decorate("Would reformat a.fusion"));
    }
}
