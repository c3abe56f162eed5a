package dev.ionfusion.fuusak.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of formatting one file.
 */
public record FormatResult(String fileName, Status status, Optional<String> message, Optional<String> formatted) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public FormatResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(formatted, "formatted");
    }

    public static FormatResult unchanged(String fileName, String formatted) {
        return new FormatResult(fileName, Status.UNCHANGED, Optional.empty(), Optional.of(formatted));
    }

    public static FormatResult reformatted(String fileName, String formatted) {
        return new FormatResult(fileName, Status.REFORMATTED, Optional.empty(), Optional.of(formatted));
    }

    public static FormatResult wouldReformat(String fileName, String formatted) {
        return new FormatResult(fileName, Status.WOULD_REFORMAT, Optional.empty(), Optional.of(formatted));
    }

    public static FormatResult failed(String fileName, String message) {
        return new FormatResult(fileName, Status.FAILED, Optional.of(message), Optional.empty());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("file", fileName);
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        message.ifPresent(value -> serializable.put("message", value));
        return serializable;
    }

    public static String toPrettyJson(List<FormatResult> results) {
        try {
            return WRITER.writeValueAsString(results.stream().map(FormatResult::toSerializableMap).toList());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize format results", ex);
        }
    }

    /**
     * Highest exit code among {@code results}, 0 when empty.
     */
    public static int exitCode(List<FormatResult> results) {
        return results.stream().mapToInt(result -> result.status().exitCode()).max().orElse(0);
    }

    public enum Status {
        UNCHANGED(0),
        REFORMATTED(0),
        WOULD_REFORMAT(1),
        FAILED(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
