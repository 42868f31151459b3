package work.lcod.manifest.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of a {@link ManifestChecker} run (usable by the CLI and embedding apps).
 *
 * <p>{@code reports} holds one entry per manifest, in the order they were given.
 */
public record CheckResult(Status status, List<Map<String, Object>> reports, Map<String, Object> metadata,
                          Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CheckResult {
        reports = List.copyOf(reports);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CheckResult of(List<Map<String, Object>> reports, Map<String, Object> metadata, Instant startedAt) {
        var valid = reports.stream().allMatch(report -> Boolean.TRUE.equals(report.get("valid")));
        return new CheckResult(valid ? Status.VALID : Status.INVALID, reports, metadata, startedAt, Instant.now());
    }

    public static CheckResult error(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new CheckResult(Status.ERROR, List.of(), meta, startedAt, Instant.now());
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("reports", reports);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        VALID(0),
        INVALID(1),
        ERROR(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
