package work.lcod.summation.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link SummationRunner} execution: the booked histograms and run description on
 * success, the message and error code on failure.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message == null ? "unknown error" : message);
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    /** Number of histograms in the store snapshot; zero when the run failed before booking. */
    public int histogramCount() {
        return metadata.get("histograms") instanceof Map<?, ?> histograms ? histograms.size() : 0;
    }

    /** Machine-readable code of a specification failure. */
    public Optional<String> errorCode() {
        return Optional.ofNullable(metadata.get("code")).map(String::valueOf);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /** One-line description for terminals and logs. */
    public String summary() {
        if (status == Status.SUCCESS) {
            return "success: " + histogramCount() + " histogram(s) in " + duration().toMillis() + " ms";
        }
        String code = errorCode().map(c -> " [" + c + "]").orElse("");
        return "failure" + code + ": " + metadata.get("error");
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("histogramCount", histogramCount());
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
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
