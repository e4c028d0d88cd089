package work.robolab.sketch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.robolab.sketch.generator.SketchBundle;
import work.robolab.sketch.validate.Diagnostic;

/**
 * Outcome of {@link RoboLabToolkit#generate}. The bundle is present only on success.
 */
public record GenerationResult(
    Status status,
    Optional<SketchBundle> bundle,
    List<Diagnostic> diagnostics,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public GenerationResult {
        diagnostics = List.copyOf(diagnostics);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static GenerationResult success(SketchBundle bundle, List<Diagnostic> diagnostics, Map<String, Object> metadata, Instant startedAt) {
        return new GenerationResult(Status.SUCCESS, Optional.of(bundle), diagnostics, metadata, startedAt, Instant.now());
    }

    public static GenerationResult invalid(List<Diagnostic> diagnostics, Map<String, Object> metadata, Instant startedAt) {
        return new GenerationResult(Status.INVALID, Optional.empty(), diagnostics, metadata, startedAt, Instant.now());
    }

    public static GenerationResult failure(String message, List<Diagnostic> diagnostics, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new GenerationResult(Status.FAILURE, Optional.empty(), diagnostics, meta, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("diagnostics", diagnostics.stream().map(Diagnostic::toMap).collect(Collectors.toList()));
        bundle.ifPresent(b -> {
            serializable.put("code", b.code());
            serializable.put("mapping", b.mapping());
        });
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
        FAILURE(1),
        INVALID(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
