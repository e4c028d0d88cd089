package work.robolab.sketch.validate;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validation finding, optionally attributed to the block instance it concerns.
 */
public record Diagnostic(DiagnosticCode code, String message, Optional<String> blockId) {
    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        blockId = blockId == null ? Optional.empty() : blockId;
    }

    public static Diagnostic of(DiagnosticCode code, String message) {
        return new Diagnostic(code, message, Optional.empty());
    }

    public static Diagnostic forBlock(DiagnosticCode code, String message, String blockId) {
        return new Diagnostic(code, message, Optional.ofNullable(blockId));
    }

    public Severity severity() {
        return code.severity();
    }

    public boolean isError() {
        return severity() == Severity.ERROR;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code.name());
        map.put("severity", severity().name().toLowerCase(Locale.ROOT));
        map.put("message", message);
        blockId.ifPresent(id -> map.put("block", id));
        return map;
    }

    @Override
    public String toString() {
        return blockId.map(id -> "[" + id + "] " + message).orElse(message);
    }
}
