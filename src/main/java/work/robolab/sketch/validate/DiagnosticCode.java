package work.robolab.sketch.validate;

/**
 * Stable identifiers for validation findings, each with its default severity.
 */
public enum DiagnosticCode {
    MISSING_ENTRY_BLOCK(Severity.ERROR),
    UNKNOWN_BLOCK_TYPE(Severity.ERROR),
    ROOT_NOT_ENTRY(Severity.WARNING),
    MISSING_PARAMETER(Severity.ERROR),
    INVALID_PIN_FORMAT(Severity.ERROR),
    PIN_UNAVAILABLE(Severity.ERROR),
    INVALID_INTEGER(Severity.ERROR),
    LOOP_EMPTY(Severity.ERROR),
    SECTION_EMPTY(Severity.WARNING);

    private final Severity severity;

    DiagnosticCode(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
