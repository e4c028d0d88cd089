package work.robolab.sketch.generator;

/**
 * Aborts a {@link CodeGenerator#build} call; no partial sketch is produced.
 */
public final class CodeGenerationException extends RuntimeException {
    private final String blockId;

    public CodeGenerationException(String message) {
        this(message, null, null);
    }

    public CodeGenerationException(String message, String blockId, Throwable cause) {
        super(message, cause);
        this.blockId = blockId;
    }

    /**
     * Instance id of the block that caused the failure, when known.
     */
    public String blockId() {
        return blockId;
    }
}
