package work.robolab.sketch.firmware;

/**
 * Raised when an external tool cannot be started or the upload command is malformed.
 */
public final class ToolchainException extends RuntimeException {
    public ToolchainException(String message) {
        super(message);
    }

    public ToolchainException(String message, Throwable cause) {
        super(message, cause);
    }
}
