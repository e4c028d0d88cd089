package work.robolab.sketch.board;

/**
 * Raised when a board profile document is malformed.
 */
public final class BoardLoadException extends RuntimeException {
    public BoardLoadException(String message) {
        super(message);
    }

    public BoardLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
