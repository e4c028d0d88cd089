package work.robolab.sketch.project;

/**
 * Raised when a project file cannot be read or its graph cannot be turned into a program.
 */
public final class ProjectFormatException extends RuntimeException {
    public ProjectFormatException(String message) {
        super(message);
    }

    public ProjectFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
