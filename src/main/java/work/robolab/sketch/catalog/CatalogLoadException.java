package work.robolab.sketch.catalog;

/**
 * Raised when a block catalog document is malformed. The message names the offending entry.
 */
public final class CatalogLoadException extends RuntimeException {
    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
