package work.robolab.sketch.catalog;

/**
 * Lookup of a block id that the catalog does not define.
 */
public final class UnknownBlockException extends RuntimeException {
    private final String blockId;

    public UnknownBlockException(String blockId) {
        super("Unknown block '" + blockId + "'");
        this.blockId = blockId;
    }

    public String blockId() {
        return blockId;
    }
}
