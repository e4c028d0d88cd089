package work.robolab.sketch.catalog;

import java.util.Locale;

/**
 * Structural role of a block definition. Each kind fixes which definition fields are legal.
 */
public enum BlockKind {
    /** Entry point such as the start block; owns top-level containers. */
    EVENT,
    /** Emits statements into a section. */
    STATEMENT,
    /** Renders a value that is substituted into a parent template. */
    EXPRESSION,
    /** Transparent grouping node: no template, only containers. */
    CONTAINER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BlockKind from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Block kind is required");
        }
        try {
            return BlockKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported block kind: " + value);
        }
    }
}
