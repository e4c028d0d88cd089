package work.robolab.sketch.catalog;

import java.util.Locale;

/**
 * Output regions of a generated sketch, declared in emission order.
 */
public enum Section {
    INCLUDES,
    GLOBALS,
    SETUP,
    LOOP,
    FUNCTIONS;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Section from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Section name is required");
        }
        try {
            return Section.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown section: " + value);
        }
    }
}
