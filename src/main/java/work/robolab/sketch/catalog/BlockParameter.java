package work.robolab.sketch.catalog;

import java.util.Objects;

/**
 * Declared parameter of a block definition. {@code defaultValue} may be {@code null}.
 */
public record BlockParameter(String name, String type, Object defaultValue) {
    public static final String DIGITAL_PIN = "digital_pin";
    public static final String INT = "int";

    public BlockParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
