package work.robolab.sketch.board;

import java.util.Objects;

/**
 * Target board: identifiers, upload parameters and pin capabilities.
 */
public record BoardProfile(
    String id,
    String name,
    String fqbn,
    String uploadCommand,
    String uploadTool,
    int uploadSpeed,
    PinCapabilities pins
) {
    public static final int DEFAULT_UPLOAD_SPEED = 115200;

    public BoardProfile {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
        fqbn = fqbn == null || fqbn.isBlank() ? id : fqbn;
        uploadCommand = uploadCommand == null ? "" : uploadCommand;
        uploadTool = uploadTool == null ? "" : uploadTool;
        pins = pins == null ? PinCapabilities.none() : pins;
    }

    public boolean supportsDigital(int pin) {
        return pins.digital().contains(pin);
    }

    public boolean supportsPwm(int pin) {
        return pins.pwm().contains(pin);
    }

    public boolean supportsAnalog(String pin) {
        return pin != null && pins.analog().contains(pin.trim());
    }
}
