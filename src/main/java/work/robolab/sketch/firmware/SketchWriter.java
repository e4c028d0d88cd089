package work.robolab.sketch.firmware;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.robolab.sketch.generator.SketchBundle;

/**
 * Lays a sketch out the way arduino-cli expects: {@code <dir>/<name>/<name>.ino}.
 */
public final class SketchWriter {
    private SketchWriter() {}

    public static Path write(Path directory, String name, SketchBundle bundle) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sketch name must not be blank");
        }
        var sketchDir = directory.resolve(name);
        var file = sketchDir.resolve(name + ".ino");
        try {
            Files.createDirectories(sketchDir);
            Files.writeString(file, bundle.code(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ToolchainException("Unable to write sketch " + file + ": " + ex.getMessage(), ex);
        }
        return file;
    }
}
