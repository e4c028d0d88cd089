package work.robolab.sketch.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@code robolab.toml}. Relative paths resolve against the file's directory; missing keys
 * keep the values of the supplied base configuration.
 */
public final class ToolkitConfigurationLoader {
    public static final String FILE_NAME = "robolab.toml";

    private ToolkitConfigurationLoader() {}

    public static ToolkitConfiguration load(Path path) {
        return load(path, ToolkitConfiguration.defaults());
    }

    public static ToolkitConfiguration load(Path path, ToolkitConfiguration base) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid configuration " + path + ": " + errors);
        }
        var baseDir = path.toAbsolutePath().getParent();
        return fromToml(result, baseDir, base);
    }

    static ToolkitConfiguration fromToml(TomlTable toml, Path baseDir, ToolkitConfiguration base) {
        var builder = base.toBuilder();
        try {
            var catalog = toml.getString("catalog.path");
            if (catalog != null) builder.catalogPath(resolve(baseDir, catalog));
            var boards = toml.getString("boards.path");
            if (boards != null) builder.boardsPath(resolve(baseDir, boards));
            var board = toml.getString("boards.default");
            if (board != null) builder.boardId(board.trim());
            var tools = toml.getString("toolchain.root");
            if (tools != null) builder.toolsRoot(resolve(baseDir, tools));
            var strict = toml.getBoolean("generation.strict");
            if (strict != null) builder.strict(strict);
            var level = toml.getString("logging.level");
            if (level != null) builder.logLevel(LogLevel.from(level));
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw new ConfigurationException("Invalid configuration value: " + ex.getMessage(), ex);
        }
        return builder.build();
    }

    private static Path resolve(Path baseDir, String value) {
        var path = Path.of(value.trim());
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }
}
