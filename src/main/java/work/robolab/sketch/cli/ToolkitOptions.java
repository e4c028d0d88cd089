package work.robolab.sketch.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import picocli.CommandLine;
import work.robolab.sketch.api.LogLevel;
import work.robolab.sketch.api.RoboLabToolkit;
import work.robolab.sketch.api.ToolkitConfiguration;
import work.robolab.sketch.api.ToolkitConfigurationLoader;

/**
 * Options shared by every subcommand. Explicit flags override {@code robolab.toml}.
 */
final class ToolkitOptions {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Option(
        names = "--config",
        description = "Configuration file (default: ./robolab.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path config;

    @CommandLine.Option(names = "--catalog", description = "Block catalog (JSON or YAML).")
    Path catalog;

    @CommandLine.Option(names = "--boards", description = "Board profiles file.")
    Path boards;

    @CommandLine.Option(names = {"-b", "--board"}, description = "Target board id.")
    String board;

    @CommandLine.Option(names = "--tools", description = "Root of arduino-cli and upload tools.")
    Path tools;

    @CommandLine.Option(names = "--strict", description = "Refuse to generate when validation reports errors.")
    boolean strict;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String logLevelRaw;

    ToolkitConfiguration configuration() {
        var base = ToolkitConfiguration.defaults();
        var file = config;
        if (file == null && Files.isRegularFile(Paths.get(ToolkitConfigurationLoader.FILE_NAME))) {
            file = Paths.get(ToolkitConfigurationLoader.FILE_NAME);
        }
        if (file != null) {
            base = ToolkitConfigurationLoader.load(file, base);
        }
        var builder = base.toBuilder();
        if (catalog != null) builder.catalogPath(catalog.toAbsolutePath().normalize());
        if (boards != null) builder.boardsPath(boards.toAbsolutePath().normalize());
        if (board != null) builder.boardId(board);
        if (tools != null) builder.toolsRoot(tools.toAbsolutePath().normalize());
        if (strict) builder.strict(true);
        if (logLevelRaw != null) builder.logLevel(LogLevel.from(logLevelRaw));
        return builder.build();
    }

    /**
     * Applies the log level before any logger is created, then opens the toolkit.
     */
    RoboLabToolkit openToolkit() {
        var configuration = configuration();
        var candidate = logLevelRaw != null ? logLevelRaw : System.getenv("ROBOLAB_LOG_LEVEL");
        var level = candidate != null && !candidate.isBlank() ? LogLevel.from(candidate) : configuration.logLevel();
        System.setProperty(LOG_LEVEL_PROPERTY, level.simpleLoggerName());
        return new RoboLabToolkit(configuration);
    }
}
