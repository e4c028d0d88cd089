package work.robolab.sketch.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable settings for a {@link RoboLabToolkit}. Absent catalog or boards paths select the
 * definitions bundled on the classpath.
 */
public record ToolkitConfiguration(
    Optional<Path> catalogPath,
    Optional<Path> boardsPath,
    String boardId,
    Path toolsRoot,
    boolean strict,
    LogLevel logLevel
) {
    public static final String DEFAULT_BOARD = "uno";

    public ToolkitConfiguration {
        Objects.requireNonNull(catalogPath, "catalogPath");
        Objects.requireNonNull(boardsPath, "boardsPath");
        Objects.requireNonNull(boardId, "boardId");
        Objects.requireNonNull(toolsRoot, "toolsRoot");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static ToolkitConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .catalogPath(catalogPath.orElse(null))
            .boardsPath(boardsPath.orElse(null))
            .boardId(boardId)
            .toolsRoot(toolsRoot)
            .strict(strict)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private Path catalogPath;
        private Path boardsPath;
        private String boardId = DEFAULT_BOARD;
        private Path toolsRoot = Path.of("tools");
        private boolean strict;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder catalogPath(Path catalogPath) {
            this.catalogPath = catalogPath;
            return this;
        }

        public Builder boardsPath(Path boardsPath) {
            this.boardsPath = boardsPath;
            return this;
        }

        public Builder boardId(String boardId) {
            this.boardId = boardId;
            return this;
        }

        public Builder toolsRoot(Path toolsRoot) {
            this.toolsRoot = toolsRoot;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ToolkitConfiguration build() {
            return new ToolkitConfiguration(
                Optional.ofNullable(catalogPath),
                Optional.ofNullable(boardsPath),
                boardId == null || boardId.isBlank() ? DEFAULT_BOARD : boardId,
                toolsRoot,
                strict,
                logLevel
            );
        }
    }
}
