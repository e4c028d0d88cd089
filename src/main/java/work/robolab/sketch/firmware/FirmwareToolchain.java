package work.robolab.sketch.firmware;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.robolab.sketch.board.BoardProfile;
import work.robolab.sketch.generator.Template;

/**
 * Drives arduino-cli and the board upload tools shipped under a tools root.
 */
public final class FirmwareToolchain {
    private static final Logger LOG = LoggerFactory.getLogger(FirmwareToolchain.class);

    private final Path toolsRoot;
    private final CommandRunner runner;

    public FirmwareToolchain(Path toolsRoot) {
        this(toolsRoot, new ProcessCommandRunner());
    }

    public FirmwareToolchain(Path toolsRoot, CommandRunner runner) {
        this.toolsRoot = Objects.requireNonNull(toolsRoot, "toolsRoot");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    public CommandResult compile(Path sketchDir, BoardProfile board) {
        var cli = toolsRoot.resolve("ArduinoCLI").resolve("arduino-cli");
        var command = List.of(cli.toString(), "compile", "--fqbn", board.fqbn(), sketchDir.toString());
        LOG.info("Compiling {} for {}", sketchDir, board.fqbn());
        return runner.run(command);
    }

    public CommandResult upload(Path hexPath, BoardProfile board, String port) {
        if (board.uploadCommand() == null || board.uploadCommand().isBlank()) {
            throw new ToolchainException("Board " + board.id() + " has no upload command");
        }
        var tool = resolveTool(board.uploadTool()).toString();
        var context = Map.of(
            "avrdude", tool,
            "tool", tool,
            "port", port == null ? "" : port,
            "hex_path", hexPath.toString(),
            "speed", Integer.toString(board.uploadSpeed())
        );
        var command = splitCommand(Template.render(board.uploadCommand(), context::get));
        if (command.isEmpty()) {
            throw new ToolchainException("Upload command of board " + board.id() + " is empty");
        }
        LOG.info("Uploading {} to {} on {}", hexPath, board.id(), port);
        return runner.run(command);
    }

    public Path resolveTool(String tool) {
        if (tool == null || tool.isBlank()) {
            return resolveTool("avrdude");
        }
        return switch (tool) {
            case "avrdude" -> toolsRoot.resolve("Tools").resolve("avrdude").resolve("avrdude.exe");
            case "esptool" -> toolsRoot.resolve("Tools").resolve("esptool.py");
            case "picotool" -> toolsRoot.resolve("Tools").resolve("picotool.exe");
            default -> toolsRoot.resolve(tool);
        };
    }

    public Path toolsRoot() {
        return toolsRoot;
    }

    /**
     * Splits a command line into arguments. Whitespace separates arguments; single and double
     * quotes group them. A backslash escapes only a quote, whitespace or another backslash, so
     * Windows paths pass through unchanged.
     */
    static List<String> splitCommand(String line) {
        var args = new ArrayList<String>();
        var current = new StringBuilder();
        boolean inArg = false;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '\\' && quote != '\'' && i + 1 < line.length() && isEscapable(line.charAt(i + 1))) {
                current.append(line.charAt(++i));
                inArg = true;
            } else if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                } else {
                    current.append(ch);
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                inArg = true;
            } else if (Character.isWhitespace(ch)) {
                if (inArg) {
                    args.add(current.toString());
                    current.setLength(0);
                    inArg = false;
                }
            } else {
                current.append(ch);
                inArg = true;
            }
        }
        if (quote != 0) {
            throw new ToolchainException("Unbalanced quote in command: " + line);
        }
        if (inArg) {
            args.add(current.toString());
        }
        return args;
    }

    private static boolean isEscapable(char ch) {
        return ch == '"' || ch == '\'' || ch == '\\' || Character.isWhitespace(ch);
    }
}
