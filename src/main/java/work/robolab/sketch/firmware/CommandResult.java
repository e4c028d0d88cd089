package work.robolab.sketch.firmware;

import java.util.List;

/**
 * Outcome of an external tool invocation.
 */
public record CommandResult(List<String> command, int exitCode, String stdout, String stderr) {
    public CommandResult {
        command = command == null ? List.of() : List.copyOf(command);
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean success() {
        return exitCode == 0;
    }

    /**
     * stdout followed by stderr, the way compiler diagnostics are usually scanned.
     */
    public String combinedOutput() {
        if (stdout.isEmpty()) return stderr;
        if (stderr.isEmpty()) return stdout;
        return stdout + "\n" + stderr;
    }
}
