package work.robolab.sketch.firmware;

import java.util.List;

/**
 * Runs an external command to completion. Tests substitute a recording stub.
 */
@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command);
}
