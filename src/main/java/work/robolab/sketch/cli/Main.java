package work.robolab.sketch.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new RoboLabCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
