package work.robolab.sketch.cli;

import picocli.CommandLine;
import work.robolab.sketch.generator.CodeGenerationException;

/**
 * Keeps CLI failures short and focused on the root cause. Generation failures name the block
 * instance they came from so it can be found on the canvas.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof CodeGenerationException generation) {
            message = withBlock(message, generation.blockId());
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("robolab.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String withBlock(Object message, Object blockId) {
        return blockId == null ? String.valueOf(message) : message + " [block " + blockId + "]";
    }
}
