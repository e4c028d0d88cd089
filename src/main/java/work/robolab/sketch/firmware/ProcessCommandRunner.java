package work.robolab.sketch.firmware;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link CommandRunner} backed by {@link ProcessBuilder}. Both output streams are drained
 * concurrently so a chatty tool cannot block on a full pipe.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command) {
        LOG.debug("Running {}", String.join(" ", command));
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new ToolchainException("Unable to start " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        var stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        var stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            int exitCode = process.waitFor();
            return new CommandResult(command, exitCode, stdout.get(), stderr.get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ToolchainException("Interrupted while running " + command.get(0), ex);
        } catch (ExecutionException ex) {
            throw new ToolchainException("Unable to read output of " + command.get(0), ex.getCause());
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
