package work.kdotool.host;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
public final class SystemCommandRunner implements CommandRunner {
    private static final Logger LOG = LoggerFactory.getLogger(SystemCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws ScriptHostException {
        String display = String.join(" ", command);
        LOG.debug("Running {}", display);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException ex) {
            throw new ScriptHostException("Cannot start " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        // drain both pipes so a chatty child cannot block on a full buffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ScriptHostException("Command timeout after " + timeout.toMillis() + "ms: " + display);
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ScriptHostException("Interrupted while running " + display, ex);
        } catch (ExecutionException ex) {
            throw new ScriptHostException("Cannot read output of " + display + ": " + ex.getCause().getMessage(), ex.getCause());
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
