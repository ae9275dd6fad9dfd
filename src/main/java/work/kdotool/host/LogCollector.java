package work.kdotool.host;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.kdotool.protocol.DecodedOutput;
import work.kdotool.protocol.LogDecoder;

/**
 * Polls a {@link LogSource} until the FINISH line of a run shows up or the wait runs out.
 * The host logs asynchronously, so the first read right after a run is often incomplete.
 */
public final class LogCollector {
    private static final Logger LOG = LoggerFactory.getLogger(LogCollector.class);

    private final LogSource source;
    private final LogDecoder decoder;
    private final Duration wait;
    private final Duration pollInterval;

    public LogCollector(LogSource source, LogDecoder decoder, Duration wait, Duration pollInterval) {
        this.source = Objects.requireNonNull(source, "source");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.wait = Objects.requireNonNull(wait, "wait");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    public DecodedOutput collect(LocalDateTime since, String marker) throws ScriptHostException {
        long deadline = System.nanoTime() + wait.toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            List<String> lines = source.readSince(since);
            DecodedOutput output = decoder.decode(lines, marker);
            if (output.finished()) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("KWin log after {} read(s):\n{}", attempts, String.join("\n", lines));
                }
                return output;
            }
            if (System.nanoTime() - deadline >= 0) {
                LOG.warn("No FINISH line for {} after {}ms; output may be incomplete", marker, wait.toMillis());
                return output;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ScriptHostException("Interrupted while waiting for script output", ex);
            }
        }
    }
}
