package work.kdotool.host;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Log stream the host writes script output to.
 */
@FunctionalInterface
public interface LogSource {
    List<String> readSince(LocalDateTime since) throws ScriptHostException;
}
