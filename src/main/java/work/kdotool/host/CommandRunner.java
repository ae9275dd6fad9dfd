package work.kdotool.host;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external program to completion.
 */
@FunctionalInterface
public interface CommandRunner {
    CommandResult run(List<String> command, Duration timeout) throws ScriptHostException;

    record CommandResult(int exitCode, String stdout, String stderr) {
        public CommandResult {
            stdout = stdout == null ? "" : stdout;
            stderr = stderr == null ? "" : stderr;
        }

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
