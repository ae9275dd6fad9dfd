package work.kdotool.host;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.kdotool.config.KdotoolConfig;

/**
 * Reads the KWin units of the user journal with {@code journalctl --output=cat}.
 */
public final class JournalLogSource implements LogSource {
    static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Duration READ_TIMEOUT = Duration.ofSeconds(10);

    private final CommandRunner runner;
    private final String journalCommand;
    private final List<String> units;

    public JournalLogSource(CommandRunner runner, KdotoolConfig config) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.journalCommand = config.journalCommand();
        this.units = config.journalUnits();
    }

    @Override
    public List<String> readSince(LocalDateTime since) throws ScriptHostException {
        CommandRunner.CommandResult result = runner.run(command(since), READ_TIMEOUT);
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr().trim();
            throw new ScriptHostException("Cannot read journal: " + detail);
        }
        return result.stdout().lines().toList();
    }

    List<String> command(LocalDateTime since) {
        List<String> command = new ArrayList<>();
        command.add(journalCommand);
        command.add("--since=" + SINCE_FORMAT.format(since));
        command.add("--user");
        for (String unit : units) {
            command.add("--unit=" + unit);
        }
        command.add("--output=cat");
        return command;
    }
}
