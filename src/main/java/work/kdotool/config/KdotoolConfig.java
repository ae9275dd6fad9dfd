package work.kdotool.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.kdotool.script.TargetEnvironment;

/**
 * Settings read from {@code config.toml}; every field has a working default.
 */
public record KdotoolConfig(
    boolean debug,
    Optional<TargetEnvironment> target,
    String dbusCommand,
    String kwinService,
    String scriptingPath,
    Duration callTimeout,
    String journalCommand,
    List<String> journalUnits,
    String logPrefix,
    Duration logWait,
    Duration pollInterval
) {
    public static final String DEFAULT_DBUS_COMMAND = "gdbus";
    public static final String DEFAULT_KWIN_SERVICE = "org.kde.KWin";
    public static final String DEFAULT_SCRIPTING_PATH = "/Scripting";
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);
    public static final String DEFAULT_JOURNAL_COMMAND = "journalctl";
    public static final List<String> DEFAULT_JOURNAL_UNITS = List.of(
        "plasma-kwin_wayland.service",
        "plasma-kwin_x11.service"
    );
    public static final String DEFAULT_LOG_PREFIX = "js: ";
    public static final Duration DEFAULT_LOG_WAIT = Duration.ofSeconds(2);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    public KdotoolConfig {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(dbusCommand, "dbusCommand");
        Objects.requireNonNull(kwinService, "kwinService");
        Objects.requireNonNull(scriptingPath, "scriptingPath");
        Objects.requireNonNull(callTimeout, "callTimeout");
        Objects.requireNonNull(journalCommand, "journalCommand");
        Objects.requireNonNull(logPrefix, "logPrefix");
        Objects.requireNonNull(logWait, "logWait");
        Objects.requireNonNull(pollInterval, "pollInterval");
        journalUnits = List.copyOf(journalUnits);
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("journal.poll_interval must be positive");
        }
    }

    public static KdotoolConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .debug(debug)
            .target(target)
            .dbusCommand(dbusCommand)
            .kwinService(kwinService)
            .scriptingPath(scriptingPath)
            .callTimeout(callTimeout)
            .journalCommand(journalCommand)
            .journalUnits(journalUnits)
            .logPrefix(logPrefix)
            .logWait(logWait)
            .pollInterval(pollInterval);
    }

    public static final class Builder {
        private boolean debug;
        private Optional<TargetEnvironment> target = Optional.empty();
        private String dbusCommand = DEFAULT_DBUS_COMMAND;
        private String kwinService = DEFAULT_KWIN_SERVICE;
        private String scriptingPath = DEFAULT_SCRIPTING_PATH;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
        private String journalCommand = DEFAULT_JOURNAL_COMMAND;
        private List<String> journalUnits = DEFAULT_JOURNAL_UNITS;
        private String logPrefix = DEFAULT_LOG_PREFIX;
        private Duration logWait = DEFAULT_LOG_WAIT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder target(Optional<TargetEnvironment> target) {
            this.target = target;
            return this;
        }

        public Builder dbusCommand(String dbusCommand) {
            this.dbusCommand = dbusCommand;
            return this;
        }

        public Builder kwinService(String kwinService) {
            this.kwinService = kwinService;
            return this;
        }

        public Builder scriptingPath(String scriptingPath) {
            this.scriptingPath = scriptingPath;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder journalCommand(String journalCommand) {
            this.journalCommand = journalCommand;
            return this;
        }

        public Builder journalUnits(List<String> journalUnits) {
            this.journalUnits = journalUnits;
            return this;
        }

        public Builder logPrefix(String logPrefix) {
            this.logPrefix = logPrefix;
            return this;
        }

        public Builder logWait(Duration logWait) {
            this.logWait = logWait;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public KdotoolConfig build() {
            return new KdotoolConfig(
                debug,
                target,
                dbusCommand,
                kwinService,
                scriptingPath,
                callTimeout,
                journalCommand,
                journalUnits,
                logPrefix,
                logWait,
                pollInterval
            );
        }
    }
}
