package work.kdotool.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.kdotool.config.KdotoolConfig;
import work.kdotool.script.TargetEnvironment;

/**
 * Immutable input of a {@link KdotoolRunner} run.
 */
public record RunConfiguration(
    List<String> commands,
    boolean debug,
    boolean dryRun,
    TargetEnvironment target,
    Optional<Path> scriptDirectory,
    KdotoolConfig settings
) {
    public RunConfiguration {
        commands = List.copyOf(commands);
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(scriptDirectory, "scriptDirectory");
        Objects.requireNonNull(settings, "settings");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> commands = List.of();
        private boolean debug;
        private boolean dryRun;
        private TargetEnvironment target = TargetEnvironment.KWIN6;
        private Optional<Path> scriptDirectory = Optional.empty();
        private KdotoolConfig settings = KdotoolConfig.defaults();

        public Builder commands(List<String> commands) {
            this.commands = commands;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder target(TargetEnvironment target) {
            this.target = target;
            return this;
        }

        public Builder scriptDirectory(Path scriptDirectory) {
            this.scriptDirectory = Optional.ofNullable(scriptDirectory);
            return this;
        }

        public Builder settings(KdotoolConfig settings) {
            this.settings = settings;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(commands, debug, dryRun, target, scriptDirectory, settings);
        }
    }
}
