package work.kdotool.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.kdotool.script.TargetEnvironment;
import work.kdotool.shared.DurationParser;

/**
 * Reads {@link KdotoolConfig} from TOML.
 *
 * <p>Lookup order: {@code KDOTOOL_CONFIG}, {@code $XDG_CONFIG_HOME/kdotool/config.toml},
 * {@code ~/.config/kdotool/config.toml}. A missing file means defaults.
 */
public final class ConfigLoader {
    public static final String CONFIG_ENV = "KDOTOOL_CONFIG";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    public static KdotoolConfig load(Map<String, String> env) {
        Path path = locate(env);
        if (!Files.isRegularFile(path)) {
            if (env.containsKey(CONFIG_ENV)) {
                throw new IllegalArgumentException("Config file not found: " + path);
            }
            LOG.debug("No config file at {}, using defaults", path);
            return KdotoolConfig.defaults();
        }
        return load(path);
    }

    public static KdotoolConfig load(Path path) {
        TomlParseResult result;
        try {
            result = Toml.parse(path);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Cannot read config file " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config file " + path + ": " + errors);
        }
        LOG.debug("Loaded config from {}", path);
        try {
            return fromToml(result);
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid config file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static KdotoolConfig fromToml(TomlParseResult toml) {
        var builder = KdotoolConfig.builder();
        builder.debug(toml.getBoolean("script.debug", () -> false));
        builder.target(readTarget(toml.getString("script.target")));

        builder.dbusCommand(toml.getString("kwin.dbus_command", () -> KdotoolConfig.DEFAULT_DBUS_COMMAND));
        builder.kwinService(toml.getString("kwin.service", () -> KdotoolConfig.DEFAULT_KWIN_SERVICE));
        builder.scriptingPath(toml.getString("kwin.scripting_path", () -> KdotoolConfig.DEFAULT_SCRIPTING_PATH));
        builder.callTimeout(DurationParser.parseOrDefault(
            toml.getString("kwin.call_timeout"), KdotoolConfig.DEFAULT_CALL_TIMEOUT));

        builder.journalCommand(toml.getString("journal.command", () -> KdotoolConfig.DEFAULT_JOURNAL_COMMAND));
        TomlArray units = toml.getArray("journal.units");
        if (units != null) {
            builder.journalUnits(readStrings(units));
        }
        builder.logPrefix(toml.getString("journal.log_prefix", () -> KdotoolConfig.DEFAULT_LOG_PREFIX));
        builder.logWait(DurationParser.parseOrDefault(
            toml.getString("journal.wait"), KdotoolConfig.DEFAULT_LOG_WAIT));
        builder.pollInterval(DurationParser.parseOrDefault(
            toml.getString("journal.poll_interval"), KdotoolConfig.DEFAULT_POLL_INTERVAL));
        return builder.build();
    }

    static Path locate(Map<String, String> env) {
        String explicit = env.get(CONFIG_ENV);
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit).toAbsolutePath().normalize();
        }
        String xdg = env.get("XDG_CONFIG_HOME");
        Path base = xdg != null && !xdg.isBlank()
            ? Path.of(xdg)
            : Path.of(env.getOrDefault("HOME", System.getProperty("user.home")), ".config");
        return base.resolve("kdotool").resolve("config.toml").toAbsolutePath().normalize();
    }

    private static Optional<TargetEnvironment> readTarget(String raw) {
        if (raw == null || raw.isBlank() || "auto".equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        return Optional.of(TargetEnvironment.from(raw));
    }

    private static List<String> readStrings(TomlArray array) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
