package work.kdotool.host;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.kdotool.config.KdotoolConfig;

/**
 * Talks to KWin's scripting interface on the session bus through {@code gdbus call}.
 */
public final class GdbusScriptHost implements ScriptHost {
    static final String SCRIPTING_INTERFACE = "org.kde.kwin.Scripting";
    static final String SCRIPT_INTERFACE = "org.kde.kwin.Script";

    private static final Logger LOG = LoggerFactory.getLogger(GdbusScriptHost.class);
    private static final Pattern INT_REPLY = Pattern.compile("\\(\\s*(?:int32\\s+)?(-?\\d+)\\s*,\\s*\\)");
    private static final Duration PROCESS_GRACE = Duration.ofSeconds(1);

    private final CommandRunner runner;
    private final String dbusCommand;
    private final String service;
    private final String scriptingPath;
    private final Duration callTimeout;

    public GdbusScriptHost(CommandRunner runner, KdotoolConfig config) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.dbusCommand = config.dbusCommand();
        this.service = config.kwinService();
        this.scriptingPath = config.scriptingPath();
        this.callTimeout = config.callTimeout();
    }

    @Override
    public int load(Path script) throws ScriptHostException {
        String reply = call(scriptingPath, SCRIPTING_INTERFACE + ".loadScript", script.toAbsolutePath().toString());
        int scriptId = parseScriptId(reply);
        if (scriptId < 0) {
            throw new ScriptHostException("KWin refused to load script " + script + " (id " + scriptId + ")");
        }
        LOG.debug("Script ID: {}", scriptId);
        return scriptId;
    }

    @Override
    public void run(int scriptId) throws ScriptHostException {
        call(scriptPath(scriptId), SCRIPT_INTERFACE + ".run");
    }

    @Override
    public void stop(int scriptId) throws ScriptHostException {
        call(scriptPath(scriptId), SCRIPT_INTERFACE + ".stop");
    }

    String scriptPath(int scriptId) {
        return scriptingPath + "/Script" + scriptId;
    }

    static int parseScriptId(String reply) throws ScriptHostException {
        Matcher matcher = INT_REPLY.matcher(reply == null ? "" : reply.trim());
        if (!matcher.find()) {
            throw new ScriptHostException("Unexpected loadScript reply: " + reply);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new ScriptHostException("Unexpected loadScript reply: " + reply, ex);
        }
    }

    private String call(String objectPath, String method, String... args) throws ScriptHostException {
        List<String> command = new ArrayList<>();
        command.add(dbusCommand);
        command.add("call");
        command.add("--session");
        command.add("--dest");
        command.add(service);
        command.add("--object-path");
        command.add(objectPath);
        command.add("--timeout");
        command.add(Long.toString(Math.max(1L, (callTimeout.toMillis() + 999L) / 1000L)));
        command.add("--method");
        command.add(method);
        command.addAll(List.of(args));

        CommandRunner.CommandResult result = runner.run(command, callTimeout.plus(PROCESS_GRACE));
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr().trim();
            throw new ScriptHostException("D-Bus call " + method + " on " + objectPath + " failed: " + detail);
        }
        return result.stdout();
    }
}
