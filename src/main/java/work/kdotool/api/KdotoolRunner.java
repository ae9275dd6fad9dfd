package work.kdotool.api;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.kdotool.config.KdotoolConfig;
import work.kdotool.grammar.CompileException;
import work.kdotool.host.CommandRunner;
import work.kdotool.host.GdbusScriptHost;
import work.kdotool.host.JournalLogSource;
import work.kdotool.host.LogCollector;
import work.kdotool.host.LogSource;
import work.kdotool.host.ScriptFile;
import work.kdotool.host.ScriptHost;
import work.kdotool.host.ScriptHostException;
import work.kdotool.host.SystemCommandRunner;
import work.kdotool.protocol.DecodedOutput;
import work.kdotool.protocol.LogDecoder;
import work.kdotool.script.CompiledScript;
import work.kdotool.script.RenderContext;
import work.kdotool.script.ScriptCompiler;

/**
 * Public entry point: compiles a command line, runs it inside KWin and collects its output.
 */
public final class KdotoolRunner {
    private static final Logger LOG = LoggerFactory.getLogger(KdotoolRunner.class);

    private final ScriptCompiler compiler;
    private final ScriptHost host;
    private final LogSource logs;

    public KdotoolRunner(ScriptCompiler compiler, ScriptHost host, LogSource logs) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.host = Objects.requireNonNull(host, "host");
        this.logs = Objects.requireNonNull(logs, "logs");
    }

    /**
     * Runner talking to the session's KWin through {@code gdbus} and {@code journalctl}.
     */
    public static KdotoolRunner forSession(KdotoolConfig settings) {
        CommandRunner commands = new SystemCommandRunner();
        return new KdotoolRunner(
            new ScriptCompiler(),
            new GdbusScriptHost(commands, settings),
            new JournalLogSource(commands, settings)
        );
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        try (ScriptFile scriptFile = createScriptFile(configuration)) {
            LOG.debug("===== Generate KWin script =====");
            var context = new RenderContext(scriptFile.marker(), configuration.debug(), configuration.target());
            CompiledScript script = compiler.compile(configuration.commands(), context);
            LOG.debug("Script:{}", script.text());
            if (configuration.dryRun()) {
                return RunResult.planned(script, started);
            }
            scriptFile.write(script.text());

            LOG.debug("===== Load script into KWin =====");
            int scriptId = host.load(scriptFile.path());

            LOG.debug("===== Run script =====");
            // journalctl --since has second resolution
            LocalDateTime since = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
            try {
                host.run(scriptId);
            } catch (ScriptHostException | RuntimeException ex) {
                stopAfterFailedRun(scriptId, ex);
                throw ex;
            }
            host.stop(scriptId);

            LOG.debug("===== Output =====");
            DecodedOutput output = collector(configuration).collect(since, script.marker());
            return RunResult.success(script, output, started);
        } catch (CompileException ex) {
            LOG.debug("Compilation failed", ex);
            return RunResult.failure(ex.getMessage(), started);
        } catch (ScriptHostException ex) {
            LOG.debug("Script execution failed", ex);
            return RunResult.failure(ex.getMessage(), started);
        }
    }

    /**
     * A loaded script stays registered in KWin until stopped, so it is stopped even when
     * running it failed. A failing stop is attached to the original error.
     */
    private void stopAfterFailedRun(int scriptId, Exception failure) {
        try {
            host.stop(scriptId);
        } catch (ScriptHostException | RuntimeException stopFailure) {
            failure.addSuppressed(stopFailure);
        }
    }

    private ScriptFile createScriptFile(RunConfiguration configuration) throws ScriptHostException {
        if (configuration.scriptDirectory().isPresent()) {
            return ScriptFile.create(configuration.scriptDirectory().get());
        }
        return ScriptFile.create();
    }

    private LogCollector collector(RunConfiguration configuration) {
        KdotoolConfig settings = configuration.settings();
        return new LogCollector(logs, new LogDecoder(settings.logPrefix()), settings.logWait(), settings.pollInterval());
    }
}
