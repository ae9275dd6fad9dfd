package work.kdotool.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.kdotool.config.KdotoolConfig;
import work.kdotool.host.ScriptHost;
import work.kdotool.host.ScriptHostException;
import work.kdotool.script.ScriptCompiler;
import work.kdotool.support.FakeWindow;
import work.kdotool.support.HarnessScriptHost;
import work.kdotool.support.ScriptHarness;

class KdotoolRunnerTest {
    private static final KdotoolConfig FAST = KdotoolConfig.builder()
        .logWait(Duration.ZERO)
        .pollInterval(Duration.ofMillis(1))
        .build();

    @TempDir
    Path scripts;

    private final HarnessScriptHost kwin = new HarnessScriptHost(ScriptHarness.kwin6(
        FakeWindow.of("{ff}", "Firefox", "firefox").withPid(77),
        FakeWindow.of("{term}", "Konsole", "konsole")
    ));

    private RunConfiguration.Builder configuration(String... commands) {
        return RunConfiguration.builder()
            .commands(List.of(commands))
            .scriptDirectory(scripts)
            .settings(FAST);
    }

    private KdotoolRunner runner() {
        return new KdotoolRunner(new ScriptCompiler(), kwin, kwin);
    }

    @Test
    void runsScriptAndCollectsResults() {
        var result = runner().run(configuration("search", "firefox", "getwindowpid").build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(List.of("77"), result.results());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.complete());
        assertEquals(List.of("load 1", "run 1", "stop 1"), kwin.calls());
    }

    @Test
    void runtimeErrorsDoNotFailTheRun() {
        var result = runner().run(configuration("search", "firefox", "windowclose", "%2", "getwindowname").build());

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(List.of("Invalid window stack selection '2' (out of range)"), result.errors());
        assertEquals(List.of("Firefox"), result.results());
    }

    @Test
    void foreignLinesInTheJournalAreIgnored() {
        kwin.appendJournal("js: kdotool-someone-else.js RESULT {intruder}");
        var result = runner().run(configuration("search", "konsole").build());
        assertEquals(List.of("{term}"), result.results());
    }

    @Test
    void dryRunOnlyCompiles() {
        var result = runner().run(configuration("windowminimize", "%@").dryRun(true).build());

        assertEquals(RunResult.Status.PLANNED, result.status());
        assertTrue(result.script().orElseThrow().text().contains("w.minimized = true;"));
        assertTrue(kwin.calls().isEmpty());
    }

    @Test
    void compileErrorFailsBeforeTalkingToKWin() {
        var result = runner().run(configuration("search", "firefox", "foobar").build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("unknown command: foobar", result.message());
        assertTrue(result.script().isEmpty());
        assertTrue(kwin.calls().isEmpty());
    }

    @Test
    void hostFailureBecomesFailureResult() {
        var broken = new KdotoolRunner(new ScriptCompiler(), new BrokenHost(), since -> List.of());
        var result = broken.run(configuration("getactivewindow").build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("KWin is not running", result.message());
        assertEquals(1, result.status().exitCode());
    }

    @Test
    void scriptIsStoppedWhenRunningItFails() {
        var host = new RunFailingHost();
        var result = new KdotoolRunner(new ScriptCompiler(), host, since -> List.of())
            .run(configuration("getactivewindow").build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("Script.run timed out", result.message());
        assertEquals(List.of("load 7", "run 7", "stop 7"), host.calls);
    }

    @Test
    void scriptFileIsRemovedAfterwards() throws IOException {
        runner().run(configuration("getactivewindow").build());
        runner().run(configuration("nope").build());
        try (Stream<Path> left = Files.list(scripts)) {
            assertFalse(left.findAny().isPresent());
        }
    }

    @Test
    void missingFinishIsReportedAsIncomplete() {
        var silent = new KdotoolRunner(new ScriptCompiler(), kwin, since -> List.of());
        var result = silent.run(configuration("getactivewindow").build());
        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertFalse(result.complete());
        assertTrue(result.results().isEmpty());
    }

    private static final class RunFailingHost implements ScriptHost {
        private final List<String> calls = new ArrayList<>();

        @Override
        public int load(Path script) {
            calls.add("load 7");
            return 7;
        }

        @Override
        public void run(int scriptId) throws ScriptHostException {
            calls.add("run " + scriptId);
            throw new ScriptHostException("Script.run timed out");
        }

        @Override
        public void stop(int scriptId) {
            calls.add("stop " + scriptId);
        }
    }

    private static final class BrokenHost implements ScriptHost {
        @Override
        public int load(Path script) throws ScriptHostException {
            throw new ScriptHostException("KWin is not running");
        }

        @Override
        public void run(int scriptId) {
        }

        @Override
        public void stop(int scriptId) {
        }
    }
}
