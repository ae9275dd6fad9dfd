package work.kdotool.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import work.kdotool.grammar.CompileException;
import work.kdotool.protocol.Channel;

class ScriptCompilerTest {
    private static final String MARKER = "kdotool-4Hq2x.js";
    private static final RenderContext CONTEXT = new RenderContext(MARKER, false, TargetEnvironment.KWIN6);
    private static final Pattern PRINT_HEADER = Pattern.compile("print\\(\"([^\"]*)\"");

    private final ScriptCompiler compiler = new ScriptCompiler();
    private final ActionRegistry actions = ActionRegistry.standard();

    private CompiledScript compile(String... tokens) {
        return compiler.compile(List.of(tokens), CONTEXT);
    }

    private Action action(String verb) {
        return actions.lookup(verb).orElseThrow();
    }

    @Test
    void searchThenActionHasNoFinalOutput() {
        var script = compile("search", "firefox", "getwindowname", "%1");
        assertEquals(
            List.of(new Step.Search("firefox", false), new Step.ActionOnStackItem(action("getwindowname"), 1)),
            script.steps()
        );
        assertFalse(script.hasFinalOutput());
    }

    @Test
    void searchAloneEndsWithFinalOutput() {
        var script = compile("search", "firefox");
        assertEquals(List.of(new Step.Search("firefox", false), Step.FinalOutput.INSTANCE), script.steps());
        assertTrue(script.hasFinalOutput());
    }

    @Test
    void getActiveWindowAloneEndsWithFinalOutput() {
        var script = compile("windowminimize", "%@", "getactivewindow");
        assertEquals(
            List.of(new Step.ActionOnStackAll(action("windowminimize")), Step.GetActiveWindow.INSTANCE, Step.FinalOutput.INSTANCE),
            script.steps()
        );
    }

    @Test
    void bareActionTargetsFirstStackEntry() {
        assertEquals(List.of(new Step.ActionOnStackItem(action("windowclose"), 1)), compile("windowclose").steps());
    }

    @Test
    void allSelectorLowersToStackAll() {
        assertEquals(List.of(new Step.ActionOnStackAll(action("windowminimize"))), compile("windowminimize", "%@").steps());
    }

    @Test
    void literalSelectorLowersToIdLookup() {
        assertEquals(
            List.of(new Step.ActionOnId(action("windowactivate"), "{0b7f}")),
            compile("windowactivate", "{0b7f}").steps()
        );
    }

    @Test
    void stepCountFollowsIntentCount() {
        var script = compile("search", "a", "windowraise", "%@", "search", "b", "getwindowpid", "%2", "windowkill", "x");
        assertEquals(5, script.steps().size());
        assertFalse(script.hasFinalOutput());
    }

    @Test
    void stackIndexIsNotCheckedAtCompileTime() {
        var script = compile("windowclose", "%42");
        assertEquals(List.of(new Step.ActionOnStackItem(action("windowclose"), 42)), script.steps());
        assertTrue(script.text().contains("window_stack[42 - 1]"));
    }

    @Test
    void unknownCommandProducesNoScript() {
        var error = assertThrows(CompileException.class, () -> compile("foobar"));
        assertEquals("unknown command: foobar", error.getMessage());
    }

    @Test
    void identicalInputRendersIdenticalText() {
        String first = compile("search", "firefox", "windowminimize", "%@").text();
        String second = compile("search", "firefox", "windowminimize", "%@").text();
        assertEquals(first, second);
    }

    @Test
    void everyPrintStartsWithMarkerAndKnownChannel() {
        var text = new ScriptCompiler()
            .compile(List.of("search", "x", "getwindowgeometry", "%5"), new RenderContext(MARKER, true, TargetEnvironment.KWIN6))
            .text();
        Matcher matcher = PRINT_HEADER.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
            String header = matcher.group(1);
            assertTrue(header.startsWith(MARKER + " "), header);
            String channel = header.substring(MARKER.length() + 1);
            assertTrue(Channel.lookup(channel).isPresent(), channel);
        }
        assertEquals(5, count);
    }

    @Test
    void debugPrintIsOnlyEmittedWhenEnabled() {
        String quiet = compile("getactivewindow").text();
        String verbose = compiler.compile(List.of("getactivewindow"), new RenderContext(MARKER, true, TargetEnvironment.KWIN6)).text();
        assertFalse(quiet.contains(MARKER + " DEBUG"));
        assertTrue(verbose.contains(MARKER + " DEBUG"));
    }

    @Test
    void targetSelectsWindowListing() {
        var kwin5 = compiler.compile(List.of("search", "x"), new RenderContext(MARKER, false, TargetEnvironment.KWIN5)).text();
        assertTrue(kwin5.contains("workspace.clientList()"));
        assertFalse(kwin5.contains("workspace.windowList()"));
        assertTrue(compile("windowraise", "abc").text().contains("workspace.windowList()"));
    }

    @Test
    void emptyCommandLineIsJustPrologueAndEpilogue() {
        var script = compile();
        assertTrue(script.steps().isEmpty());
        assertTrue(script.text().startsWith("print(\"" + MARKER + " START\");"));
        assertTrue(script.text().endsWith("print(\"" + MARKER + " FINISH\");\n"));
    }

    @Test
    void userTextIsNeitherExpandedNorHtmlEscaped() {
        String text = compile("search", "{{#x}}{{{y}}} & <b>", "windowraise", "{{z}}").text();
        assertTrue(text.contains("new RegExp(\"{{#x}}{{{y}}} & <b>\", \"i\")"), text);
        assertTrue(text.contains("== \"{{z}}\")"), text);
    }

    @Test
    void markerMustBeASingleToken() {
        assertThrows(IllegalArgumentException.class, () -> new RenderContext("two words", false, TargetEnvironment.KWIN6));
    }
}
