package work.kdotool.script;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import work.kdotool.protocol.Channel;
import work.kdotool.protocol.ProtocolLine;

/**
 * Turns {@link Step}s into KWin script text. Rendering is a pure function of the step and
 * the {@link RenderContext}.
 *
 * <p>Every step becomes its own block inside {@code run()} so block-scoped declarations of
 * consecutive steps never clash; {@code window_stack} is the only state shared between them.
 * Values are JS source (JSON string literals, numbers, action fragments), hence the
 * unescaped {@code {{{...}}}} tags.
 */
public final class ScriptRenderer {
    private static final MustacheFactory TEMPLATES = new DefaultMustacheFactory();

    private static final Mustache PROLOGUE = compile("prologue", """
        print({{{start}}});

        function output_debug(message) {
        {{#debug}}
            print({{{debug_header}}}, message);
        {{/debug}}
        }

        function output_error(message) {
            print({{{error}}}, message);
        }

        function output_result(message) {
            print({{{result}}}, message);
        }

        function run() {
            var window_stack = [];
        """);

    private static final Mustache EPILOGUE = compile("epilogue", """
        }

        run();

        print({{{finish}}});
        """);

    private static final Mustache SEARCH = compile("search", """
            {
                output_debug({{{debug_label}}});
                window_stack = [];
                let re = null;
                try {
                    re = new RegExp({{{term}}}, "i");
                } catch (e) {
                    output_error({{{term_error}}} + e.message);
                }
                if (re !== null) {
                    const windows = {{{window_list}}};
                    for (var i = 0; i < windows.length; i++) {
                        var w = windows[i];
                        var candidates = [w.caption, w.resourceClass, w.resourceName, w.windowRole];
                        output_debug(candidates);
        {{#matchAny}}
                        for (var j = 0; j < candidates.length; j++) {
                            if (String(candidates[j] || "").search(re) >= 0) {
                                window_stack.push(w);
                                break;
                            }
                        }
        {{/matchAny}}
        {{^matchAny}}
                        var mismatch = false;
                        for (var j = 0; j < candidates.length; j++) {
                            if (String(candidates[j] || "").search(re) < 0) {
                                mismatch = true;
                                break;
                            }
                        }
                        if (!mismatch) {
                            window_stack.push(w);
                        }
        {{/matchAny}}
                    }
                }
            }
        """);

    private static final Mustache GET_ACTIVE_WINDOW = compile("getactivewindow", """
            {
                output_debug({{{debug_label}}});
                window_stack = workspace.activeWindow ? [workspace.activeWindow] : [];
            }
        """);

    private static final Mustache ACTION_ON_ID = compile("action_on_id", """
            {
                output_debug({{{debug_label}}});
                const windows = {{{window_list}}};
                for (var i = 0; i < windows.length; i++) {
                    var w = windows[i];
                    if (String(w.internalId) == {{{window_id}}}) {
                        {{{action}}}
                        break;
                    }
                }
            }
        """);

    private static final Mustache ACTION_ON_STACK_ITEM = compile("action_on_stack_item", """
            {
                output_debug({{{debug_label}}});
                if (window_stack.length > 0) {
                    if ({{{index}}} > window_stack.length || {{{index}}} < 1) {
                        output_error({{{range_error}}});
                    } else {
                        var w = window_stack[{{{index}}} - 1];
                        {{{action}}}
                    }
                }
            }
        """);

    private static final Mustache ACTION_ON_STACK_ALL = compile("action_on_stack_all", """
            {
                output_debug({{{debug_label}}});
                for (var i = 0; i < window_stack.length; i++) {
                    var w = window_stack[i];
                    {{{action}}}
                }
            }
        """);

    private static final Mustache FINAL_OUTPUT = compile("final_output", """
            {
                for (var i = 0; i < window_stack.length; i++) {
                    output_result(window_stack[i].internalId);
                }
            }
        """);

    public String prologue(RenderContext context) {
        String marker = context.marker();
        return execute(PROLOGUE, Map.of(
            "start", header(marker, Channel.START),
            "debug", context.debug(),
            "debug_header", header(marker, Channel.DEBUG),
            "error", header(marker, Channel.ERROR),
            "result", header(marker, Channel.RESULT)
        ));
    }

    public String epilogue(RenderContext context) {
        return execute(EPILOGUE, Map.of("finish", header(context.marker(), Channel.FINISH)));
    }

    public String render(Step step, RenderContext context) {
        if (step instanceof Step.Search search) {
            return execute(SEARCH, Map.of(
                "debug_label", debugLabel(search.name() + " " + search.term()),
                "term", ScriptLiterals.string(search.term()),
                "term_error", ScriptLiterals.string("Invalid search term '" + search.term() + "': "),
                "window_list", context.target().windowListCall(),
                "matchAny", search.matchAny()
            ));
        }
        if (step instanceof Step.GetActiveWindow) {
            return execute(GET_ACTIVE_WINDOW, Map.of("debug_label", debugLabel(step.name())));
        }
        if (step instanceof Step.ActionOnId onId) {
            return execute(ACTION_ON_ID, Map.of(
                "debug_label", debugLabel(onId.name()),
                "window_list", context.target().windowListCall(),
                "window_id", ScriptLiterals.string(onId.windowId()),
                "action", onId.action().fragment()
            ));
        }
        if (step instanceof Step.ActionOnStackItem item) {
            String index = Integer.toString(item.index());
            return execute(ACTION_ON_STACK_ITEM, Map.of(
                "debug_label", debugLabel(item.name()),
                "index", index,
                "range_error", ScriptLiterals.string("Invalid window stack selection '" + index + "' (out of range)"),
                "action", item.action().fragment()
            ));
        }
        if (step instanceof Step.ActionOnStackAll all) {
            return execute(ACTION_ON_STACK_ALL, Map.of(
                "debug_label", debugLabel(all.name()),
                "action", all.action().fragment()
            ));
        }
        if (step instanceof Step.FinalOutput) {
            return execute(FINAL_OUTPUT, Map.of());
        }
        throw new IllegalArgumentException("Unsupported step: " + step);
    }

    private static String debugLabel(String label) {
        return ScriptLiterals.string("STEP " + label);
    }

    private static String header(String marker, Channel channel) {
        return ScriptLiterals.string(ProtocolLine.header(marker, channel));
    }

    private static Mustache compile(String name, String template) {
        return TEMPLATES.compile(new StringReader(template), name);
    }

    private static String execute(Mustache template, Map<String, Object> scope) {
        StringWriter writer = new StringWriter();
        template.execute(writer, scope);
        return writer.toString();
    }
}
