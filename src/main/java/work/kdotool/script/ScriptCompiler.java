package work.kdotool.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.kdotool.grammar.CommandIntent;
import work.kdotool.grammar.CommandParser;
import work.kdotool.grammar.CompileException;
import work.kdotool.grammar.Selector;
import work.kdotool.grammar.TokenStream;

/**
 * Parses and lowers a command line in a single left-to-right pass.
 *
 * <p>Each intent is lowered to one {@link Step} as soon as it is parsed. When the last intent
 * is a query a {@link Step.FinalOutput} is appended so the caller sees the matched windows.
 * A {@link CompileException} aborts the whole compilation and no text is returned.
 */
public final class ScriptCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptCompiler.class);

    private final ActionRegistry actions;
    private final ScriptRenderer renderer;

    public ScriptCompiler() {
        this(ActionRegistry.standard(), new ScriptRenderer());
    }

    public ScriptCompiler(ActionRegistry actions, ScriptRenderer renderer) {
        this.actions = Objects.requireNonNull(actions, "actions");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public CompiledScript compile(List<String> tokens, RenderContext context) {
        Objects.requireNonNull(context, "context");
        var parser = new CommandParser(new TokenStream(tokens), actions.verbs());
        var steps = new ArrayList<Step>();
        var text = new StringBuilder(renderer.prologue(context));
        boolean lastIsQuery = false;

        while (parser.hasNext()) {
            CommandIntent intent = parser.next();
            Step step = lower(intent);
            LOG.debug("Lowered {} to {}", intent, step);
            steps.add(step);
            text.append(renderer.render(step, context));
            lastIsQuery = intent.isQuery();
        }

        if (lastIsQuery) {
            steps.add(Step.FinalOutput.INSTANCE);
            text.append(renderer.render(Step.FinalOutput.INSTANCE, context));
        }
        text.append(renderer.epilogue(context));
        return new CompiledScript(text.toString(), steps, context.marker());
    }

    Step lower(CommandIntent intent) {
        if (intent instanceof CommandIntent.Search search) {
            // the grammar has no switch for "any field matches" yet
            return new Step.Search(search.term(), false);
        }
        if (intent instanceof CommandIntent.GetActiveWindow) {
            return Step.GetActiveWindow.INSTANCE;
        }
        if (intent instanceof CommandIntent.Action action) {
            Action definition = actions.lookup(action.verb())
                .orElseThrow(() -> new CompileException("unknown command: " + action.verb(), action.verb()));
            Selector selector = action.selector();
            if (selector instanceof Selector.StackAll) {
                return new Step.ActionOnStackAll(definition);
            }
            if (selector instanceof Selector.StackIndex index) {
                return new Step.ActionOnStackItem(definition, index.index());
            }
            if (selector instanceof Selector.WindowId windowId) {
                return new Step.ActionOnId(definition, windowId.id());
            }
            throw new IllegalArgumentException("Unsupported selector: " + selector);
        }
        throw new IllegalArgumentException("Unsupported command: " + intent);
    }
}
