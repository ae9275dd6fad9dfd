package work.kdotool.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls {@link CommandIntent}s out of a {@link TokenStream}, one command at a time, so the
 * caller can lower each intent as soon as it is recognised.
 */
public final class CommandParser {
    public static final String SEARCH = "search";
    public static final String GET_ACTIVE_WINDOW = "getactivewindow";

    private static final Logger LOG = LoggerFactory.getLogger(CommandParser.class);

    private final TokenStream tokens;
    private final Set<String> actionVerbs;

    public CommandParser(TokenStream tokens, Set<String> actionVerbs) {
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.actionVerbs = Set.copyOf(actionVerbs);
    }

    public boolean hasNext() {
        return tokens.hasNext();
    }

    public CommandIntent next() {
        String verb = tokens.next();
        if (TokenStream.isOption(verb)) {
            throw new CompileException("unexpected option: " + verb, verb);
        }
        if (SEARCH.equals(verb)) {
            return parseSearch();
        }
        if (GET_ACTIVE_WINDOW.equals(verb)) {
            return CommandIntent.GetActiveWindow.INSTANCE;
        }
        if (actionVerbs.contains(verb)) {
            return parseAction(verb);
        }
        throw new CompileException("unknown command: " + verb, verb);
    }

    public List<CommandIntent> parseAll() {
        var intents = new ArrayList<CommandIntent>();
        while (hasNext()) {
            intents.add(next());
        }
        return intents;
    }

    public boolean isVerb(String token) {
        return SEARCH.equals(token) || GET_ACTIVE_WINDOW.equals(token) || actionVerbs.contains(token);
    }

    private CommandIntent parseSearch() {
        if (!tokens.hasNext()) {
            throw new CompileException("missing search term", null);
        }
        if (tokens.nextIsOption()) {
            String option = tokens.next();
            throw new CompileException("missing search term (found option " + option + ")", option);
        }
        return new CommandIntent.Search(tokens.next());
    }

    private CommandIntent parseAction(String verb) {
        // leading options are reserved for per-command flags
        while (tokens.nextIsOption()) {
            LOG.debug("Ignoring option {} for {}", tokens.next(), verb);
        }
        Selector selector = Selector.DEFAULT;
        if (tokens.nextIsValue() && !isVerb(tokens.peek().orElseThrow())) {
            selector = Selector.parse(tokens.next());
        }
        return new CommandIntent.Action(verb, selector);
    }
}
