package work.kdotool.grammar;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Cursor over command-line tokens with a single token of lookahead.
 */
public final class TokenStream {
    private final List<String> tokens;
    private int position;

    public TokenStream(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        this.tokens = List.copyOf(tokens);
    }

    public static TokenStream of(String... tokens) {
        return new TokenStream(List.of(tokens));
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    public Optional<String> peek() {
        return hasNext() ? Optional.of(tokens.get(position)) : Optional.empty();
    }

    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more tokens");
        }
        return tokens.get(position++);
    }

    public boolean nextIsOption() {
        return peek().map(TokenStream::isOption).orElse(false);
    }

    public boolean nextIsValue() {
        return peek().map(token -> !isOption(token)).orElse(false);
    }

    public int position() {
        return position;
    }

    /**
     * A lone {@code -} is a value, as in most command-line parsers.
     */
    public static boolean isOption(String token) {
        return token != null && token.length() > 1 && token.startsWith("-");
    }
}
