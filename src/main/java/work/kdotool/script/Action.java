package work.kdotool.script;

import java.util.Objects;

/**
 * Catalog entry: a verb and the script fragment applied to the window bound to {@code w}.
 */
public record Action(String verb, Kind kind, String fragment) {
    public Action {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(fragment, "fragment");
    }

    public boolean isQuery() {
        return kind == Kind.QUERY;
    }

    public enum Kind {
        /** Emits RESULT lines and leaves the window untouched. */
        QUERY,
        /** Performs one side effect and emits nothing. */
        MUTATION
    }
}
