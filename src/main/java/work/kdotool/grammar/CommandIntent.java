package work.kdotool.grammar;

import java.util.Objects;

/**
 * One parsed command. Query intents replace the window stack; actions only read it.
 */
public interface CommandIntent {
    boolean isQuery();

    record Search(String term) implements CommandIntent {
        public Search {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public boolean isQuery() {
            return true;
        }
    }

    final class GetActiveWindow implements CommandIntent {
        public static final GetActiveWindow INSTANCE = new GetActiveWindow();

        private GetActiveWindow() {}

        @Override
        public boolean isQuery() {
            return true;
        }

        @Override
        public String toString() {
            return "GetActiveWindow";
        }
    }

    record Action(String verb, Selector selector) implements CommandIntent {
        public Action {
            Objects.requireNonNull(verb, "verb");
            Objects.requireNonNull(selector, "selector");
        }

        @Override
        public boolean isQuery() {
            return false;
        }
    }
}
