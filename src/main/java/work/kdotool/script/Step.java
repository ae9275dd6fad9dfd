package work.kdotool.script;

import java.util.Objects;

/**
 * One emitted unit of script logic.
 */
public interface Step {
    String name();

    /**
     * Replaces the window stack with the windows whose fields match {@code term}.
     * {@code matchAny} keeps a window when any field matches instead of all of them.
     */
    record Search(String term, boolean matchAny) implements Step {
        public Search {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public String name() {
            return "search";
        }
    }

    final class GetActiveWindow implements Step {
        public static final GetActiveWindow INSTANCE = new GetActiveWindow();

        private GetActiveWindow() {}

        @Override
        public String name() {
            return "getactivewindow";
        }

        @Override
        public String toString() {
            return "GetActiveWindow";
        }
    }

    record ActionOnId(Action action, String windowId) implements Step {
        public ActionOnId {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(windowId, "windowId");
        }

        @Override
        public String name() {
            return action.verb();
        }
    }

    record ActionOnStackItem(Action action, int index) implements Step {
        public ActionOnStackItem {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public String name() {
            return action.verb();
        }
    }

    record ActionOnStackAll(Action action) implements Step {
        public ActionOnStackAll {
            Objects.requireNonNull(action, "action");
        }

        @Override
        public String name() {
            return action.verb();
        }
    }

    /** Prints the identity of every window left on the stack. */
    final class FinalOutput implements Step {
        public static final FinalOutput INSTANCE = new FinalOutput();

        private FinalOutput() {}

        @Override
        public String name() {
            return "output";
        }

        @Override
        public String toString() {
            return "FinalOutput";
        }
    }
}
