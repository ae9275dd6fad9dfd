package work.kdotool.grammar;

import java.util.Objects;

/**
 * Designates the windows an action applies to.
 */
public interface Selector {
    String ALL_TOKEN = "%@";
    char STACK_PREFIX = '%';

    /** Selector used when an action is given no operand. */
    Selector DEFAULT = new StackIndex(1);

    /** Canonical token form, as it would appear on the command line. */
    String token();

    static Selector parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (ALL_TOKEN.equals(raw)) {
            return StackAll.INSTANCE;
        }
        if (raw.isEmpty() || raw.charAt(0) != STACK_PREFIX) {
            return new WindowId(raw);
        }
        String digits = raw.substring(1);
        if (digits.isEmpty() || !digits.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw new CompileException("invalid window selector: " + raw, raw);
        }
        try {
            return new StackIndex(Integer.parseInt(digits));
        } catch (NumberFormatException ex) {
            throw new CompileException("window stack index out of bounds: " + raw, raw, ex);
        }
    }

    record WindowId(String id) implements Selector {
        public WindowId {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public String token() {
            return id;
        }
    }

    /**
     * 1-based position in the window stack. Range is only known when the script runs.
     */
    record StackIndex(int index) implements Selector {
        @Override
        public String token() {
            return STACK_PREFIX + Integer.toString(index);
        }
    }

    final class StackAll implements Selector {
        public static final StackAll INSTANCE = new StackAll();

        private StackAll() {}

        @Override
        public String token() {
            return ALL_TOKEN;
        }

        @Override
        public String toString() {
            return "StackAll";
        }
    }
}
