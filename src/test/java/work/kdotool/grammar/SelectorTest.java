package work.kdotool.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SelectorTest {
    @Test
    void percentAtSelectsWholeStack() {
        assertSame(Selector.StackAll.INSTANCE, Selector.parse("%@"));
    }

    @Test
    void percentDigitsSelectsStackPosition() {
        assertEquals(new Selector.StackIndex(3), Selector.parse("%3"));
        assertEquals(new Selector.StackIndex(12), Selector.parse("%12"));
    }

    @Test
    void zeroIsAcceptedUntilTheScriptRuns() {
        assertEquals(new Selector.StackIndex(0), Selector.parse("%0"));
    }

    @Test
    void anythingElseIsAWindowId() {
        assertEquals(
            new Selector.WindowId("{6f1c0b2e-1d3a-4a55-9c1e-2b7c51f0a9d1}"),
            Selector.parse("{6f1c0b2e-1d3a-4a55-9c1e-2b7c51f0a9d1}")
        );
        assertEquals(new Selector.WindowId("12345"), Selector.parse("12345"));
    }

    @Test
    void defaultIsFirstStackEntry() {
        assertEquals(new Selector.StackIndex(1), Selector.DEFAULT);
    }

    @Test
    void rejectsMalformedStackReference() {
        var error = assertThrows(CompileException.class, () -> Selector.parse("%first"));
        assertEquals("%first", error.token());
        assertThrows(CompileException.class, () -> Selector.parse("%"));
        assertThrows(CompileException.class, () -> Selector.parse("%-1"));
    }

    @Test
    void rejectsIndexBeyondIntRange() {
        var error = assertThrows(CompileException.class, () -> Selector.parse("%99999999999"));
        assertEquals("%99999999999", error.token());
    }

    @Test
    void tokenRoundTripsCanonicalForms() {
        assertEquals("%@", Selector.StackAll.INSTANCE.token());
        assertEquals("%2", new Selector.StackIndex(2).token());
        assertEquals("abc", new Selector.WindowId("abc").token());
    }
}
