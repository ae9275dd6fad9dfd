package work.kdotool.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogDecoderTest {
    private static final String MARKER = "kdotool-9f3k.js";

    private final LogDecoder decoder = new LogDecoder("js: ");

    @Test
    void splitsResultsAndErrorsInOrder() {
        var output = decoder.decode(List.of(
            "kwin_core: some unrelated line",
            "js: kdotool-9f3k.js START",
            "js: kdotool-9f3k.js DEBUG STEP search firefox",
            "js: kdotool-9f3k.js RESULT {a}",
            "js: kdotool-9f3k.js ERROR Invalid window stack selection '4' (out of range)",
            "js: kdotool-9f3k.js RESULT {b}",
            "js: kdotool-9f3k.js FINISH"
        ), MARKER);

        assertEquals(List.of("{a}", "{b}"), output.results());
        assertEquals(List.of("Invalid window stack selection '4' (out of range)"), output.errors());
        assertEquals(List.of("STEP search firefox"), output.debug());
        assertTrue(output.started());
        assertTrue(output.finished());
    }

    @Test
    void interleavedRunsAreSeparatedByMarker() {
        var lines = List.of(
            "js: kdotool-other.js START",
            "js: kdotool-9f3k.js START",
            "js: kdotool-other.js RESULT {foreign}",
            "js: kdotool-9f3k.js RESULT {mine}",
            "js: kdotool-other.js FINISH"
        );
        var output = decoder.decode(lines, MARKER);
        assertEquals(List.of("{mine}"), output.results());
        assertTrue(output.started());
        assertFalse(output.finished());

        assertEquals(List.of("{foreign}"), decoder.decode(lines, "kdotool-other.js").results());
    }

    @Test
    void prefixMayFollowJournalMetadata() {
        var output = decoder.decode(List.of("Oct 19 10:00:00 host kwin_wayland[812]: js: kdotool-9f3k.js RESULT 42"), MARKER);
        assertEquals(List.of("42"), output.results());
    }

    @Test
    void markerQuotedInsideAnotherPayloadIsIgnored() {
        var output = decoder.decode(List.of(
            "js: kdotool-other.js RESULT js: kdotool-9f3k.js RESULT {spoofed}",
            "Oct 19 10:00:00 host kwin_wayland[812]: js: kdotool-other.js RESULT js: kdotool-9f3k.js FINISH",
            "kwin_core: caption changed to js: kdotool-9f3k.js ERROR nope"
        ), MARKER);
        assertTrue(output.results().isEmpty());
        assertTrue(output.errors().isEmpty());
        assertFalse(output.finished());
    }

    @Test
    void linesWithoutTransportPrefixAreIgnored() {
        var output = decoder.decode(List.of("kdotool-9f3k.js RESULT 42"), MARKER);
        assertTrue(output.results().isEmpty());
    }

    @Test
    void emptyResultPayloadIsKept() {
        var output = decoder.decode(List.of("js: kdotool-9f3k.js RESULT "), MARKER);
        assertEquals(List.of(""), output.results());
    }
}
