package work.kdotool.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recovers the lines of one script run from a shared log stream.
 *
 * <p>The host prepends its own prefix (KWin writes {@code js: }) before the marker. The
 * prefix must open the line ({@code journalctl --output=cat}) or directly follow the
 * {@code ": "} ending the journal metadata; a marker quoted inside another line's payload is
 * not ours.
 */
public final class LogDecoder {
    private static final String METADATA_SEPARATOR = ": ";

    private final String transportPrefix;

    public LogDecoder(String transportPrefix) {
        this.transportPrefix = Objects.requireNonNull(transportPrefix, "transportPrefix");
    }

    public DecodedOutput decode(Iterable<String> lines, String marker) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(marker, "marker");
        List<String> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> debug = new ArrayList<>();
        boolean started = false;
        boolean finished = false;
        for (String raw : lines) {
            Optional<ProtocolLine> parsed = stripPrefix(raw, marker).flatMap(line -> ProtocolLine.parse(line, marker));
            if (parsed.isEmpty()) {
                continue;
            }
            ProtocolLine line = parsed.get();
            switch (line.channel()) {
                case START -> started = true;
                case FINISH -> finished = true;
                case RESULT -> results.add(line.payload());
                case ERROR -> errors.add(line.payload());
                case DEBUG -> debug.add(line.payload());
                default -> throw new IllegalStateException("Unhandled channel " + line.channel());
            }
        }
        return new DecodedOutput(results, errors, debug, started, finished);
    }

    private Optional<String> stripPrefix(String raw, String marker) {
        if (raw == null) {
            return Optional.empty();
        }
        String expected = transportPrefix + marker + " ";
        int start;
        if (raw.startsWith(expected)) {
            start = 0;
        } else {
            int metadataEnd = raw.indexOf(METADATA_SEPARATOR);
            if (metadataEnd < 0 || !raw.startsWith(expected, metadataEnd + METADATA_SEPARATOR.length())) {
                return Optional.empty();
            }
            start = metadataEnd + METADATA_SEPARATOR.length();
        }
        return Optional.of(raw.substring(start + transportPrefix.length()));
    }
}
