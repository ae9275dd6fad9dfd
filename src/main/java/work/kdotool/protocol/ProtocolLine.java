package work.kdotool.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * A single {@code <marker> <channel> <payload>} line.
 */
public record ProtocolLine(String marker, Channel channel, String payload) {
    public ProtocolLine {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(channel, "channel");
        payload = payload == null ? "" : payload;
    }

    /**
     * Fixed part of every line on {@code channel}; the payload follows after one space.
     */
    public static String header(String marker, Channel channel) {
        return marker + " " + channel.name();
    }

    public String render() {
        return payload.isEmpty() ? header(marker, channel) : header(marker, channel) + " " + payload;
    }

    /**
     * Parses a line already stripped of any transport prefix. Lines written under another
     * marker, or with an unknown channel, are not ours and yield empty.
     */
    public static Optional<ProtocolLine> parse(String line, String marker) {
        if (line == null || marker == null || marker.isEmpty()) {
            return Optional.empty();
        }
        String expected = marker + " ";
        if (!line.startsWith(expected)) {
            return Optional.empty();
        }
        String rest = line.substring(expected.length());
        int space = rest.indexOf(' ');
        String channelName = space < 0 ? rest : rest.substring(0, space);
        String payload = space < 0 ? "" : rest.substring(space + 1);
        return Channel.lookup(channelName).map(channel -> new ProtocolLine(marker, channel, payload));
    }
}
