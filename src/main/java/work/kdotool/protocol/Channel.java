package work.kdotool.protocol;

import java.util.Optional;

/**
 * Purpose of a line written by a generated script.
 */
public enum Channel {
    START,
    DEBUG,
    ERROR,
    RESULT,
    FINISH;

    public static Optional<Channel> lookup(String value) {
        for (Channel channel : values()) {
            if (channel.name().equals(value)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
