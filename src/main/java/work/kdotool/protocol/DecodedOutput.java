package work.kdotool.protocol;

import java.util.List;

/**
 * Everything one script run wrote to the log, split by channel.
 */
public record DecodedOutput(
    List<String> results,
    List<String> errors,
    List<String> debug,
    boolean started,
    boolean finished
) {
    public DecodedOutput {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
        debug = List.copyOf(debug);
    }

    public static DecodedOutput empty() {
        return new DecodedOutput(List.of(), List.of(), List.of(), false, false);
    }
}
