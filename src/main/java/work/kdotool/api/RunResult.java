package work.kdotool.api;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import work.kdotool.protocol.DecodedOutput;
import work.kdotool.script.CompiledScript;

/**
 * Outcome of a {@link KdotoolRunner} run.
 *
 * <p>{@code errors} are the recoverable ERROR lines of the script; a failed run carries its
 * cause in {@code message} instead and has no script.
 */
public record RunResult(
    Status status,
    Optional<CompiledScript> script,
    List<String> results,
    List<String> errors,
    boolean complete,
    String message,
    Instant startedAt,
    Instant finishedAt
) {
    public RunResult {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }

    public static RunResult success(CompiledScript script, DecodedOutput output, Instant startedAt) {
        return new RunResult(
            Status.SUCCESS,
            Optional.of(script),
            output.results(),
            output.errors(),
            output.finished(),
            null,
            startedAt,
            Instant.now()
        );
    }

    public static RunResult planned(CompiledScript script, Instant startedAt) {
        return new RunResult(Status.PLANNED, Optional.of(script), List.of(), List.of(), true, null, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Instant startedAt) {
        return new RunResult(Status.FAILURE, Optional.empty(), List.of(), List.of(), false, message, startedAt, Instant.now());
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        PLANNED(0);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
