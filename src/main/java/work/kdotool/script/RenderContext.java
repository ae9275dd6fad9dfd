package work.kdotool.script;

import java.util.Objects;

/**
 * Compile-time settings that change the emitted text.
 */
public record RenderContext(String marker, boolean debug, TargetEnvironment target) {
    public RenderContext {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(target, "target");
        if (marker.isBlank() || marker.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Marker must be a non-empty token without whitespace: '" + marker + "'");
        }
    }
}
