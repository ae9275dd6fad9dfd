package work.kdotool.script;

import java.util.List;
import java.util.Objects;

/**
 * Script text together with the steps it was rendered from.
 */
public record CompiledScript(String text, List<Step> steps, String marker) {
    public CompiledScript {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(marker, "marker");
        steps = List.copyOf(steps);
    }

    public boolean hasFinalOutput() {
        return !steps.isEmpty() && steps.get(steps.size() - 1) instanceof Step.FinalOutput;
    }
}
