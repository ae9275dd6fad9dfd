package work.kdotool.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes Java values as JavaScript source literals.
 */
final class ScriptLiterals {
    private static final ObjectMapper JSON = new ObjectMapper();

    private ScriptLiterals() {}

    /**
     * JSON string syntax is valid JavaScript except for the two Unicode line separators,
     * which older engines reject inside string literals.
     */
    static String string(String value) {
        try {
            return JSON.writeValueAsString(value)
                .replace("\u2028", "\\u2028")
                .replace("\u2029", "\\u2029");
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to encode script literal: " + ex.getMessage(), ex);
        }
    }
}
