package work.kdotool.script;

import java.util.Locale;

/**
 * KWin scripting API generation the script is rendered for.
 */
public enum TargetEnvironment {
    KWIN5("workspace.clientList()"),
    KWIN6("workspace.windowList()");

    private final String windowListCall;

    TargetEnvironment(String windowListCall) {
        this.windowListCall = windowListCall;
    }

    public String windowListCall() {
        return windowListCall;
    }

    /**
     * Maps {@code KDE_SESSION_VERSION}; only Plasma 5 keeps the old client API.
     */
    public static TargetEnvironment fromSessionVersion(String version) {
        if (version != null && "5".equals(version.trim())) {
            return KWIN5;
        }
        return KWIN6;
    }

    public static TargetEnvironment from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target environment must not be empty");
        }
        try {
            return TargetEnvironment.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported target environment: " + value);
        }
    }
}
