package work.kdotool.host;

/**
 * Failure while handing a script to the window manager or reading its log back.
 */
public class ScriptHostException extends Exception {
    public ScriptHostException(String message) {
        super(message);
    }

    public ScriptHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
