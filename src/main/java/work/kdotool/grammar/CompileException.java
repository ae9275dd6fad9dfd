package work.kdotool.grammar;

/**
 * Fatal compilation failure: the command line could not be turned into a script.
 */
public final class CompileException extends RuntimeException {
    private final String token;

    public CompileException(String message, String token) {
        super(message);
        this.token = token;
    }

    public CompileException(String message, String token, Throwable cause) {
        super(message, cause);
        this.token = token;
    }

    /**
     * Offending token, or {@code null} when the failure is caused by a missing one.
     */
    public String token() {
        return token;
    }
}
