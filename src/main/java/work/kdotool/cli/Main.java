package work.kdotool.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = commandLine(new KdotoolCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Global options are only recognised before the first command; everything after it,
     * option-like tokens included, belongs to the command grammar. Search terms may start
     * with {@code @}, so argument files are off.
     */
    static CommandLine commandLine(KdotoolCommand command) {
        return new CommandLine(command)
            .setStopAtPositional(true)
            .setExpandAtFiles(false)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
