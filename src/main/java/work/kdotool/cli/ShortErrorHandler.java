package work.kdotool.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Reports unexpected failures (bad config, I/O) as a single {@code Error:} line. The stack
 * trace goes to the debug log ({@code KDOTOOL_LOG=debug}).
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ShortErrorHandler.class);

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        LOG.debug("{} failed", commandLine.getCommandName(), ex);
        commandLine.getErr().println(errorLine(commandLine, ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getSimpleName()
            : ex.getMessage()));
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String errorLine(CommandLine commandLine, String message) {
        return commandLine.getColorScheme().errorText("Error: " + message).toString();
    }
}
