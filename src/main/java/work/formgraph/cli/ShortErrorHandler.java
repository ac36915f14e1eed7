package work.formgraph.cli;

import picocli.CommandLine;
import work.formgraph.shared.FormGraphException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof FormGraphException graphError) {
            message = graphError.code() + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("formgraph.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
