package work.lcod.summation.cli;

import picocli.CommandLine;
import work.lcod.summation.runtime.SpecificationException;

/**
 * Prints the root cause of a failed run, prefixed by the specification error code when one
 * is in the cause chain.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String code = null;
        Throwable root = ex;
        while (true) {
            if (code == null && root instanceof SpecificationException spec) {
                code = spec.code();
            }
            if (root.getCause() == null || root.getCause() == root) {
                break;
            }
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        if (code != null) {
            message = "[" + code + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("summation.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
