package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.shared.FusionException;
import picocli.CommandLine;

/**
 * Prints a {@link FusionException} as its (possibly multi-line, located) message. Anything else is a
 * defect and is labelled as such. {@code -Dfuusak.debug=true} adds the stack trace in both cases.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "fuusak.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        } else if (!(ex instanceof FusionException)) {
            err.println("Run with -D" + DEBUG_PROPERTY + "=true for the stack trace.");
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof FusionException) {
            return ex.getMessage();
        }
        String message = ex.getMessage();
        String detail = message == null || message.isBlank() ? "" : ": " + message;
        return "Internal error (" + ex.getClass().getSimpleName() + ")" + detail;
    }
}
