package dev.ionfusion.fuusak.cli;

import dev.ionfusion.fuusak.api.LogLevel;
import java.io.PrintWriter;
import picocli.CommandLine;

/**
 * Command output: results go to stdout, diagnostics at or above the threshold to stderr.
 */
final class CliReporter {
    private final PrintWriter out;
    private final PrintWriter err;
    private final CommandLine.Help.ColorScheme colors;
    private final LogLevel threshold;

    CliReporter(CommandLine commandLine, LogLevel threshold) {
        this.out = commandLine.getOut();
        this.err = commandLine.getErr();
        this.colors = commandLine.getColorScheme();
        this.threshold = threshold;
    }

    void result(String text) {
        out.print(text);
        if (!text.endsWith("\n")) {
            out.println();
        }
        out.flush();
    }

    void debug(String message) {
        log(LogLevel.DEBUG, message);
    }

    void info(String message) {
        log(LogLevel.INFO, message);
    }

    void warn(String message) {
        log(LogLevel.WARN, message);
    }

    void error(String message) {
        if (threshold.enables(LogLevel.ERROR)) {
            err.println(colors.errorText(LogLevel.ERROR.decorate(message)));
            err.flush();
        }
    }

    private void log(LogLevel level, String message) {
        if (threshold.enables(level)) {
            err.println(level.decorate(message));
            err.flush();
        }
    }
}
