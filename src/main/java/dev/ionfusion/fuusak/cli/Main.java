package dev.ionfusion.fuusak.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(newCommandLine(new FuusakCommand()).execute(args));
    }

    static CommandLine newCommandLine(FuusakCommand command) {
        return new CommandLine(command).setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
