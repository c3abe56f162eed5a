package dev.ionfusion.fuusak.cli;

import picocli.CommandLine;

/**
 * Version from the jar manifest; {@code development} when running from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_VERSION = "development";

    @Override
    public String[] getVersion() {
        String implementationVersion = FuusakCommand.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : DEVELOPMENT_VERSION;
        return new String[] {
            "fuusak " + version,
            "Java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
