package org.scssonjava;

/**
 * Central configuration class for the stylesheet scanner.
 * Contains constants that control scanner behavior and identify the release.
 */
public final class Configuration {

    public static final String version = "1.0.0";
    // Exit status for a stylesheet that fails to parse
    public static final int EXIT_PARSE_ERROR = 65;
    // Exit status for input that cannot be read
    public static final int EXIT_IO_ERROR = 66;
    // Exit status for invalid command line arguments
    public static final int EXIT_USAGE = 64;

    // Prevent instantiation
    private Configuration() {
    }
}
