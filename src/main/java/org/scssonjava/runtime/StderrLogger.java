package org.scssonjava.runtime;

import org.scssonjava.lexer.SourceSpan;

import java.io.PrintStream;

/**
 * Writes warnings to standard error. Debug messages are printed only when
 * debugging is enabled.
 */
public class StderrLogger implements Logger {
    private final PrintStream err;
    private final boolean debugEnabled;

    public StderrLogger(boolean debugEnabled) {
        this(System.err, debugEnabled);
    }

    public StderrLogger(PrintStream err, boolean debugEnabled) {
        this.err = err;
        this.debugEnabled = debugEnabled;
    }

    @Override
    public void warn(String message, SourceSpan span, Deprecation deprecation) {
        StringBuilder sb = new StringBuilder();
        sb.append(deprecation == null ? "WARNING: " : "DEPRECATION WARNING [" + deprecation.getId() + "]: ");
        sb.append(message);
        if (span != null) {
            sb.append("\n    ").append(span.location());
        }
        err.println(sb);
        err.println();
    }

    @Override
    public void debug(String message, SourceSpan span) {
        if (!debugEnabled) {
            return;
        }
        if (span == null) {
            err.println("DEBUG: " + message);
        } else {
            err.println(span.location() + " DEBUG: " + message);
        }
    }
}
