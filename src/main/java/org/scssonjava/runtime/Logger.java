package org.scssonjava.runtime;

import org.scssonjava.lexer.SourceSpan;

/**
 * Sink for non-fatal diagnostics produced while parsing.
 * Hard errors are not reported here; they are thrown as {@link ScssCompilerException}.
 */
public interface Logger {

    /**
     * Emits a warning.
     *
     * @param message     the warning text
     * @param span        the source the warning refers to, may be null
     * @param deprecation the deprecation this warning is about, or null for a plain warning
     */
    void warn(String message, SourceSpan span, Deprecation deprecation);

    void debug(String message, SourceSpan span);

    default void warnForDeprecation(Deprecation deprecation, String message, SourceSpan span) {
        warn(message, span, deprecation);
    }

    /**
     * A logger that drops everything.
     */
    Logger QUIET = new Logger() {
        @Override
        public void warn(String message, SourceSpan span, Deprecation deprecation) {
        }

        @Override
        public void debug(String message, SourceSpan span) {
        }
    };
}
