package org.scssonjava.runtime;

import org.scssonjava.lexer.SourceSpan;

import java.io.Serial;

/**
 * ScssCompilerException is raised for every parse failure: a required character
 * that is missing, an unterminated construct, or syntax that is not allowed in
 * the current mode. It carries the span of the offending source and provides a
 * detailed error message that includes the file name, position and a snippet of code.
 * <p>
 * Nothing in the scanner recovers from these errors locally; they unwind to the
 * caller of the parse.
 */
public class ScssCompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Detailed error message that includes additional context about the error
    private final String errorMessage;
    private final transient SourceSpan span;

    /**
     * Constructs a new ScssCompilerException using the error message utility.
     *
     * @param message          the detail message describing the error
     * @param span             the span where the error occurred
     * @param errorMessageUtil the utility for formatting error messages
     */
    public ScssCompilerException(String message, SourceSpan span, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.span = span;
        this.errorMessage = errorMessageUtil.errorMessage(span, message);
    }

    public ScssCompilerException(String message, SourceSpan span, String source) {
        this(message, span, new ErrorMessageUtil(span == null ? null : span.url, source));
    }

    /**
     * Returns the message without location context.
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
