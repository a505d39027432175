package org.scssonjava.runtime;

import org.scssonjava.lexer.SourceSpan;

/**
 * Utility class for generating error messages with context from the source text.
 */
public class ErrorMessageUtil {
    // Characters of context shown on each side of the error position
    private static final int CONTEXT_BEFORE = 12;
    private static final int CONTEXT_AFTER = 8;

    private final String fileName;
    private final String source;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and source.
     *
     * @param fileName the name of the file, may be null for anonymous input
     * @param source   the full source text
     */
    public ErrorMessageUtil(String fileName, String source) {
        this.fileName = fileName;
        this.source = source;
    }

    public String getFileName() {
        return fileName == null ? "-" : fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    public static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\r':
                    escaped.append("\\r");
                    break;
                case '\f':
                    escaped.append("\\f");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message with the location and surrounding text of a span.
     *
     * @param span    the span the error refers to
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(SourceSpan span, String message) {
        if (span == null) {
            return message + "\n";
        }
        int line = span.start.line + 1;
        int column = span.start.column + 1;
        return message + " at " + getFileName() + " line " + line + ", column " + column
                + ", near " + errorMessageQuote(nearString(span)) + "\n";
    }

    /**
     * Retrieves the text around the start of a span, up to the end of that line.
     */
    String nearString(SourceSpan span) {
        if (source == null) {
            return span.text;
        }
        int from = Math.max(0, span.start.position - CONTEXT_BEFORE);
        int to = Math.min(source.length(), span.start.position + CONTEXT_AFTER);
        int lineEnd = indexOfNewline(source, span.start.position);
        if (lineEnd >= 0 && lineEnd < to) {
            to = lineEnd;
        }
        return source.substring(from, to);
    }

    private static int indexOfNewline(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\n' || c == '\r' || c == '\f') {
                return i;
            }
        }
        return -1;
    }
}
