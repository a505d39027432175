package org.scssonjava.lexer;

import org.scssonjava.runtime.ScssCompilerException;

/**
 * A character cursor over an immutable source string.
 * <p>
 * The scanner reads one UTF-16 unit at a time and keeps line and column
 * bookkeeping up to date, so that any position can be snapshotted with
 * {@link #getState()} and later restored with {@link #setState(ScannerState)}.
 * This is the only backtracking mechanism the parsers use.
 * <p>
 * Line breaks are LF, CR and CRLF (counted once).
 */
public class SourceScanner {
    // Returned by the peek methods past the end of the input
    public static final int EOF = -1;

    // Source being scanned
    private final String string;
    // Length of the source
    private final int length;
    // URL or file name used in spans, may be null
    private final String url;
    // Offset of the next character
    private int position;
    private int line;
    private int column;

    public SourceScanner(String string, String url) {
        this.string = string;
        this.length = string.length();
        this.url = url;
    }

    public SourceScanner(String string) {
        this(string, null);
    }

    public String getString() {
        return string;
    }

    public String getUrl() {
        return url;
    }

    public boolean isDone() {
        return position >= length;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Moves the cursor to an arbitrary offset, recomputing line and column.
     * Prefer {@link #setState(ScannerState)} when a saved state is available.
     */
    public void setPosition(int newPosition) {
        if (newPosition < 0 || newPosition > length) {
            throw new IllegalArgumentException("Invalid position " + newPosition);
        }
        ScannerState from = newPosition >= position ? getState() : new ScannerState(0, 0, 0);
        setState(countLines(from, newPosition));
    }

    private ScannerState countLines(ScannerState from, int to) {
        int l = from.line;
        int c = from.column;
        for (int i = from.position; i < to; i++) {
            char ch = string.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= length || string.charAt(i + 1) != '\n'))) {
                l++;
                c = 0;
            } else {
                c++;
            }
        }
        return new ScannerState(to, l, c);
    }

    public ScannerState getState() {
        return new ScannerState(position, line, column);
    }

    public void setState(ScannerState state) {
        this.position = state.position;
        this.line = state.line;
        this.column = state.column;
    }

    /**
     * Returns the next character without consuming it, or {@link #EOF}.
     */
    public int peekChar() {
        return peekChar(0);
    }

    /**
     * Returns the character {@code offset} positions ahead without consuming it,
     * or {@link #EOF} if that is past the end of the input.
     */
    public int peekChar(int offset) {
        int index = position + offset;
        if (index < 0 || index >= length) {
            return EOF;
        }
        return string.charAt(index);
    }

    /**
     * Consumes and returns the next character.
     *
     * @throws ScssCompilerException at the end of the input
     */
    public int readChar() {
        if (isDone()) {
            throw error("expected more input.");
        }
        char ch = string.charAt(position);
        advance(ch);
        return ch;
    }

    private void advance(char ch) {
        position++;
        if (ch == '\n' || (ch == '\r' && peekChar() != '\n')) {
            line++;
            column = 0;
        } else {
            column++;
        }
    }

    /**
     * Consumes the next character if it is {@code c}.
     *
     * @return true if the character was consumed
     */
    public boolean scanChar(int c) {
        if (isDone() || string.charAt(position) != c) {
            return false;
        }
        advance(string.charAt(position));
        return true;
    }

    /**
     * Consumes the next character, which must be {@code c}.
     *
     * @throws ScssCompilerException if the next character is anything else
     */
    public void expectChar(int c) {
        if (scanChar(c)) {
            return;
        }
        throw error("expected \"" + (char) c + "\".");
    }

    /**
     * Consumes {@code text} if the input continues with it; otherwise consumes nothing.
     *
     * @return true if the text was consumed
     */
    public boolean scan(String text) {
        if (!string.startsWith(text, position)) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            advance(string.charAt(position));
        }
        return true;
    }

    /**
     * Returns true if the input continues with {@code text}, without consuming it.
     */
    public boolean matches(String text) {
        return string.startsWith(text, position);
    }

    public void expect(String text) {
        if (scan(text)) {
            return;
        }
        throw error("expected \"" + text + "\".");
    }

    /**
     * Fails unless the whole input has been consumed.
     */
    public void expectDone() {
        if (isDone()) {
            return;
        }
        throw error("expected no more input.");
    }

    public String substring(int start) {
        return string.substring(start, position);
    }

    public String substring(int start, int end) {
        return string.substring(start, end);
    }

    /**
     * Creates a span from {@code start} to the current position.
     */
    public SourceSpan spanFrom(ScannerState start) {
        return spanFrom(start, getState());
    }

    public SourceSpan spanFrom(ScannerState start, ScannerState end) {
        return new SourceSpan(url, start, end, string.substring(start.position, end.position));
    }

    /**
     * An empty span at the current position.
     */
    public SourceSpan emptySpan() {
        ScannerState here = getState();
        return new SourceSpan(url, here, here, "");
    }

    /**
     * A span covering the next character, or an empty span at the end of input.
     */
    public SourceSpan nextCharSpan() {
        ScannerState here = getState();
        if (isDone()) {
            return new SourceSpan(url, here, here, "");
        }
        ScannerState after = countLines(here, position + 1);
        return spanFrom(here, after);
    }

    /**
     * Builds an error at the next character; the caller throws it.
     */
    public ScssCompilerException error(String message) {
        return new ScssCompilerException(message, nextCharSpan(), string);
    }

    @Override
    public String toString() {
        return "SourceScanner{" + "url=" + url + ", position=" + position + ", line=" + line + ", column=" + column + '}';
    }
}
