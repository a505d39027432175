package org.scssonjava.parser;

import org.scssonjava.lexer.ScannerState;
import org.scssonjava.lexer.SourceScanner;

import static org.scssonjava.lexer.CharacterUtil.isNewline;
import static org.scssonjava.lexer.CharacterUtil.isWhitespace;

/**
 * The Whitespace class provides utility methods for skipping whitespace and
 * inline comments in the source.
 * <p>
 * These methods only skip; statement-level comments, which become nodes, are
 * handled by the statement splitter.
 */
public class Whitespace {

    private Whitespace() {
    }

    /**
     * Skips whitespace characters, stopping at comments.
     *
     * @param scanner the scanner to advance
     */
    public static void whitespaceWithoutComments(SourceScanner scanner) {
        while (!scanner.isDone() && isWhitespace(scanner.peekChar())) {
            scanner.readChar();
        }
    }

    /**
     * Skips whitespace and comments, repeatedly, until neither follows.
     *
     * @param parser the parser whose scanner is advanced
     */
    public static void whitespace(Parser parser) {
        do {
            whitespaceWithoutComments(parser.scanner);
        } while (scanComment(parser));
    }

    /**
     * Consumes a single comment if one starts at the current position.
     *
     * @param parser the parser whose scanner is advanced
     * @return true if a comment was consumed
     */
    public static boolean scanComment(Parser parser) {
        SourceScanner scanner = parser.scanner;
        if (scanner.peekChar() != '/') {
            return false;
        }
        int next = scanner.peekChar(1);
        if (next == '/') {
            skipSilentComment(parser);
            return true;
        } else if (next == '*') {
            skipLoudComment(scanner);
            return true;
        }
        return false;
    }

    /**
     * Consumes a {@code //} comment up to, but not including, the end of the line.
     *
     * @throws org.scssonjava.runtime.ScssCompilerException in plain CSS mode
     */
    public static void skipSilentComment(Parser parser) {
        SourceScanner scanner = parser.scanner;
        ScannerState start = scanner.getState();
        scanner.expect("//");
        while (!scanner.isDone() && !isNewline(scanner.peekChar())) {
            scanner.readChar();
        }
        if (parser.isPlainCss()) {
            throw parser.error("Silent comments aren't allowed in plain CSS.", scanner.spanFrom(start));
        }
    }

    /**
     * Consumes a {@code /*} comment including its terminator.
     *
     * @throws org.scssonjava.runtime.ScssCompilerException if the input ends first
     */
    public static void skipLoudComment(SourceScanner scanner) {
        scanner.expect("/*");
        while (true) {
            int next = scanner.readChar();
            if (next != '*') {
                continue;
            }
            do {
                next = scanner.readChar();
            } while (next == '*');
            if (next == '/') {
                break;
            }
        }
    }
}
