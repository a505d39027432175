package org.scssonjava.parser;

import org.scssonjava.lexer.ScannerState;
import org.scssonjava.lexer.SourceScanner;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.BooleanSupplier;

import static org.scssonjava.lexer.CharacterUtil.closingBracket;
import static org.scssonjava.lexer.CharacterUtil.isWhitespace;

/**
 * Consumes source text without interpreting it, keeping brackets balanced and
 * skipping over quoted strings, escapes, interpolation and comments.
 * <p>
 * This is how the default collaborators find the end of an expression or a
 * statement prelude without a full expression grammar.
 */
final class BalancedText {

    private BalancedText() {
    }

    /**
     * Consumes text until {@code atEnd} returns true outside of any brackets.
     *
     * @param parser the parser whose scanner is advanced
     * @param atEnd  checked before each character while no bracket is open
     * @return the state just after the last non-whitespace character consumed,
     * or the starting state if only whitespace was consumed
     */
    static ScannerState consume(Parser parser, BooleanSupplier atEnd) {
        SourceScanner scanner = parser.scanner;
        Deque<Integer> brackets = new ArrayDeque<>();
        ScannerState contentEnd = scanner.getState();
        while (true) {
            if (brackets.isEmpty() && atEnd.getAsBoolean()) {
                return contentEnd;
            }
            int next = scanner.peekChar();
            if (next == SourceScanner.EOF) {
                if (brackets.isEmpty()) {
                    return contentEnd;
                }
                throw scanner.error("expected \"" + (char) (int) brackets.peek() + "\".");
            }

            if (next == '"' || next == '\'') {
                quotedString(scanner);
            } else if (next == '\\') {
                scanner.readChar();
                if (!scanner.isDone()) {
                    scanner.readChar();
                }
            } else if (next == '/' && brackets.isEmpty() && lookingAtComment(scanner)) {
                Whitespace.scanComment(parser);
            } else if (next == '#' && scanner.peekChar(1) == '{') {
                scanner.readChar();
                scanner.readChar();
                brackets.push((int) '}');
            } else if (closingBracket(next) != -1) {
                scanner.readChar();
                brackets.push(closingBracket(next));
            } else if (next == ')' || next == ']' || next == '}') {
                if (brackets.isEmpty()) {
                    throw scanner.error("unmatched \"" + (char) next + "\".");
                }
                if (brackets.peek() != next) {
                    throw scanner.error("expected \"" + (char) (int) brackets.peek() + "\".");
                }
                brackets.pop();
                scanner.readChar();
            } else {
                scanner.readChar();
                if (isWhitespace(next)) {
                    continue;
                }
            }
            contentEnd = scanner.getState();
        }
    }

    private static boolean lookingAtComment(SourceScanner scanner) {
        int second = scanner.peekChar(1);
        return second == '/' || second == '*';
    }

    /**
     * Consumes a single- or double-quoted string, including its quotes.
     */
    static void quotedString(SourceScanner scanner) {
        int quote = scanner.readChar();
        while (true) {
            int next = scanner.peekChar();
            if (next == quote) {
                scanner.readChar();
                return;
            }
            if (next == SourceScanner.EOF || next == '\n' || next == '\r' || next == '\f') {
                throw scanner.error("Expected " + (char) quote + ".");
            }
            if (next == '\\') {
                scanner.readChar();
                if (scanner.isDone()) {
                    throw scanner.error("Expected " + (char) quote + ".");
                }
            }
            scanner.readChar();
        }
    }
}
