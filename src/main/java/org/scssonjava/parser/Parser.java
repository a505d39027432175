package org.scssonjava.parser;

import org.scssonjava.ArgumentParser.CompilerOptions;
import org.scssonjava.astnode.Expression;
import org.scssonjava.astnode.SilentComment;
import org.scssonjava.astnode.Statement;
import org.scssonjava.lexer.ScannerState;
import org.scssonjava.lexer.SourceScanner;
import org.scssonjava.lexer.SourceSpan;
import org.scssonjava.runtime.ErrorMessageUtil;
import org.scssonjava.runtime.Logger;
import org.scssonjava.runtime.ScssCompilerException;

import java.util.List;

import static org.scssonjava.lexer.CharacterUtil.asciiToLower;
import static org.scssonjava.lexer.CharacterUtil.isName;
import static org.scssonjava.lexer.CharacterUtil.isNameStart;

/**
 * Base class for stylesheet parsers. It owns the scanner, the options and the
 * diagnostics sink of one parse, and provides the lexical helpers shared by the
 * statement-level grammars.
 * <p>
 * A parser instance is used by a single thread for a single document.
 */
public abstract class Parser {

    // Cursor over the document
    public final SourceScanner scanner;
    // Options for this parse; plain CSS mode is read once at construction
    public final CompilerOptions options;
    // Sink for deprecations and other warnings
    protected final Logger logger;
    // Grammar for embedded expressions and variable declarations
    protected final ExpressionParser expressionParser;
    protected final ErrorMessageUtil errorUtil;
    private final boolean plainCss;
    // Most recent statement-level silent comment, for productions that document themselves
    private SilentComment lastSilentComment;

    protected Parser(String contents, String url, CompilerOptions options, Logger logger,
                     ExpressionParser expressionParser) {
        this.scanner = new SourceScanner(contents, url);
        this.options = options;
        this.logger = logger;
        this.expressionParser = expressionParser;
        this.errorUtil = new ErrorMessageUtil(url, contents);
        this.plainCss = options.plainCss;
    }

    /**
     * Whether this parser accepts only plain CSS.
     */
    public boolean isPlainCss() {
        return plainCss;
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * Whether this is the indented syntax.
     */
    public abstract boolean isIndented();

    /**
     * Current indentation, for parsers of the indented syntax.
     */
    public abstract int getCurrentIndentation();

    /**
     * Consumes the end of a statement. The end of the document and a closing
     * brace both count as terminators and are not consumed.
     *
     * @param name the kind of statement being ended, for error messages; may be null
     */
    public abstract void expectStatementSeparator(String name);

    /**
     * Returns true if the current statement cannot continue at this position.
     */
    public abstract boolean atEndOfStatement();

    /**
     * Returns true if a block of child statements starts at this position.
     */
    public abstract boolean lookingAtChildren();

    /**
     * Consumes an {@code @else} introducer if one follows, otherwise leaves the
     * scanner where it was.
     *
     * @param ifIndentation the indentation of the {@code @if} the clause would belong to
     */
    public abstract boolean scanElse(int ifIndentation);

    /**
     * Consumes a block of child statements.
     */
    public abstract List<Statement> children(StatementParser child);

    /**
     * Consumes statements until the end of the document.
     */
    public abstract List<Statement> statements(StatementParser statement);

    public SilentComment getLastSilentComment() {
        return lastSilentComment;
    }

    protected void setLastSilentComment(SilentComment comment) {
        this.lastSilentComment = comment;
    }

    /**
     * Returns the last silent comment and clears it, so that it is attached to
     * at most one statement.
     */
    public SilentComment takeLastSilentComment() {
        SilentComment comment = lastSilentComment;
        lastSilentComment = null;
        return comment;
    }

    public void whitespace() {
        Whitespace.whitespace(this);
    }

    public void whitespaceWithoutComments() {
        Whitespace.whitespaceWithoutComments(scanner);
    }

    /**
     * Consumes {@code #{...}} using the expression grammar.
     */
    public Expression singleInterpolation() {
        return expressionParser.singleInterpolation(this);
    }

    /**
     * Consumes a variable declaration using the expression grammar.
     */
    public Statement variableDeclarationWithoutNamespace() {
        return expressionParser.variableDeclaration(this);
    }

    /**
     * Returns true if an identifier starts at the current position, without
     * consuming anything.
     */
    public boolean lookingAtIdentifier() {
        int first = scanner.peekChar();
        if (isNameStart(first) || first == '\\') {
            return true;
        }
        if (first != '-') {
            return false;
        }
        int second = scanner.peekChar(1);
        return isNameStart(second) || second == '\\' || second == '-';
    }

    public boolean lookingAtIdentifierBody() {
        int next = scanner.peekChar();
        return isName(next) || next == '\\';
    }

    /**
     * Consumes the identifier {@code text} if it is the whole of the identifier
     * at the current position. The scanner does not move if it doesn't match.
     *
     * @param text          the identifier to match
     * @param caseSensitive false to fold ASCII letters when comparing
     */
    public boolean scanIdentifier(String text, boolean caseSensitive) {
        if (!lookingAtIdentifier()) {
            return false;
        }
        ScannerState start = scanner.getState();
        for (int i = 0; i < text.length(); i++) {
            int expected = text.charAt(i);
            int actual = scanner.peekChar();
            boolean same = caseSensitive ? actual == expected : asciiToLower(actual) == asciiToLower(expected);
            if (!same) {
                scanner.setState(start);
                return false;
            }
            scanner.readChar();
        }
        if (lookingAtIdentifierBody()) {
            scanner.setState(start);
            return false;
        }
        return true;
    }

    /**
     * Consumes an identifier and returns its text. Escapes are kept as written.
     */
    public String identifier() {
        if (!lookingAtIdentifier()) {
            throw error("Expected identifier.", scanner.nextCharSpan());
        }
        int start = scanner.getPosition();
        while (lookingAtIdentifierBody()) {
            if (scanner.readChar() == '\\' && !scanner.isDone()) {
                scanner.readChar();
            }
        }
        return scanner.substring(start);
    }

    /**
     * Builds a parse error for {@code span}; the caller throws it.
     */
    public ScssCompilerException error(String message, SourceSpan span) {
        return new ScssCompilerException(message, span, errorUtil);
    }

    public void logDebug(String message) {
        if (options.debugEnabled) {
            logger.debug(message, scanner.emptySpan());
        }
    }
}
