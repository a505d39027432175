package org.scssonjava.parser;

import org.scssonjava.ArgumentParser.CompilerOptions;
import org.scssonjava.astnode.LoudComment;
import org.scssonjava.astnode.SilentComment;
import org.scssonjava.astnode.Statement;
import org.scssonjava.lexer.ScannerState;
import org.scssonjava.runtime.Deprecation;
import org.scssonjava.runtime.DeprecationProcessingLogger;
import org.scssonjava.runtime.Logger;
import org.scssonjava.runtime.StderrLogger;

import java.util.ArrayList;
import java.util.List;

import static org.scssonjava.lexer.CharacterUtil.isNewline;

/**
 * A parser for the CSS-compatible, brace-delimited syntax.
 * <p>
 * This class splits a document, or a block inside it, into statements. It looks
 * at no more than the next two characters to decide what comes next:
 * <ul>
 *   <li>{@code $} starts a variable declaration</li>
 *   <li>{@code //} and {@code /*} start comments, which become nodes</li>
 *   <li>{@code ;} separates statements and produces nothing</li>
 *   <li>a closing brace ends the current block</li>
 * </ul>
 * Everything else is handed to the caller's {@link StatementParser}, which must
 * consume exactly one balanced statement.
 */
public class ScssParser extends Parser {

    public ScssParser(String contents, String url, CompilerOptions options, Logger logger,
                      ExpressionParser expressionParser) {
        super(contents, url, options, logger, expressionParser);
    }

    public ScssParser(String contents, String url, CompilerOptions options, Logger logger) {
        this(contents, url, options, logger, new DefaultExpressionParser());
    }

    public ScssParser(String contents, String url, CompilerOptions options) {
        this(contents, url, options, createLogger(options));
    }

    public ScssParser(String contents, String url) {
        this(contents, url, new CompilerOptions());
    }

    /**
     * Builds the logger described by {@code options}: quiet, or standard error
     * behind the deprecation settings.
     */
    public static Logger createLogger(CompilerOptions options) {
        if (options.quietDeps) {
            return Logger.QUIET;
        }
        return new DeprecationProcessingLogger(new StderrLogger(options.debugEnabled),
                options.silenceDeprecations, options.fatalDeprecations, !options.verbose);
    }

    /**
     * Parses the whole document, using {@link GenericStatementParser} for every
     * statement the splitter doesn't recognize itself.
     *
     * @return the top-level statements in source order
     */
    public List<Statement> parse() {
        List<Statement> result = statements(new GenericStatementParser(this));
        scanner.expectDone();
        if (logger instanceof DeprecationProcessingLogger) {
            ((DeprecationProcessingLogger) logger).summarize();
        }
        return result;
    }

    @Override
    public boolean isIndented() {
        return false;
    }

    @Override
    public int getCurrentIndentation() {
        return 0;
    }

    @Override
    public void expectStatementSeparator(String name) {
        whitespaceWithoutComments();
        if (scanner.isDone()) {
            return;
        }
        int next = scanner.peekChar();
        if (next == ';' || next == '}') {
            return;
        }
        scanner.expectChar(';');
    }

    @Override
    public boolean atEndOfStatement() {
        int next = scanner.peekChar();
        return next == -1 || next == ';' || next == '}' || next == '{';
    }

    @Override
    public boolean lookingAtChildren() {
        return scanner.peekChar() == '{';
    }

    @Override
    public boolean scanElse(int ifIndentation) {
        ScannerState start = scanner.getState();
        whitespace();
        ScannerState beforeAt = scanner.getState();
        if (scanner.scanChar('@')) {
            if (scanIdentifier("else", true)) {
                return true;
            }
            if (scanIdentifier("elseif", true)) {
                logger.warnForDeprecation(Deprecation.ELSEIF,
                        "@elseif is deprecated and will not be supported in future versions.\n"
                                + "\n"
                                + "Recommendation: @else if",
                        scanner.spanFrom(beforeAt));
                // Leave "if" for the caller, as if the source said "@else if"
                scanner.setPosition(scanner.getPosition() - 2);
                return true;
            }
        }
        scanner.setState(start);
        return false;
    }

    @Override
    public List<Statement> children(StatementParser child) {
        scanner.expectChar('{');
        whitespaceWithoutComments();
        List<Statement> children = new ArrayList<>();
        while (true) {
            switch (scanner.peekChar()) {
                case '$':
                    children.add(variableDeclarationWithoutNamespace());
                    break;

                case '/':
                    switch (scanner.peekChar(1)) {
                        case '/':
                            children.add(silentComment());
                            whitespaceWithoutComments();
                            break;
                        case '*':
                            children.add(loudComment());
                            whitespaceWithoutComments();
                            break;
                        default:
                            children.add(child.parse());
                            break;
                    }
                    break;

                case ';':
                    scanner.readChar();
                    whitespaceWithoutComments();
                    break;

                case '}':
                    scanner.expectChar('}');
                    logDebug("children: " + children.size() + " statements");
                    return children;

                default:
                    children.add(child.parse());
                    break;
            }
        }
    }

    @Override
    public List<Statement> statements(StatementParser statement) {
        List<Statement> statements = new ArrayList<>();
        whitespaceWithoutComments();
        while (!scanner.isDone()) {
            switch (scanner.peekChar()) {
                case '$':
                    statements.add(variableDeclarationWithoutNamespace());
                    break;

                case '/':
                    switch (scanner.peekChar(1)) {
                        case '/':
                            statements.add(silentComment());
                            whitespaceWithoutComments();
                            break;
                        case '*':
                            statements.add(loudComment());
                            whitespaceWithoutComments();
                            break;
                        default:
                            addIfPresent(statements, statement.parse());
                            break;
                    }
                    break;

                case ';':
                    scanner.readChar();
                    whitespaceWithoutComments();
                    break;

                default:
                    addIfPresent(statements, statement.parse());
                    break;
            }
        }
        logDebug("statements: " + statements.size() + " statements");
        return statements;
    }

    private static void addIfPresent(List<Statement> statements, Statement statement) {
        if (statement != null) {
            statements.add(statement);
        }
    }

    /**
     * Consumes a statement-level silent comment block. Consecutive {@code //}
     * lines separated only by whitespace are merged into one comment.
     */
    SilentComment silentComment() {
        ScannerState start = scanner.getState();
        scanner.expect("//");

        do {
            // Consume the rest of the line, including the line break
            while (!scanner.isDone() && !isNewline(scanner.readChar())) {
                continue;
            }
            if (scanner.isDone()) {
                break;
            }
            whitespaceWithoutComments();
        } while (scanner.scan("//"));

        if (isPlainCss()) {
            throw error("Silent comments aren't allowed in plain CSS.", scanner.spanFrom(start));
        }

        SilentComment comment = new SilentComment(scanner.substring(start.position), scanner.spanFrom(start));
        setLastSilentComment(comment);
        return comment;
    }

    /**
     * Consumes a statement-level loud comment block. CR, CRLF and FF are written
     * to the comment text as LF.
     */
    LoudComment loudComment() {
        ScannerState start = scanner.getState();
        scanner.expect("/*");
        InterpolationBuffer buffer = new InterpolationBuffer().write("/*");
        while (true) {
            switch (scanner.peekChar()) {
                case '#':
                    if (scanner.peekChar(1) == '{') {
                        buffer.add(singleInterpolation());
                    } else {
                        buffer.writeCharCode(scanner.readChar());
                    }
                    break;

                case '*':
                    buffer.writeCharCode(scanner.readChar());
                    if (scanner.peekChar() != '/') {
                        break;
                    }

                    buffer.writeCharCode(scanner.readChar());
                    return new LoudComment(buffer.interpolation(scanner.spanFrom(start)));

                case '\r':
                    scanner.readChar();
                    if (scanner.peekChar() != '\n') {
                        buffer.writeCharCode('\n');
                    }
                    break;

                case '\f':
                    scanner.readChar();
                    buffer.writeCharCode('\n');
                    break;

                default:
                    // Fails with "expected more input." if the comment is unterminated
                    buffer.writeCharCode(scanner.readChar());
                    break;
            }
        }
    }
}
