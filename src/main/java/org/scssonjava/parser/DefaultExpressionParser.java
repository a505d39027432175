package org.scssonjava.parser;

import org.scssonjava.astnode.Expression;
import org.scssonjava.astnode.RawExpression;
import org.scssonjava.astnode.SilentComment;
import org.scssonjava.astnode.Statement;
import org.scssonjava.astnode.VariableDeclaration;
import org.scssonjava.lexer.ScannerState;
import org.scssonjava.lexer.SourceScanner;

/**
 * An {@link ExpressionParser} that keeps expressions as raw source text.
 * <p>
 * It finds where an expression ends by balancing brackets and skipping strings,
 * which is enough to split statements correctly without evaluating anything.
 */
public class DefaultExpressionParser implements ExpressionParser {

    @Override
    public Expression singleInterpolation(Parser parser) {
        SourceScanner scanner = parser.scanner;
        ScannerState start = scanner.getState();
        scanner.expect("#{");
        parser.whitespace();
        ScannerState contentStart = scanner.getState();
        ScannerState contentEnd = BalancedText.consume(parser, () -> scanner.peekChar() == '}');
        if (contentEnd.position == contentStart.position) {
            throw parser.error("Expected expression.", scanner.nextCharSpan());
        }
        scanner.expectChar('}');

        if (parser.isPlainCss()) {
            throw parser.error("Interpolation isn't allowed in plain CSS.", scanner.spanFrom(start));
        }

        return new RawExpression(scanner.substring(contentStart.position, contentEnd.position),
                scanner.spanFrom(contentStart, contentEnd));
    }

    @Override
    public Statement variableDeclaration(Parser parser) {
        SourceScanner scanner = parser.scanner;
        SilentComment precedingComment = parser.takeLastSilentComment();
        ScannerState start = scanner.getState();

        scanner.expectChar('$');
        String name = parser.identifier();
        if (parser.isPlainCss()) {
            throw parser.error("Sass variables aren't allowed in plain CSS.", scanner.spanFrom(start));
        }

        parser.whitespace();
        scanner.expectChar(':');
        parser.whitespace();

        ScannerState valueStart = scanner.getState();
        ScannerState valueEnd = BalancedText.consume(parser,
                () -> parser.atEndOfStatement() || lookingAtFlag(parser));
        if (valueEnd.position == valueStart.position) {
            throw parser.error("Expected expression.", scanner.nextCharSpan());
        }
        Expression value = new RawExpression(scanner.substring(valueStart.position, valueEnd.position),
                scanner.spanFrom(valueStart, valueEnd));

        boolean guarded = false;
        boolean global = false;
        ScannerState end = valueEnd;
        ScannerState flagStart = scanner.getState();
        while (scanner.scanChar('!')) {
            String flag = parser.identifier();
            if (flag.equals("default")) {
                guarded = true;
            } else if (flag.equals("global")) {
                global = true;
            } else {
                throw parser.error("Invalid flag name.", scanner.spanFrom(flagStart));
            }
            end = scanner.getState();
            parser.whitespace();
            flagStart = scanner.getState();
        }

        VariableDeclaration declaration = new VariableDeclaration(null, name, value, guarded, global,
                precedingComment, scanner.spanFrom(start, end));
        parser.expectStatementSeparator("variable declaration");
        parser.logDebug("variable declaration $" + name);
        return declaration;
    }

    /**
     * Returns true at a {@code !} that starts a declaration flag rather than
     * {@code !important}, which is part of the value.
     */
    private static boolean lookingAtFlag(Parser parser) {
        SourceScanner scanner = parser.scanner;
        if (scanner.peekChar() != '!') {
            return false;
        }
        ScannerState start = scanner.getState();
        scanner.readChar();
        parser.whitespace();
        boolean important = parser.scanIdentifier("important", false);
        scanner.setState(start);
        return !important;
    }
}
