package org.scssonjava.parser;

import org.scssonjava.astnode.OpaqueStatement;
import org.scssonjava.astnode.Statement;
import org.scssonjava.lexer.ScannerState;
import org.scssonjava.lexer.SourceScanner;

import java.util.List;

/**
 * A grammar-neutral {@link StatementParser}: everything up to the end of the
 * statement is kept as the prelude, and a following block is split recursively
 * with the same parser.
 * <p>
 * Style rules, declarations and at-rules all come out as {@link OpaqueStatement}s.
 */
public class GenericStatementParser implements StatementParser {
    private final Parser parser;

    public GenericStatementParser(Parser parser) {
        this.parser = parser;
    }

    @Override
    public Statement parse() {
        SourceScanner scanner = parser.scanner;
        ScannerState start = scanner.getState();
        ScannerState preludeEnd = BalancedText.consume(parser, parser::atEndOfStatement);

        if (preludeEnd.position == start.position) {
            int next = scanner.peekChar();
            if (next == '}') {
                throw scanner.error("unmatched \"}\".");
            }
            if (next == SourceScanner.EOF) {
                throw scanner.error("expected \"}\".");
            }
            throw scanner.error("expected selector.");
        }
        String prelude = scanner.substring(start.position, preludeEnd.position);

        if (parser.lookingAtChildren()) {
            List<Statement> children = parser.children(this);
            OpaqueStatement statement = new OpaqueStatement(prelude, children, scanner.spanFrom(start));
            parser.whitespaceWithoutComments();
            return statement;
        }

        parser.expectStatementSeparator(null);
        return new OpaqueStatement(prelude, null, scanner.spanFrom(start, preludeEnd));
    }
}
