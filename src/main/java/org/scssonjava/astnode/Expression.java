package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

/**
 * An expression embedded in a statement, such as the contents of {@code #{...}}.
 * Expressions are produced by an {@link org.scssonjava.parser.ExpressionParser}.
 */
public interface Expression {

    SourceSpan getSpan();
}
