package org.scssonjava.astnode;

import org.scssonjava.astvisitor.PrintVisitor;
import org.scssonjava.lexer.SourceSpan;

/**
 * Base class for the statement variants defined in this package. It holds the
 * span pointing back to the source, which is used for error messages and for
 * slicing the original text.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor.
 */
public abstract class AbstractStatement implements Statement {
    protected final SourceSpan span;

    protected AbstractStatement(SourceSpan span) {
        this.span = span;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Returns a string representation of the statement and its children.
     *
     * @return a string representation of the statement
     */
    @Override
    public String toString() {
        return PrintVisitor.print(this);
    }
}
