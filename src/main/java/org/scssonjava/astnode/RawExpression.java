package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

/**
 * An expression kept as unparsed source text.
 */
public class RawExpression implements Expression {
    public final String text;
    private final SourceSpan span;

    public RawExpression(String text, SourceSpan span) {
        this.text = text;
        this.span = span;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return text;
    }
}
