package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

/**
 * A statement found by the statement splitter.
 * <p>
 * The splitter only classifies and appends statements, so the variants are told
 * apart by {@link #getKind()} rather than by behavior. Statements are never
 * modified after they are created.
 */
public interface Statement {

    StatementKind getKind();

    SourceSpan getSpan();
}
