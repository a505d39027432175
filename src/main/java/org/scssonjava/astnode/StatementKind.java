package org.scssonjava.astnode;

/**
 * Tag identifying which variant a {@link Statement} is.
 */
public enum StatementKind {
    VARIABLE_DECLARATION,
    SILENT_COMMENT,
    LOUD_COMMENT,
    // Produced by the grammar's own statement parser
    OPAQUE
}
