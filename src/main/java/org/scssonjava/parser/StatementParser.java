package org.scssonjava.parser;

import org.scssonjava.astnode.Statement;

/**
 * Parses one ordinary statement, including any nested block, for the statement
 * splitters in {@link Parser}.
 * <p>
 * Implementations must consume exactly one balanced statement and the whitespace
 * after it. At the top level of a document an implementation may return null to
 * signal that there is nothing to add.
 */
@FunctionalInterface
public interface StatementParser {

    Statement parse();
}
