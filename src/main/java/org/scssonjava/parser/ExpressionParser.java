package org.scssonjava.parser;

import org.scssonjava.astnode.Expression;
import org.scssonjava.astnode.Statement;

/**
 * The expression grammar used by the statement splitter. The splitter never
 * looks inside expressions; it hands the scanner to these methods at the right
 * positions and takes back the result.
 */
public interface ExpressionParser {

    /**
     * Consumes one {@code #{...}} interpolation. The scanner is positioned at the {@code #}.
     */
    Expression singleInterpolation(Parser parser);

    /**
     * Consumes a variable declaration and its statement separator. The scanner is
     * positioned at the {@code $}.
     */
    Statement variableDeclaration(Parser parser);
}
