package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

import java.util.Collections;
import java.util.List;

/**
 * A statement the splitter does not interpret itself, such as a style rule,
 * a declaration or an at-rule.
 */
public class OpaqueStatement extends AbstractStatement {
    // Text before the block or separator, trimmed of trailing whitespace
    public final String prelude;
    // Statements inside the block, null when the statement has no block
    public final List<Statement> children;

    public OpaqueStatement(String prelude, List<Statement> children, SourceSpan span) {
        super(span);
        this.prelude = prelude;
        this.children = children == null ? null : Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return children != null;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.OPAQUE;
    }
}
