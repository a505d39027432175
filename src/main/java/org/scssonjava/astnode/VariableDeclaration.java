package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

/**
 * A variable declaration, for example {@code $width: 10px !default}.
 */
public class VariableDeclaration extends AbstractStatement {
    // Module namespace, null when the variable is not namespaced
    public final String namespace;
    // Variable name without the leading '$'
    public final String name;
    public final Expression expression;
    // True for !default
    public final boolean isGuarded;
    // True for !global
    public final boolean isGlobal;
    // The silent comment immediately before this declaration, or null
    public final SilentComment comment;

    public VariableDeclaration(String namespace, String name, Expression expression, boolean isGuarded,
                               boolean isGlobal, SilentComment comment, SourceSpan span) {
        super(span);
        if (namespace != null && isGlobal) {
            throw new IllegalArgumentException("Other modules' members can't be defined with !global.");
        }
        this.namespace = namespace;
        this.name = name;
        this.expression = expression;
        this.isGuarded = isGuarded;
        this.isGlobal = isGlobal;
        this.comment = comment;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.VARIABLE_DECLARATION;
    }
}
