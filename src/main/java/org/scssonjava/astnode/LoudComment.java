package org.scssonjava.astnode;

/**
 * A {@code /* ... *}{@code /} comment, which is preserved in compiled CSS.
 * <p>
 * The text includes the opening and closing delimiters and may contain
 * interpolated expressions. Line breaks are normalized to line feeds.
 */
public class LoudComment extends AbstractStatement {
    public final Interpolation text;

    public LoudComment(Interpolation text) {
        super(text.getSpan());
        this.text = text;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.LOUD_COMMENT;
    }
}
