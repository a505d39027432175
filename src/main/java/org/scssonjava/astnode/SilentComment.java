package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

/**
 * A block of one or more consecutive {@code //} comment lines. These comments
 * never appear in compiled CSS.
 */
public class SilentComment extends AbstractStatement {
    /**
     * The exact source text of the comment block, including line breaks and the
     * whitespace between merged lines.
     */
    public final String text;

    public SilentComment(String text, SourceSpan span) {
        super(span);
        this.text = text;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.SILENT_COMMENT;
    }

    /**
     * Returns the documentation text of this comment: the contents of its
     * {@code ///} lines, with the marker and one following space removed, joined
     * with line feeds. Returns null if there are no such lines.
     */
    public String getDocComment() {
        StringBuilder sb = new StringBuilder();
        boolean found = false;
        for (String line : text.split("\r\n|\r|\n|\f")) {
            String trimmed = line.stripLeading();
            if (!trimmed.startsWith("///")) {
                continue;
            }
            String content = trimmed.substring(3);
            if (content.startsWith(" ")) {
                content = content.substring(1);
            }
            if (found) {
                sb.append('\n');
            }
            sb.append(content);
            found = true;
        }
        return found ? sb.toString() : null;
    }
}
