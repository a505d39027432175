package org.scssonjava.astnode;

import org.scssonjava.lexer.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Literal text interleaved with embedded expressions.
 * <p>
 * Each element of {@link #getContents()} is either a {@code String} or an
 * {@link Expression}. Adjacent strings never occur and strings are never empty.
 */
public class Interpolation {
    private final List<Object> contents;
    private final SourceSpan span;

    public Interpolation(List<Object> contents, SourceSpan span) {
        for (int i = 0; i < contents.size(); i++) {
            Object segment = contents.get(i);
            if (segment instanceof String) {
                if (((String) segment).isEmpty()) {
                    throw new IllegalArgumentException("Interpolation may not contain empty strings.");
                }
                if (i > 0 && contents.get(i - 1) instanceof String) {
                    throw new IllegalArgumentException("Interpolation may not contain adjacent strings.");
                }
            } else if (!(segment instanceof Expression)) {
                throw new IllegalArgumentException("Interpolation may contain only strings and expressions, was "
                        + (segment == null ? "null" : segment.getClass().getName()) + ".");
            }
        }
        this.contents = Collections.unmodifiableList(new ArrayList<>(contents));
        this.span = span;
    }

    public List<Object> getContents() {
        return contents;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Returns the plain text if this contains no expressions, otherwise null.
     */
    public String getAsPlain() {
        if (contents.isEmpty()) {
            return "";
        }
        if (contents.size() > 1 || !(contents.get(0) instanceof String)) {
            return null;
        }
        return (String) contents.get(0);
    }

    /**
     * Returns the literal text before the first expression.
     */
    public String getInitialPlain() {
        if (!contents.isEmpty() && contents.get(0) instanceof String) {
            return (String) contents.get(0);
        }
        return "";
    }

    public boolean isPlain() {
        return getAsPlain() != null;
    }

    /**
     * Renders the interpolation with each expression written as {@code #{text}}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : contents) {
            if (segment instanceof String) {
                sb.append((String) segment);
            } else {
                sb.append("#{").append(segment).append('}');
            }
        }
        return sb.toString();
    }
}
