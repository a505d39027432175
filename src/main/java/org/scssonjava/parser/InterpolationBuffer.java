package org.scssonjava.parser;

import org.scssonjava.astnode.Expression;
import org.scssonjava.astnode.Interpolation;
import org.scssonjava.lexer.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates literal text and embedded expressions into an {@link Interpolation}.
 * <p>
 * Literal text is collected in a buffer and flushed as a single string segment
 * whenever an expression is added or the interpolation is built, so adjacent
 * writes always end up in one segment.
 */
public class InterpolationBuffer {

    /**
     * Buffer for accumulating the current literal segment
     */
    private final StringBuilder currentSegment = new StringBuilder();

    /**
     * Segments flushed so far: strings and expressions
     */
    private final List<Object> segments = new ArrayList<>();

    public InterpolationBuffer write(String text) {
        currentSegment.append(text);
        return this;
    }

    public InterpolationBuffer writeCharCode(int c) {
        currentSegment.append((char) c);
        return this;
    }

    /**
     * Appends an embedded expression after the text written so far.
     */
    public InterpolationBuffer add(Expression expression) {
        flushCurrentSegment();
        segments.add(expression);
        return this;
    }

    /**
     * Appends every segment of {@code interpolation}, merging its leading text
     * with the text written so far.
     */
    public InterpolationBuffer addInterpolation(Interpolation interpolation) {
        for (Object segment : interpolation.getContents()) {
            if (segment instanceof String) {
                currentSegment.append((String) segment);
            } else {
                add((Expression) segment);
            }
        }
        return this;
    }

    public boolean isEmpty() {
        return segments.isEmpty() && currentSegment.isEmpty();
    }

    /**
     * Builds an interpolation from everything written so far. The buffer can
     * keep being written to afterwards.
     */
    public Interpolation interpolation(SourceSpan span) {
        List<Object> contents = new ArrayList<>(segments);
        if (!currentSegment.isEmpty()) {
            contents.add(currentSegment.toString());
        }
        return new Interpolation(contents, span);
    }

    private void flushCurrentSegment() {
        if (!currentSegment.isEmpty()) {
            segments.add(currentSegment.toString());
            currentSegment.setLength(0);
        }
    }

    @Override
    public String toString() {
        return interpolation(null).toString();
    }
}
