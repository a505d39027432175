package org.scssonjava.parser;

import org.junit.jupiter.api.Test;
import org.scssonjava.astnode.Expression;
import org.scssonjava.astnode.Interpolation;
import org.scssonjava.astnode.RawExpression;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InterpolationBufferTest {

    @Test
    public void testAdjacentWritesCoalesce() {
        Expression expression = new RawExpression("x", null);
        Interpolation interpolation = new InterpolationBuffer()
                .write("a")
                .writeCharCode('b')
                .add(expression)
                .write("c")
                .interpolation(null);

        assertEquals(List.of("ab", expression, "c"), interpolation.getContents());
        assertEquals("ab", interpolation.getInitialPlain());
        assertEquals("ab#{x}c", interpolation.toString());
    }

    @Test
    public void testEmptyBuffer() {
        InterpolationBuffer buffer = new InterpolationBuffer();
        assertTrue(buffer.isEmpty());
        Interpolation interpolation = buffer.interpolation(null);
        assertTrue(interpolation.getContents().isEmpty());
        assertEquals("", interpolation.getAsPlain());
    }

    @Test
    public void testExpressionOnly() {
        Expression expression = new RawExpression("x", null);
        InterpolationBuffer buffer = new InterpolationBuffer().add(expression);
        assertFalse(buffer.isEmpty());
        Interpolation interpolation = buffer.interpolation(null);
        assertEquals(List.of(expression), interpolation.getContents());
        assertEquals("", interpolation.getInitialPlain());
        assertNull(interpolation.getAsPlain());
    }

    @Test
    public void testAddInterpolationMergesText() {
        Expression first = new RawExpression("1", null);
        Interpolation inner = new InterpolationBuffer().write("b").add(first).write("c").interpolation(null);

        Interpolation outer = new InterpolationBuffer().write("a").addInterpolation(inner).write("d").interpolation(null);

        assertEquals(List.of("ab", first, "cd"), outer.getContents());
    }
}
