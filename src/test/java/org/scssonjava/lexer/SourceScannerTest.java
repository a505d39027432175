package org.scssonjava.lexer;

import org.junit.jupiter.api.Test;
import org.scssonjava.runtime.ScssCompilerException;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    @Test
    public void testPeekDoesNotConsume() {
        SourceScanner scanner = new SourceScanner("ab");
        assertEquals('a', scanner.peekChar());
        assertEquals('b', scanner.peekChar(1));
        assertEquals(SourceScanner.EOF, scanner.peekChar(2));
        assertEquals(0, scanner.getPosition());
    }

    @Test
    public void testReadCharAdvances() {
        SourceScanner scanner = new SourceScanner("ab");
        assertEquals('a', scanner.readChar());
        assertEquals(1, scanner.getPosition());
        assertEquals('b', scanner.readChar());
        assertTrue(scanner.isDone());
    }

    @Test
    public void testReadCharAtEndFails() {
        SourceScanner scanner = new SourceScanner("");
        ScssCompilerException e = assertThrows(ScssCompilerException.class, scanner::readChar);
        assertEquals("expected more input.", e.getRawMessage());
    }

    @Test
    public void testExpectCharMismatchFailsWithoutConsuming() {
        SourceScanner scanner = new SourceScanner("x", "test.scss");
        ScssCompilerException e = assertThrows(ScssCompilerException.class, () -> scanner.expectChar(';'));
        assertEquals("expected \";\".", e.getRawMessage());
        assertEquals(0, e.getSpan().start.position);
        assertEquals("x", e.getSpan().text);
        assertEquals(0, scanner.getPosition());
    }

    @Test
    public void testScanIsNonConsumingOnFailure() {
        SourceScanner scanner = new SourceScanner("/*x");
        assertFalse(scanner.scan("//"));
        assertEquals(0, scanner.getPosition());
        assertTrue(scanner.scan("/*"));
        assertEquals(2, scanner.getPosition());
    }

    @Test
    public void testExpectStringFails() {
        SourceScanner scanner = new SourceScanner("/x");
        ScssCompilerException e = assertThrows(ScssCompilerException.class, () -> scanner.expect("//"));
        assertEquals("expected \"//\".", e.getRawMessage());
    }

    @Test
    public void testSaveAndRestoreState() {
        SourceScanner scanner = new SourceScanner("a\nb");
        ScannerState start = scanner.getState();
        scanner.readChar();
        scanner.readChar();
        scanner.readChar();
        ScannerState end = scanner.getState();
        assertEquals(new ScannerState(3, 1, 1), end);

        scanner.setState(start);
        assertEquals(0, scanner.getPosition());
        assertEquals(new ScannerState(0, 0, 0), scanner.getState());
    }

    @Test
    public void testCrLfCountsAsOneLineBreak() {
        SourceScanner scanner = new SourceScanner("a\r\nb");
        while (!scanner.isDone()) {
            scanner.readChar();
        }
        assertEquals(new ScannerState(4, 1, 1), scanner.getState());
    }

    @Test
    public void testLoneCrIsALineBreak() {
        SourceScanner scanner = new SourceScanner("a\rb");
        scanner.scan("a\rb");
        assertEquals(new ScannerState(3, 1, 1), scanner.getState());
    }

    @Test
    public void testSetPositionRecomputesLines() {
        SourceScanner scanner = new SourceScanner("ab\ncd");
        scanner.setPosition(5);
        assertEquals(new ScannerState(5, 1, 2), scanner.getState());
        scanner.setPosition(3);
        assertEquals(new ScannerState(3, 1, 0), scanner.getState());
        scanner.setPosition(1);
        assertEquals(new ScannerState(1, 0, 1), scanner.getState());
    }

    @Test
    public void testSetPositionOutOfRange() {
        SourceScanner scanner = new SourceScanner("ab");
        assertThrows(IllegalArgumentException.class, () -> scanner.setPosition(3));
    }

    @Test
    public void testSpanFrom() {
        SourceScanner scanner = new SourceScanner("foo bar", "style.scss");
        scanner.scan("foo ");
        ScannerState start = scanner.getState();
        scanner.scan("bar");
        SourceSpan span = scanner.spanFrom(start);
        assertEquals("bar", span.text);
        assertEquals(4, span.start.position);
        assertEquals(7, span.end.position);
        assertEquals(3, span.length());
        assertEquals("style.scss 1:5", span.location());
    }

    @Test
    public void testExpectDone() {
        SourceScanner scanner = new SourceScanner("a");
        ScssCompilerException e = assertThrows(ScssCompilerException.class, scanner::expectDone);
        assertEquals("expected no more input.", e.getRawMessage());
        scanner.readChar();
        assertDoesNotThrow(scanner::expectDone);
    }
}
