package org.scssonjava.parser;

import org.junit.jupiter.api.Test;
import org.scssonjava.astnode.OpaqueStatement;
import org.scssonjava.astnode.SilentComment;
import org.scssonjava.astnode.Statement;
import org.scssonjava.astnode.StatementKind;
import org.scssonjava.astnode.VariableDeclaration;
import org.scssonjava.runtime.ScssCompilerException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.scssonjava.parser.ScssParserTestSupport.parser;

public class StatementsTest {

    @Test
    public void testTopLevelStatements() {
        ScssParser parser = parser("a {b: c}\n$x: 1;\n// done\n");
        List<Statement> statements = parser.parse();

        assertEquals(3, statements.size());
        assertEquals(StatementKind.OPAQUE, statements.get(0).getKind());
        assertEquals(StatementKind.VARIABLE_DECLARATION, statements.get(1).getKind());
        assertEquals("// done\n", ((SilentComment) statements.get(2)).text);
    }

    @Test
    public void testLeadingAndTrailingWhitespace() {
        ScssParser parser = parser("  \n a: b \n ");
        List<Statement> statements = parser.parse();
        assertEquals(1, statements.size());
        assertEquals("a: b", ((OpaqueStatement) statements.get(0)).prelude);
    }

    @Test
    public void testEmptyDocument() {
        assertTrue(parser("").parse().isEmpty());
        assertTrue(parser(" \n\t ").parse().isEmpty());
    }

    @Test
    public void testSeparatorsOnly() {
        assertTrue(parser(";; ;").parse().isEmpty());
    }

    @Test
    public void testAbsentStatementIsNotAdded() {
        ScssParser parser = parser("x y");
        List<Statement> statements = parser.statements(() -> {
            parser.scanner.readChar();
            parser.whitespaceWithoutComments();
            return null;
        });
        assertTrue(statements.isEmpty());
        assertTrue(parser.scanner.isDone());
    }

    @Test
    public void testUnmatchedClosingBrace() {
        ScssParser parser = parser("a {b: c}}");
        ScssCompilerException e = assertThrows(ScssCompilerException.class, parser::parse);
        assertEquals("unmatched \"}\".", e.getRawMessage());
        assertEquals(8, e.getSpan().start.position);
    }

    @Test
    public void testMalformedStatementFailsWholeDocument() {
        ScssParser parser = parser("a {b: c}\nd: (e;\nf {g: h}");
        assertThrows(ScssCompilerException.class, parser::parse);
    }

    @Test
    public void testLeadingCommentIsAttachedToVariable() {
        ScssParser parser = parser("/// The width.\n$width: 10px;");
        List<Statement> statements = parser.parse();

        assertEquals(2, statements.size());
        VariableDeclaration declaration = (VariableDeclaration) statements.get(1);
        assertSame(statements.get(0), declaration.comment);
        assertEquals("The width.", declaration.comment.getDocComment());
        assertNull(parser.getLastSilentComment());
    }

    @Test
    public void testLastSilentCommentIsKept() {
        ScssParser parser = parser("a: b;\n// first\nc: d;\n// tail");
        assertNull(parser.getLastSilentComment());
        parser.parse();
        assertEquals("// tail", parser.getLastSilentComment().text);
    }

    @Test
    public void testIfElseChainAtTopLevel() {
        ScssParser parser = parser("@if $a { b: c } @else { d: e }");
        List<Statement> statements = parser.parse();
        assertEquals(2, statements.size());
        assertEquals("@if $a", ((OpaqueStatement) statements.get(0)).prelude);
        assertEquals("@else", ((OpaqueStatement) statements.get(1)).prelude);
    }
}
