package org.scssonjava.astvisitor;

import org.scssonjava.astnode.LoudComment;
import org.scssonjava.astnode.OpaqueStatement;
import org.scssonjava.astnode.SilentComment;
import org.scssonjava.astnode.Statement;
import org.scssonjava.astnode.VariableDeclaration;

import java.util.List;

import static org.scssonjava.runtime.ErrorMessageUtil.errorMessageQuote;

/*
 * Renders a statement list as an indented outline, one statement per line.
 *
 * Usage:
 *
 *   PrintVisitor printVisitor = new PrintVisitor();
 *   printVisitor.visit(statements);
 *   return printVisitor.getResult();
 */
public class PrintVisitor {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public static String print(Statement statement) {
        PrintVisitor printVisitor = new PrintVisitor();
        printVisitor.visit(statement);
        return printVisitor.getResult();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    public String getResult() {
        return sb.toString();
    }

    public void visit(List<Statement> statements) {
        for (Statement statement : statements) {
            visit(statement);
        }
    }

    public void visit(Statement statement) {
        appendIndent();
        switch (statement.getKind()) {
            case VARIABLE_DECLARATION: {
                VariableDeclaration node = (VariableDeclaration) statement;
                sb.append("VariableDeclaration: $").append(node.name)
                        .append(" = ").append(errorMessageQuote(String.valueOf(node.expression)));
                if (node.isGuarded) {
                    sb.append(" !default");
                }
                if (node.isGlobal) {
                    sb.append(" !global");
                }
                break;
            }
            case SILENT_COMMENT:
                sb.append("SilentComment: ").append(errorMessageQuote(((SilentComment) statement).text));
                break;
            case LOUD_COMMENT:
                sb.append("LoudComment: ").append(errorMessageQuote(((LoudComment) statement).text.toString()));
                break;
            case OPAQUE:
                if (statement instanceof OpaqueStatement) {
                    OpaqueStatement node = (OpaqueStatement) statement;
                    sb.append("Statement: ").append(errorMessageQuote(node.prelude));
                    if (node.hasChildren()) {
                        sb.append(" {").append("\n");
                        indentLevel++;
                        visit(node.children);
                        indentLevel--;
                        appendIndent();
                        sb.append("}");
                    }
                } else {
                    sb.append(statement.getClass().getSimpleName()).append(": ")
                            .append(errorMessageQuote(statement.getSpan().text));
                }
                break;
        }
        sb.append("  pos:").append(statement.getSpan().start.position).append("\n");
    }
}
