package io.github.cyfko.boolql.core.format;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprVisitor;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a tree one node per line, children indented by two spaces.
 *
 * <pre>
 * Or
 *   Var(name=A)
 *   And
 *     Var(name=B)
 *     Not
 *       Var(name=C)
 * </pre>
 *
 * @since 1.0.0
 */
public final class TreePrinter implements ExprVisitor<Void> {

    private static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();
    private int depth = 0;

    private TreePrinter() {}

    public static String print(Expr expr) {
        TreePrinter printer = new TreePrinter();
        expr.accept(printer);
        return String.join("\n", printer.lines);
    }

    @Override
    public Void visitVariable(Variable expr) {
        line("Var(name=" + expr.name() + ")");
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteral expr) {
        line("BoolLit(value=" + expr.value() + ")");
        return null;
    }

    @Override
    public Void visitNot(Not expr) {
        line("Not");
        nested(expr.operand());
        return null;
    }

    @Override
    public Void visitAnd(And expr) {
        line("And");
        nested(expr.left(), expr.right());
        return null;
    }

    @Override
    public Void visitOr(Or expr) {
        line("Or");
        nested(expr.left(), expr.right());
        return null;
    }

    private void line(String text) {
        lines.add(INDENT.repeat(depth) + text);
    }

    private void nested(Expr... children) {
        depth++;
        try {
            for (Expr child : children) {
                child.accept(this);
            }
        } finally {
            depth--;
        }
    }
}
