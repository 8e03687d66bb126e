package io.github.cyfko.boolql.core.evaluation;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprVisitor;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the variable names a tree references, in order of first occurrence (left to right).
 * An environment binding all of them is enough to evaluate the tree.
 *
 * @since 1.0.0
 */
public final class VariableCollector implements ExprVisitor<Void> {

    private final Set<String> names = new LinkedHashSet<>();

    private VariableCollector() {}

    public static Set<String> collect(Expr expr) {
        VariableCollector collector = new VariableCollector();
        expr.accept(collector);
        return Collections.unmodifiableSet(collector.names);
    }

    @Override
    public Void visitVariable(Variable expr) {
        names.add(expr.name());
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteral expr) {
        return null;
    }

    @Override
    public Void visitNot(Not expr) {
        return expr.operand().accept(this);
    }

    @Override
    public Void visitAnd(And expr) {
        expr.left().accept(this);
        return expr.right().accept(this);
    }

    @Override
    public Void visitOr(Or expr) {
        expr.left().accept(this);
        return expr.right().accept(this);
    }
}
