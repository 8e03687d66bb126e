package io.github.cyfko.boolql.core.ast;

/**
 * Operation over a BoolQL tree with one handler per node kind.
 * <p>
 * Implementations drive recursion themselves by calling {@link Expr#accept(ExprVisitor)}
 * on children, which lets each of them choose its traversal order (the optimizer works
 * bottom-up, the pretty printers top-down).
 * </p>
 *
 * @param <R> the result type
 * @since 1.0.0
 */
public interface ExprVisitor<R> {

    R visitVariable(Variable expr);

    R visitBooleanLiteral(BooleanLiteral expr);

    R visitNot(Not expr);

    R visitAnd(And expr);

    R visitOr(Or expr);
}
