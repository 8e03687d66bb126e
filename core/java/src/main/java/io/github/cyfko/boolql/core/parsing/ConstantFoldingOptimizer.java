package io.github.cyfko.boolql.core.parsing;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprVisitor;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Tree rewriter applying constant folding and double-negation elimination.
 * <p>
 * The rewrite is a single bottom-up pass: children are optimized first, then the rules
 * below are checked in order against the optimized children. The first matching rule wins.
 * </p>
 * <ul>
 *   <li>Negation: {@code NOT TRUE → FALSE}, {@code NOT FALSE → TRUE}, {@code NOT NOT X → X}</li>
 *   <li>Conjunction: {@code TRUE AND X → X}, {@code FALSE AND X → FALSE},
 *       {@code X AND TRUE → X}, {@code X AND FALSE → FALSE}</li>
 *   <li>Disjunction: {@code TRUE OR X → TRUE}, {@code FALSE OR X → X},
 *       {@code X OR TRUE → TRUE}, {@code X OR FALSE → X}</li>
 * </ul>
 * <p>
 * Both operands of {@code AND} and {@code OR} are always optimized, even when the left one
 * already decides the result. Nodes whose children did not change are returned as is; the
 * input tree is never modified. The pass always terminates and never fails, and applying it
 * twice gives the same tree as applying it once.
 * </p>
 *
 * <pre>{@code
 * Expr optimized = ConstantFoldingOptimizer.optimize(BoolQl.parse("TRUE AND (FALSE OR A)"));
 * // Variable[name=A]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ConstantFoldingOptimizer implements ExprVisitor<Expr> {

    private static final Logger log = Logger.getLogger(ConstantFoldingOptimizer.class.getName());

    private final boolean trace;

    /**
     * @param trace whether each applied rewrite is logged at {@code FINE}
     */
    public ConstantFoldingOptimizer(boolean trace) {
        this.trace = trace;
    }

    /**
     * Optimizes a tree without tracing.
     *
     * @param expr the tree to optimize
     * @return the optimized tree, possibly {@code expr} itself
     */
    public static Expr optimize(Expr expr) {
        return optimize(expr, false);
    }

    /**
     * Optimizes a tree.
     *
     * @param expr  the tree to optimize
     * @param trace whether each applied rewrite is logged at {@code FINE}
     * @return the optimized tree, possibly {@code expr} itself
     */
    public static Expr optimize(Expr expr, boolean trace) {
        Objects.requireNonNull(expr, "Expression is required");
        return expr.accept(new ConstantFoldingOptimizer(trace));
    }

    @Override
    public Expr visitVariable(Variable expr) {
        return expr;
    }

    @Override
    public Expr visitBooleanLiteral(BooleanLiteral expr) {
        return expr;
    }

    @Override
    public Expr visitNot(Not expr) {
        Expr operand = expr.operand().accept(this);

        if (isLiteral(operand, true)) {
            trace("NOT TRUE → FALSE");
            return BooleanLiteral.FALSE;
        }
        if (isLiteral(operand, false)) {
            trace("NOT FALSE → TRUE");
            return BooleanLiteral.TRUE;
        }
        if (operand instanceof Not) {
            trace("NOT NOT X → X");
            return ((Not) operand).operand();
        }

        return operand == expr.operand() ? expr : new Not(operand);
    }

    @Override
    public Expr visitAnd(And expr) {
        Expr left = expr.left().accept(this);
        Expr right = expr.right().accept(this);

        if (isLiteral(left, true)) {
            trace("TRUE AND X → X");
            return right;
        }
        if (isLiteral(left, false)) {
            trace("FALSE AND X → FALSE");
            return BooleanLiteral.FALSE;
        }
        if (isLiteral(right, true)) {
            trace("X AND TRUE → X");
            return left;
        }
        if (isLiteral(right, false)) {
            trace("X AND FALSE → FALSE");
            return BooleanLiteral.FALSE;
        }

        return left == expr.left() && right == expr.right() ? expr : new And(left, right);
    }

    @Override
    public Expr visitOr(Or expr) {
        Expr left = expr.left().accept(this);
        Expr right = expr.right().accept(this);

        if (isLiteral(left, true)) {
            trace("TRUE OR X → TRUE");
            return BooleanLiteral.TRUE;
        }
        if (isLiteral(left, false)) {
            trace("FALSE OR X → X");
            return right;
        }
        if (isLiteral(right, true)) {
            trace("X OR TRUE → TRUE");
            return BooleanLiteral.TRUE;
        }
        if (isLiteral(right, false)) {
            trace("X OR FALSE → X");
            return left;
        }

        return left == expr.left() && right == expr.right() ? expr : new Or(left, right);
    }

    private static boolean isLiteral(Expr expr, boolean value) {
        return expr instanceof BooleanLiteral && ((BooleanLiteral) expr).value() == value;
    }

    private void trace(String rule) {
        if (trace) {
            log.fine(() -> "[OPT] " + rule);
        }
    }
}
