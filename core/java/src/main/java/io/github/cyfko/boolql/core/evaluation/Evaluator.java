package io.github.cyfko.boolql.core.evaluation;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprVisitor;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;
import io.github.cyfko.boolql.core.exception.InvalidBindingException;
import io.github.cyfko.boolql.core.exception.UnknownVariableException;
import io.github.cyfko.boolql.core.utils.EditDistanceUtils;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Tree-walking evaluator reducing an expression to a boolean.
 * <p>
 * Variables are looked up by exact name in the environment, which is only read.
 * {@code AND} and {@code OR} always evaluate both operands, left first, so the evaluation
 * order (and the trace) does not depend on operand values.
 * </p>
 *
 * <p><strong>Failures:</strong></p>
 * <ul>
 *   <li>{@link UnknownVariableException} when a name is not bound; it lists the bound
 *       names within three case-insensitive edits, closest first</li>
 *   <li>{@link InvalidBindingException} when a name is bound to {@code null} or to a
 *       value that is not a {@link Boolean}</li>
 * </ul>
 *
 * <pre>{@code
 * boolean result = Evaluator.evaluate(BoolQl.parse("(A OR B) AND C"),
 *         Map.of("A", true, "B", false, "C", true));   // true
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Evaluator implements ExprVisitor<Boolean> {

    private static final Logger log = Logger.getLogger(Evaluator.class.getName());

    private final Map<String, Boolean> environment;
    private final boolean trace;

    public Evaluator(Map<String, Boolean> environment) {
        this(environment, false);
    }

    /**
     * @param environment variable bindings, never modified
     * @param trace       whether each evaluation step is logged at {@code FINE}
     */
    public Evaluator(Map<String, Boolean> environment, boolean trace) {
        this.environment = Objects.requireNonNull(environment, "Environment is required");
        this.trace = trace;
    }

    /**
     * Evaluates a tree.
     *
     * @param expr        the tree
     * @param environment variable bindings
     * @return the value of the expression
     * @throws UnknownVariableException if a referenced variable is not bound
     * @throws InvalidBindingException  if a referenced variable is bound to a non-boolean
     */
    public static boolean evaluate(Expr expr, Map<String, Boolean> environment) {
        return new Evaluator(environment).evaluate(expr);
    }

    /**
     * Evaluates a tree against this evaluator's environment.
     *
     * @param expr the tree
     * @return the value of the expression
     */
    public boolean evaluate(Expr expr) {
        Objects.requireNonNull(expr, "Expression is required");
        return expr.accept(this);
    }

    @Override
    public Boolean visitVariable(Variable expr) {
        String name = expr.name();
        if (!environment.containsKey(name)) {
            List<String> suggestions = EditDistanceUtils.suggest(name, environment.keySet());
            throw new UnknownVariableException(name, suggestions);
        }

        // read through a wildcard view: a polluted map may hold anything
        Map<String, ?> bindings = environment;
        Object value = bindings.get(name);
        if (!(value instanceof Boolean)) {
            throw new InvalidBindingException(name, value);
        }

        trace(name + " = " + value);
        return (Boolean) value;
    }

    @Override
    public Boolean visitBooleanLiteral(BooleanLiteral expr) {
        trace("literal " + expr.value());
        return expr.value();
    }

    @Override
    public Boolean visitNot(Not expr) {
        boolean operand = expr.operand().accept(this);
        boolean result = !operand;
        trace("NOT " + operand + " = " + result);
        return result;
    }

    @Override
    public Boolean visitAnd(And expr) {
        boolean left = expr.left().accept(this);
        boolean right = expr.right().accept(this);
        boolean result = left & right;
        trace(left + " AND " + right + " = " + result);
        return result;
    }

    @Override
    public Boolean visitOr(Or expr) {
        boolean left = expr.left().accept(this);
        boolean right = expr.right().accept(this);
        boolean result = left | right;
        trace(left + " OR " + right + " = " + result);
        return result;
    }

    private void trace(String step) {
        if (trace) {
            log.fine(() -> "[EVAL] " + step);
        }
    }
}
