package io.github.cyfko.boolql.core.format;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprVisitor;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;
import io.github.cyfko.boolql.core.config.ParenthesesMode;
import io.github.cyfko.boolql.core.config.PrettyOptions;

import java.util.Objects;

/**
 * Renders a tree back into BoolQL surface syntax.
 * <p>
 * Precedence is {@code NOT} (3) &gt; {@code AND} (2) &gt; {@code OR} (1); {@code AND} and
 * {@code OR} associate to the left. With {@link ParenthesesMode#MINIMAL} an operand is
 * parenthesized only when its precedence is lower than its parent's, or when it is the right
 * operand of a binary operator of the same precedence. Parsing the output then yields a tree
 * equal to the input.
 * </p>
 *
 * <pre>{@code
 * SmartPrettyPrinter.format(BoolQl.parse("((A or b)) and not (c)"));
 * // (A OR b) AND NOT c
 *
 * SmartPrettyPrinter.format(tree, PrettyOptions.builder().caseStyle(CaseStyle.LOWER).build());
 * // (A or b) and not c
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SmartPrettyPrinter implements ExprVisitor<String> {

    private static final int PREC_OR = 1;
    private static final int PREC_AND = 2;
    private static final int PREC_NOT = 3;
    private static final int PREC_ATOM = 4;

    private final PrettyOptions options;

    public SmartPrettyPrinter(PrettyOptions options) {
        this.options = Objects.requireNonNull(options, "Pretty options are required");
    }

    public static String format(Expr expr) {
        return format(expr, PrettyOptions.defaults());
    }

    public static String format(Expr expr, PrettyOptions options) {
        Objects.requireNonNull(expr, "Expression is required");
        return expr.accept(new SmartPrettyPrinter(options));
    }

    @Override
    public String visitVariable(Variable expr) {
        return expr.name();
    }

    @Override
    public String visitBooleanLiteral(BooleanLiteral expr) {
        return keyword(expr.value() ? "TRUE" : "FALSE");
    }

    @Override
    public String visitNot(Not expr) {
        String operand = operand(expr.operand(), PREC_NOT, false);
        if (options.parentheses() == ParenthesesMode.ALWAYS && expr.operand() instanceof Not) {
            operand = "(" + operand + ")";
        }
        return keyword("NOT") + " " + operand;
    }

    @Override
    public String visitAnd(And expr) {
        return binary("AND", PREC_AND, expr.left(), expr.right());
    }

    @Override
    public String visitOr(Or expr) {
        return binary("OR", PREC_OR, expr.left(), expr.right());
    }

    private String binary(String operator, int precedence, Expr left, Expr right) {
        String text = operand(left, precedence, false)
                + " " + keyword(operator) + " "
                + operand(right, precedence, true);
        return options.parentheses() == ParenthesesMode.ALWAYS ? "(" + text + ")" : text;
    }

    private String operand(Expr child, int parentPrecedence, boolean rightSide) {
        String text = child.accept(this);
        if (options.parentheses() != ParenthesesMode.MINIMAL) {
            return text;
        }
        int precedence = precedenceOf(child);
        boolean wrap = precedence < parentPrecedence
                || (rightSide && precedence == parentPrecedence);
        return wrap ? "(" + text + ")" : text;
    }

    private String keyword(String keyword) {
        return options.caseStyle().apply(keyword);
    }

    private static int precedenceOf(Expr expr) {
        if (expr instanceof Or) return PREC_OR;
        if (expr instanceof And) return PREC_AND;
        if (expr instanceof Not) return PREC_NOT;
        return PREC_ATOM;
    }
}
