package io.github.cyfko.boolql.core.ast;

import java.util.Objects;

/**
 * Logical disjunction. Chains such as {@code A OR B OR C} nest to the left.
 *
 * @param left  left operand
 * @param right right operand
 * @since 1.0.0
 */
public record Or(Expr left, Expr right) implements Expr {

    public Or {
        Objects.requireNonNull(left, "OR left operand is required");
        Objects.requireNonNull(right, "OR right operand is required");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
