package io.github.cyfko.boolql.core.ast;

import java.util.Objects;

/**
 * Logical conjunction. Chains such as {@code A AND B AND C} nest to the left.
 *
 * @param left  left operand
 * @param right right operand
 * @since 1.0.0
 */
public record And(Expr left, Expr right) implements Expr {

    public And {
        Objects.requireNonNull(left, "AND left operand is required");
        Objects.requireNonNull(right, "AND right operand is required");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
