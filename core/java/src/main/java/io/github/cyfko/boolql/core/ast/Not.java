package io.github.cyfko.boolql.core.ast;

import java.util.Objects;

/**
 * Logical negation.
 *
 * @param operand the negated expression
 * @since 1.0.0
 */
public record Not(Expr operand) implements Expr {

    public Not {
        Objects.requireNonNull(operand, "NOT operand is required");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
