package io.github.cyfko.boolql.core.ast;

/**
 * The constant {@code TRUE} or {@code FALSE}.
 *
 * @param value the constant value
 * @since 1.0.0
 */
public record BooleanLiteral(boolean value) implements Expr {

    public static final BooleanLiteral TRUE = new BooleanLiteral(true);
    public static final BooleanLiteral FALSE = new BooleanLiteral(false);

    /**
     * @param value the constant value
     * @return the shared literal for {@code value}
     */
    public static BooleanLiteral of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }
}
