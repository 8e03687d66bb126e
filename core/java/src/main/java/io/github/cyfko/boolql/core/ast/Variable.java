package io.github.cyfko.boolql.core.ast;

import java.util.Objects;

/**
 * Reference to a variable, looked up in the evaluation environment by exact (case-sensitive) name.
 *
 * @param name the identifier as written in the source
 * @since 1.0.0
 */
public record Variable(String name) implements Expr {

    public Variable {
        Objects.requireNonNull(name, "Variable name is required");
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
