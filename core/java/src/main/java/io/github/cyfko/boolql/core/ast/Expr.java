package io.github.cyfko.boolql.core.ast;

/**
 * A node of a BoolQL abstract syntax tree.
 * <p>
 * The set of node kinds is closed: {@link Variable}, {@link BooleanLiteral}, {@link Not},
 * {@link And} and {@link Or}. Nodes are immutable records; each one owns its children,
 * so a tree never shares or cycles back on a node. Equality is structural: two trees
 * are equal iff they have the same shape and the same leaf values.
 * </p>
 *
 * <p>Operations over trees are written as {@link ExprVisitor}s and dispatched with
 * {@link #accept(ExprVisitor)}:</p>
 * <pre>{@code
 * Expr tree = new Or(new Variable("A"), new And(new Variable("B"), new Not(new Variable("C"))));
 * boolean value = tree.accept(new Evaluator(env));
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface Expr permits Variable, BooleanLiteral, Not, And, Or {

    /**
     * Dispatches this node to the visitor method matching its kind.
     *
     * @param visitor the visitor
     * @param <R>     result type of the visitor
     * @return the visitor's result for this node
     */
    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Serializes this tree to its tagged JSON form.
     *
     * @return compact JSON text
     * @see ExprJsonCodec#toJson(Expr)
     */
    default String toJson() {
        return ExprJsonCodec.toJson(this);
    }
}
