package io.github.cyfko.boolql.core.api;

import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.exception.LexicalException;
import io.github.cyfko.boolql.core.exception.ParseException;

/**
 * Interface for parsing BoolQL source text into expression trees.
 * <p>
 * Implementations turn text such as {@code "(A OR B) AND NOT C"} into a tree of
 * {@link Expr} nodes that preserves operator precedence and associativity.
 * </p>
 *
 * <h2>Supported Syntax</h2>
 * <ul>
 *   <li><strong>Operators:</strong> {@code NOT} (highest), {@code AND}, {@code OR} (lowest); keywords in any case</li>
 *   <li><strong>Literals:</strong> {@code TRUE}, {@code FALSE}</li>
 *   <li><strong>Identifiers:</strong> {@code [A-Za-z_][A-Za-z0-9_]*}, case-sensitive</li>
 *   <li><strong>Grouping:</strong> parentheses</li>
 *   <li><strong>Comments:</strong> {@code #} to end of line, when the implementation enables them</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 *
 * parser.parse("A");                          // Variable[name=A]
 * parser.parse("A OR B AND NOT C");           // Or(A, And(B, Not(C)))
 * parser.parse("(A OR B) AND C");             // And(Or(A, B), C)
 *
 * parser.parse("(A AND B");                   // MissingParenthesisException (closing)
 * parser.parse("A AND");                      // EndOfInputException
 * parser.parse("A & B");                      // LexicalException
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Must consume the whole input and reject trailing tokens</li>
 *   <li>Must produce equal trees for identical input</li>
 *   <li>Must fail on the first error, with its location and the source text</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * Parses source text into a tree.
     *
     * @param source the text to parse
     * @return the expression tree
     * @throws LexicalException     if the text contains an invalid character
     * @throws ParseException       if the text is not a well-formed expression
     * @throws NullPointerException if {@code source} is null
     */
    Expr parse(String source);
}
