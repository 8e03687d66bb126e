package io.github.cyfko.boolql.core.parsing;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;
import io.github.cyfko.boolql.core.exception.EndOfInputException;
import io.github.cyfko.boolql.core.exception.MissingOperandException;
import io.github.cyfko.boolql.core.exception.MissingParenthesisException;
import io.github.cyfko.boolql.core.exception.ParseException;
import io.github.cyfko.boolql.core.exception.UnexpectedTokenException;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.model.TokenType;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive-descent parser building a tree from the tokens of one expression.
 * <p>
 * Grammar, from lowest to highest precedence:
 * </p>
 * <pre>
 * expression := or
 * or         := and ( OR and )*
 * and        := not ( AND not )*
 * not        := NOT not | primary
 * primary    := IDENTIFIER | BOOLEAN_LITERAL | '(' expression ')'
 * </pre>
 * <ul>
 *   <li>{@code NOT} (3) binds tighter than {@code AND} (2), which binds tighter than {@code OR} (1)</li>
 *   <li>{@code AND} and {@code OR} are left-associative: {@code A OR B OR C} is {@code Or(Or(A, B), C)}</li>
 *   <li>{@code NOT} is right-associative: {@code NOT NOT A} is {@code Not(Not(A))}</li>
 * </ul>
 * <p>
 * The grammar is LL(1): each rule only looks at the current token. The parser consumes the
 * whole stream and stops at the first error; every error carries the location of the
 * offending token and the complete source text.
 * </p>
 * <p>
 * Chains of {@code AND}/{@code OR} are read in a loop. Parenthesized groups and {@code NOT}
 * prefixes recurse, so their combined nesting is capped: the token opening a level beyond
 * the cap raises a {@link ParseException}.
 * </p>
 *
 * <pre>{@code
 * Expr tree = RecursiveDescentParser.parse(Tokenizer.tokenize(source), source);
 * }</pre>
 *
 * <p>An instance holds the cursor of a single parse and is not reused.</p>
 *
 * @since 1.0.0
 */
public final class RecursiveDescentParser {

    private static final Logger log = Logger.getLogger(RecursiveDescentParser.class.getName());

    /**
     * Nesting cap applied by the overloads that do not take one.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 100;

    static final String EXPECTED_PRIMARY = "identifier, boolean literal or opening parenthesis";
    static final List<String> PRIMARY_ALTERNATIVES = List.of(
            "identifier", "boolean literal (TRUE/FALSE)", "opening parenthesis '('");

    private final List<Token> tokens;
    private final String source;
    private final boolean trace;
    private final int maxNestingDepth;
    private int current = 0;
    private int depth = 0;

    private RecursiveDescentParser(List<Token> tokens, String source, boolean trace, int maxNestingDepth) {
        this.tokens = tokens;
        this.source = source;
        this.trace = trace;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a complete token stream.
     *
     * @param tokens tokens produced by {@link Tokenizer}, ending with {@link TokenType#END_OF_INPUT}
     * @param source the text the tokens were read from, used in error reports
     * @return the tree of the expression
     * @throws ParseException on the first syntax error
     */
    public static Expr parse(List<Token> tokens, String source) {
        return parse(tokens, source, false);
    }

    /**
     * Parses a complete token stream, optionally logging each grammar rule at {@code FINE}.
     *
     * @param tokens tokens produced by {@link Tokenizer}, ending with {@link TokenType#END_OF_INPUT}
     * @param source the text the tokens were read from, used in error reports
     * @param trace  whether to log rule entries, exits and reductions
     * @return the tree of the expression
     * @throws ParseException on the first syntax error
     * @throws IllegalArgumentException if the stream is empty or not terminated
     */
    public static Expr parse(List<Token> tokens, String source, boolean trace) {
        return parse(tokens, source, trace, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parses a complete token stream under a nesting cap.
     *
     * @param tokens          tokens produced by {@link Tokenizer}, ending with {@link TokenType#END_OF_INPUT}
     * @param source          the text the tokens were read from, used in error reports
     * @param trace           whether to log rule entries, exits and reductions
     * @param maxNestingDepth deepest accepted stack of open parentheses and {@code NOT} prefixes
     * @return the tree of the expression
     * @throws ParseException on the first syntax error, or when nesting exceeds {@code maxNestingDepth}
     * @throws IllegalArgumentException if the stream is empty or not terminated, or the cap is not positive
     */
    public static Expr parse(List<Token> tokens, String source, boolean trace, int maxNestingDepth) {
        Objects.requireNonNull(tokens, "Token list is required");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_INPUT) {
            throw new IllegalArgumentException("Token list must end with " + TokenType.END_OF_INPUT);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
        return new RecursiveDescentParser(List.copyOf(tokens), source, trace, maxNestingDepth).parseExpression();
    }

    // ========== Grammar rules ==========

    private Expr parseExpression() {
        trace("[ENTER] expression");
        Expr expr = parseOr();
        if (!isAtEnd()) {
            Token token = peek(0);
            throw new UnexpectedTokenException("end of expression", token.describe(), token.location(), source);
        }
        trace("[EXIT] expression");
        return expr;
    }

    private Expr parseOr() {
        trace("[ENTER] or");
        Expr expr = parseAnd();
        while (match(TokenType.OR)) {
            trace("  [REDUCE] OR");
            Expr right = parseAnd();
            expr = new Or(expr, right);
        }
        trace("[EXIT] or");
        return expr;
    }

    private Expr parseAnd() {
        trace("[ENTER] and");
        Expr expr = parseNot();
        while (match(TokenType.AND)) {
            trace("  [REDUCE] AND");
            Expr right = parseNot();
            expr = new And(expr, right);
        }
        trace("[EXIT] and");
        return expr;
    }

    private Expr parseNot() {
        trace("[ENTER] not");
        Expr expr;
        Token token = peek(0);
        if (match(TokenType.NOT)) {
            trace("  [REDUCE] NOT");
            enterNesting(token);
            expr = new Not(parseNot());
            depth--;
        } else {
            expr = parsePrimary();
        }
        trace("[EXIT] not");
        return expr;
    }

    private Expr parsePrimary() {
        trace("[ENTER] primary");
        Token token = peek(0);

        if (match(TokenType.BOOLEAN_LITERAL)) {
            trace("  [REDUCE] BOOLEAN_LITERAL(" + token.lexeme() + ")");
            return BooleanLiteral.of("TRUE".equals(token.lexeme()));
        }

        if (match(TokenType.IDENTIFIER)) {
            trace("  [REDUCE] IDENTIFIER(" + token.lexeme() + ")");
            return new Variable(token.lexeme());
        }

        if (match(TokenType.LEFT_PAREN)) {
            trace("  [REDUCE] LEFT_PAREN");
            enterNesting(token);
            Expr expr = parseOr();
            try {
                consume(TokenType.RIGHT_PAREN, "closing parenthesis ')'");
            } catch (UnexpectedTokenException e) {
                throw new MissingParenthesisException(
                        MissingParenthesisException.Kind.CLOSING, e.getLocation().orElse(null), source, e);
            }
            depth--;
            trace("[EXIT] primary");
            return expr;
        }

        if (isAtEnd()) {
            throw new EndOfInputException(EXPECTED_PRIMARY, token.location(), source);
        }

        if (token.type().isBinaryOperator()) {
            throw new MissingOperandException(
                    token.lexeme(), PRIMARY_ALTERNATIVES, token.describe(), token.location(), source);
        }

        throw new UnexpectedTokenException(PRIMARY_ALTERNATIVES, token.describe(), token.location(), source);
    }

    private void enterNesting(Token opener) {
        if (++depth > maxNestingDepth) {
            throw new ParseException(String.format(
                    "Nesting too deep at %s (max depth: %d)", opener.describe(), maxNestingDepth),
                    opener.location(), source);
        }
    }

    // ========== Cursor helpers ==========

    /**
     * Looks {@code k} tokens ahead of the cursor; past the end, yields the terminal token.
     */
    private Token peek(int k) {
        int position = current + k;
        if (position >= tokens.size()) {
            return tokens.get(tokens.size() - 1);
        }
        return tokens.get(position);
    }

    private Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return tokens.get(current - 1);
    }

    private boolean isAtEnd() {
        return peek(0).type() == TokenType.END_OF_INPUT;
    }

    private boolean check(TokenType type) {
        return !isAtEnd() && peek(0).type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            trace("  [MATCH] " + type);
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) {
            return advance();
        }
        Token token = peek(0);
        throw new UnexpectedTokenException(expected, token.describe(), token.location(), source);
    }

    private void trace(String message) {
        if (trace) {
            log.fine(message);
        }
    }
}
