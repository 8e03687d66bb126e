package io.github.cyfko.boolql.core.impl;

import io.github.cyfko.boolql.core.api.ExpressionParser;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.config.SyntaxPolicy;
import io.github.cyfko.boolql.core.exception.ParseException;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.parsing.RecursiveDescentParser;
import io.github.cyfko.boolql.core.parsing.Tokenizer;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionParser}: tokenizes then parses under a {@link SyntaxPolicy}.
 * <p>
 * Two phases:
 * </p>
 * <ol>
 *   <li>{@link Tokenizer#tokenize(String, boolean)}, comments per {@link SyntaxPolicy#enableComments()}</li>
 *   <li>{@link RecursiveDescentParser#parse(List, String, boolean, int)}, traced per {@link SyntaxPolicy#trace()}
 *       and capped at {@link SyntaxPolicy#maxNestingDepth()}</li>
 * </ol>
 * <p>
 * Input longer than {@link SyntaxPolicy#maxExpressionLength()} is rejected before tokenizing.
 * Parsers hold no mutable state and can be shared between threads.
 * </p>
 *
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser(SyntaxPolicy.strict());
 * Expr tree = parser.parse("A AND NOT B");
 * }</pre>
 *
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final SyntaxPolicy syntaxPolicy;

    /**
     * Parser using {@link SyntaxPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(SyntaxPolicy.defaults());
    }

    /**
     * @param syntaxPolicy the policy to apply
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicExpressionParser(SyntaxPolicy syntaxPolicy) {
        if (syntaxPolicy == null) {
            throw new IllegalArgumentException("Syntax policy is required");
        }
        this.syntaxPolicy = syntaxPolicy;
    }

    public SyntaxPolicy getSyntaxPolicy() {
        return syntaxPolicy;
    }

    @Override
    public Expr parse(String source) {
        Objects.requireNonNull(source, "Source text is required");

        if (source.length() > syntaxPolicy.maxExpressionLength()) {
            throw new ParseException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    source.length(), syntaxPolicy.maxExpressionLength(), syntaxPolicy.policyName()
            ));
        }

        // Phase 1: tokens
        List<Token> tokens = Tokenizer.tokenize(source, syntaxPolicy.enableComments());
        if (syntaxPolicy.trace()) {
            log.fine(() -> "Tokens: " + Tokenizer.debugTokens(tokens));
        }

        // Phase 2: tree
        return RecursiveDescentParser.parse(tokens, source, syntaxPolicy.trace(), syntaxPolicy.maxNestingDepth());
    }
}
