package io.github.cyfko.boolql.core;

import io.github.cyfko.boolql.core.api.ExpressionParser;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.ExprJsonCodec;
import io.github.cyfko.boolql.core.config.PrettyOptions;
import io.github.cyfko.boolql.core.config.SyntaxPolicy;
import io.github.cyfko.boolql.core.evaluation.Evaluator;
import io.github.cyfko.boolql.core.evaluation.VariableCollector;
import io.github.cyfko.boolql.core.exception.BoolQlException;
import io.github.cyfko.boolql.core.exception.EvaluationException;
import io.github.cyfko.boolql.core.exception.ExpressionDecodingException;
import io.github.cyfko.boolql.core.exception.LexicalException;
import io.github.cyfko.boolql.core.exception.ParseException;
import io.github.cyfko.boolql.core.format.SmartPrettyPrinter;
import io.github.cyfko.boolql.core.format.TreePrinter;
import io.github.cyfko.boolql.core.impl.BasicExpressionParser;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.parsing.ConstantFoldingOptimizer;
import io.github.cyfko.boolql.core.parsing.Tokenizer;
import io.github.cyfko.boolql.core.utils.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * High-level facade over the BoolQL pipeline.
 * <p>
 * Groups the operations that front ends (shells, editors, exporters) need behind static
 * methods: tokenize, parse, optimize, evaluate, serialize and print.
 * </p>
 *
 * <p><strong>Pipeline Overview:</strong></p>
 * <ol>
 *   <li><strong>Tokenize:</strong> text to tokens with {@link Tokenizer}</li>
 *   <li><strong>Parse:</strong> tokens to tree with {@link BasicExpressionParser}</li>
 *   <li><strong>Optimize:</strong> constant folding with {@link ConstantFoldingOptimizer}</li>
 *   <li><strong>Evaluate:</strong> tree to boolean with {@link Evaluator}</li>
 * </ol>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * Expr tree = BoolQl.parse("TRUE AND (FALSE OR ready) # deploy gate");
 * Expr optimized = BoolQl.optimize(tree);                 // Variable[name=ready]
 *
 * boolean go = BoolQl.evaluate(optimized, Map.of("ready", true));
 *
 * String json = BoolQl.toJson(tree);
 * Expr copy = BoolQl.fromJson(json);                      // copy.equals(tree)
 *
 * System.out.println(BoolQl.format(optimized));           // ready
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>{@link LexicalException} - invalid character</li>
 *   <li>{@link ParseException} and subtypes - malformed expression</li>
 *   <li>{@link EvaluationException} and subtypes - unbound or non-boolean variable</li>
 *   <li>{@link ExpressionDecodingException} - malformed JSON tree</li>
 * </ul>
 *
 * @see ExpressionParser
 * @see SyntaxPolicy
 * @since 1.0.0
 */
public final class BoolQl {

    private static final Logger log = Logger.getLogger(BoolQl.class.getName());

    private static final ExpressionParser DEFAULT_PARSER = new BasicExpressionParser(SyntaxPolicy.relaxed());

    private BoolQl() {}

    public static List<Token> tokenize(String source) {
        return Tokenizer.tokenize(source);
    }

    public static List<Token> tokenize(String source, boolean enableComments) {
        return Tokenizer.tokenize(source, enableComments);
    }

    /**
     * Parses source text of any length with {@link SyntaxPolicy#relaxed()}.
     * <p>
     * Nesting of parentheses and {@code NOT} prefixes is still capped by the policy.
     * </p>
     *
     * @param source the text to parse
     * @return the expression tree
     * @throws LexicalException if the text contains an invalid character
     * @throws ParseException   if the text is not a well-formed expression
     */
    public static Expr parse(String source) {
        return DEFAULT_PARSER.parse(source);
    }

    /**
     * Parses source text under the given policy.
     *
     * @param source the text to parse
     * @param policy the syntax policy
     * @return the expression tree
     * @throws LexicalException if the text contains an invalid character
     * @throws ParseException   if the text is too long or not a well-formed expression
     */
    public static Expr parse(String source, SyntaxPolicy policy) {
        return new BasicExpressionParser(policy).parse(source);
    }

    /**
     * Folds constants and removes double negations. Never fails.
     */
    public static Expr optimize(Expr expr) {
        Expr optimized = ConstantFoldingOptimizer.optimize(expr);
        if (optimized != expr) {
            log.fine(() -> "Optimized " + SmartPrettyPrinter.format(expr) + " into " + SmartPrettyPrinter.format(optimized));
        }
        return optimized;
    }

    /**
     * Evaluates a tree against variable bindings.
     *
     * @param expr        the tree
     * @param environment variable bindings, never modified
     * @return the value of the expression
     * @throws EvaluationException if a variable is unbound or bound to a non-boolean
     */
    public static boolean evaluate(Expr expr, Map<String, Boolean> environment) {
        return Evaluator.evaluate(expr, environment);
    }

    public static String toJson(Expr expr) {
        return ExprJsonCodec.toJson(expr);
    }

    /**
     * @throws ExpressionDecodingException if the text does not describe a tree
     */
    public static Expr fromJson(String json) {
        return ExprJsonCodec.fromJson(json);
    }

    /**
     * Indented one-node-per-line rendering.
     */
    public static String prettyPrint(Expr expr) {
        return TreePrinter.print(expr);
    }

    public static String format(Expr expr) {
        return SmartPrettyPrinter.format(expr);
    }

    public static String format(Expr expr, PrettyOptions options) {
        return SmartPrettyPrinter.format(expr, options);
    }

    /**
     * Free variables of a tree, in order of first occurrence.
     */
    public static Set<String> variables(Expr expr) {
        Objects.requireNonNull(expr, "Expression is required");
        return VariableCollector.collect(expr);
    }

    /**
     * Checks source text without throwing on syntax errors, under the same policy as {@link #parse(String)}.
     *
     * @param source the text to check
     * @return success, or a failure carrying the formatted diagnostic of the first error
     */
    public static ValidationResult validate(String source) {
        try {
            DEFAULT_PARSER.parse(source);
            return ValidationResult.success();
        } catch (BoolQlException e) {
            log.fine(() -> "Rejected expression: " + e.getMessage());
            return ValidationResult.failure(e.formatError());
        }
    }
}
