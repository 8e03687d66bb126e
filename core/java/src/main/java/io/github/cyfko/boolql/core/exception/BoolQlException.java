package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.format.ErrorFormatter;
import io.github.cyfko.boolql.core.model.SourceLocation;

import java.util.Optional;

/**
 * Root of every error raised while tokenizing, parsing or evaluating a BoolQL expression.
 * <p>
 * Each error carries the raw message plus, when known, the {@link SourceLocation} that
 * triggered it and the complete source text. These three values are everything needed
 * to render a contextual diagnostic with {@link #formatError()}:
 * </p>
 * <pre>{@code
 * try {
 *     BoolQl.parse("(A AND B");
 * } catch (BoolQlException e) {
 *     System.err.println(e.formatError());
 *     // MissingParenthesisException: Missing closing parenthesis
 *     //   --> 1:9
 *     // >>>    1 | (A AND B
 *     //         |          ^
 * }
 * }</pre>
 *
 * <p><strong>Hierarchy:</strong></p>
 * <ul>
 *   <li>{@link LexicalException} - invalid character in the source</li>
 *   <li>{@link ParseException} - any syntax problem, with specialised subtypes</li>
 *   <li>{@link EvaluationException} - failures while reducing a tree to a value</li>
 *   <li>{@link ExpressionDecodingException} - malformed serialized trees</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class BoolQlException extends RuntimeException {

    private final SourceLocation location;
    private final String source;

    /**
     * Creates an error without position information.
     *
     * @param message the description of the problem
     */
    public BoolQlException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates an error with position information.
     *
     * @param message  the description of the problem
     * @param location where the problem was detected, may be {@code null}
     * @param source   the complete source text, may be {@code null}
     */
    public BoolQlException(String message, SourceLocation location, String source) {
        this(message, location, source, null);
    }

    /**
     * Creates an error with position information and an underlying cause.
     *
     * @param message  the description of the problem
     * @param location where the problem was detected, may be {@code null}
     * @param source   the complete source text, may be {@code null}
     * @param cause    the original cause, may be {@code null}
     */
    public BoolQlException(String message, SourceLocation location, String source, Throwable cause) {
        super(message, cause);
        this.location = location;
        this.source = source;
    }

    public Optional<SourceLocation> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * Renders this error with two lines of context around the offending line.
     *
     * @return the formatted diagnostic
     * @see #formatError(int)
     */
    public String formatError() {
        return formatError(ErrorFormatter.DEFAULT_CONTEXT_LINES);
    }

    /**
     * Renders this error with a source excerpt and a caret marker under the offending column.
     * <p>
     * Falls back to the bare message when the location or the source is unknown.
     * </p>
     *
     * @param contextLines number of lines shown before and after the offending line
     * @return the formatted diagnostic
     */
    public String formatError(int contextLines) {
        return ErrorFormatter.format(getClass().getSimpleName(), getMessage(), location, source, contextLines);
    }
}
