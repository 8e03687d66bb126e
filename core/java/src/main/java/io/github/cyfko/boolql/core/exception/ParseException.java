package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

/**
 * Base type for every syntax error detected while parsing a token stream.
 * <p>
 * Thrown directly for input rejected before the grammar runs (e.g. an expression
 * longer than the active {@link io.github.cyfko.boolql.core.config.SyntaxPolicy} allows);
 * grammar failures use one of the subtypes.
 * </p>
 *
 * @since 1.0.0
 * @see UnexpectedTokenException
 * @see MissingParenthesisException
 * @see MissingOperandException
 * @see EndOfInputException
 */
public class ParseException extends BoolQlException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, SourceLocation location, String source) {
        super(message, location, source);
    }

    public ParseException(String message, SourceLocation location, String source, Throwable cause) {
        super(message, location, source, cause);
    }
}
