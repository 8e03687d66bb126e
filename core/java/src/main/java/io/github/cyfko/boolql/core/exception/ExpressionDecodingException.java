package io.github.cyfko.boolql.core.exception;

/**
 * Raised when a serialized tree cannot be turned back into an expression:
 * malformed JSON, an unrecognized {@code "type"} tag or a missing or ill-typed field.
 *
 * @since 1.0.0
 * @see io.github.cyfko.boolql.core.ast.ExprJsonCodec
 */
public class ExpressionDecodingException extends BoolQlException {

    public ExpressionDecodingException(String message) {
        super(message);
    }

    public ExpressionDecodingException(String message, Throwable cause) {
        super(message, null, null, cause);
    }
}
