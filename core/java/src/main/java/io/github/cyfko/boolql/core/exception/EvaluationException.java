package io.github.cyfko.boolql.core.exception;

/**
 * Base type for failures while evaluating a tree against an environment.
 *
 * @since 1.0.0
 */
public class EvaluationException extends BoolQlException {

    public EvaluationException(String message) {
        super(message);
    }
}
