package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

import java.util.List;

/**
 * Raised when a binary operator shows up where an operand was required,
 * e.g. {@code AND B} or {@code A OR OR B}.
 * <p>
 * This is an {@link UnexpectedTokenException} whose found token is the operator;
 * the message names the operator first.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingOperandException extends UnexpectedTokenException {

    private final String operator;

    /**
     * @param operator the operator lexeme, {@code AND} or {@code OR}
     * @param expected the operand alternatives the grammar accepted
     * @param found    description of the operator token
     * @param location where the operator starts
     * @param source   the complete source text
     */
    public MissingOperandException(String operator, List<String> expected, String found,
                                   SourceLocation location, String source) {
        super("Missing operand before operator '" + operator + "', expected " + describeAlternatives(expected),
                expected, found, location, source);
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
