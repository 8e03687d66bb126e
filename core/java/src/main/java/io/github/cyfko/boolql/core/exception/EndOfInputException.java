package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

/**
 * Raised when the token stream runs out while the grammar still needs input.
 *
 * @since 1.0.0
 */
public class EndOfInputException extends ParseException {

    private final String expected;

    public EndOfInputException(String expected, SourceLocation location, String source) {
        super("Unexpected end of input, expected " + expected, location, source);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
