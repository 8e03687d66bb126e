package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

import java.util.List;

/**
 * Raised when the parser finds a token of the wrong kind.
 * <p>
 * The exception lists every alternative the grammar would have accepted at that
 * point. Messages read {@code Unexpected token 'X', expected A} for one alternative,
 * {@code ... expected A or B} for two and {@code ... expected one of [A, B, C]} beyond.
 * </p>
 *
 * @since 1.0.0
 */
public class UnexpectedTokenException extends ParseException {

    private final List<String> expected;
    private final String found;

    public UnexpectedTokenException(String expected, String found, SourceLocation location, String source) {
        this(List.of(expected), found, location, source);
    }

    public UnexpectedTokenException(List<String> expected, String found, SourceLocation location, String source) {
        this("Unexpected token '" + found + "', expected " + describeAlternatives(expected),
                expected, found, location, source);
    }

    /**
     * For subclasses that word the message themselves.
     */
    protected UnexpectedTokenException(String message, List<String> expected, String found,
                                       SourceLocation location, String source) {
        super(message, location, source);
        this.expected = List.copyOf(expected);
        this.found = found;
    }

    /**
     * Renders alternatives as {@code A}, {@code A or B} or {@code one of [A, B, C]}.
     *
     * @throws IllegalArgumentException if {@code expected} is empty
     */
    protected static String describeAlternatives(List<String> expected) {
        if (expected.isEmpty()) {
            throw new IllegalArgumentException("At least one expected alternative is required");
        }
        return expected.size() <= 2
                ? String.join(" or ", expected)
                : "one of " + expected;
    }

    /**
     * @return the alternatives the grammar accepted, never empty
     */
    public List<String> getExpected() {
        return expected;
    }

    /**
     * @return description of the token actually found
     */
    public String getFound() {
        return found;
    }
}
