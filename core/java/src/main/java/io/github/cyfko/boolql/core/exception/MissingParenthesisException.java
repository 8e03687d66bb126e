package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

/**
 * Raised when a grouping parenthesis has no partner.
 * <p>
 * {@link io.github.cyfko.boolql.core.parsing.RecursiveDescentParser} only raises
 * {@link Kind#CLOSING}, wrapping the {@link UnexpectedTokenException} of the failed match as
 * the cause. A stray {@code )} is a trailing token to that parser and is reported as an
 * {@link UnexpectedTokenException}. {@link Kind#OPENING} and the constructor without a cause
 * serve callers that check parenthesis balance themselves, such as editors highlighting an
 * unmatched {@code )} before parsing.
 * </p>
 *
 * @since 1.0.0
 */
public class MissingParenthesisException extends ParseException {

    /**
     * Which side of the group is missing.
     */
    public enum Kind {
        OPENING("opening"),
        CLOSING("closing");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final Kind kind;

    public MissingParenthesisException(Kind kind, SourceLocation location, String source) {
        this(kind, location, source, null);
    }

    public MissingParenthesisException(Kind kind, SourceLocation location, String source, Throwable cause) {
        super("Missing " + kind.label() + " parenthesis", location, source, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
