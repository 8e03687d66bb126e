package io.github.cyfko.boolql.core.model;

import java.util.Objects;

/**
 * A lexical token with its position in the source.
 * <p>
 * Keyword lexemes ({@code AND}, {@code OR}, {@code NOT}, {@code TRUE}, {@code FALSE})
 * are always upper-case; identifier lexemes keep their original casing.
 * The {@link TokenType#END_OF_INPUT} token carries an empty lexeme.
 * </p>
 *
 * @param type     the token kind
 * @param lexeme   the matched text (canonical for keywords)
 * @param location where the token starts
 * @since 1.0.0
 */
public record Token(TokenType type, String lexeme, SourceLocation location) {

    public Token {
        Objects.requireNonNull(type, "Token type is required");
        Objects.requireNonNull(lexeme, "Token lexeme is required");
        Objects.requireNonNull(location, "Token location is required");
    }

    /**
     * Short rendering used in diagnostics, e.g. {@code IDENTIFIER('foo')}.
     *
     * @return the kind followed by the quoted lexeme
     */
    public String describe() {
        return type.name() + "('" + lexeme + "')";
    }

    @Override
    public String toString() {
        return describe() + "@" + location;
    }
}
