package io.github.cyfko.boolql.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Kinds of tokens produced by the {@link io.github.cyfko.boolql.core.parsing.Tokenizer}.
 *
 * @since 1.0.0
 */
public enum TokenType {
    IDENTIFIER,
    BOOLEAN_LITERAL,
    AND,
    OR,
    NOT,
    LEFT_PAREN,
    RIGHT_PAREN,
    END_OF_INPUT;

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", AND,
            "OR", OR,
            "NOT", NOT,
            "TRUE", BOOLEAN_LITERAL,
            "FALSE", BOOLEAN_LITERAL
    );

    /**
     * Resolves an upper-cased word to its keyword token type.
     *
     * @param upperCaseWord the word, already upper-cased
     * @return the keyword type, or empty if the word is a plain identifier
     */
    public static Optional<TokenType> keyword(String upperCaseWord) {
        return Optional.ofNullable(KEYWORDS.get(upperCaseWord));
    }

    /**
     * @return {@code true} for the binary operators {@link #AND} and {@link #OR}
     */
    public boolean isBinaryOperator() {
        return this == AND || this == OR;
    }
}
