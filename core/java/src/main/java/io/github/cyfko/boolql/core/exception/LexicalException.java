package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;

/**
 * Raised by the tokenizer when it meets a character that starts no token.
 *
 * @since 1.0.0
 */
public class LexicalException extends BoolQlException {

    private final char character;

    /**
     * @param character the offending character
     * @param location  position of the character
     * @param source    the complete source text
     */
    public LexicalException(char character, SourceLocation location, String source) {
        super("Unexpected character '" + character + "'", location, source);
        this.character = character;
    }

    public char getCharacter() {
        return character;
    }
}
