package io.github.cyfko.boolql.core.parsing;

import io.github.cyfko.boolql.core.exception.LexicalException;
import io.github.cyfko.boolql.core.model.SourceLocation;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Single-pass scanner turning BoolQL source text into a flat list of {@link Token}s.
 * <p>
 * Recognized input:
 * </p>
 * <ul>
 *   <li>{@code (} and {@code )}</li>
 *   <li>words matching {@code [A-Za-z_][A-Za-z0-9_]*}; {@code AND}, {@code OR}, {@code NOT},
 *       {@code TRUE} and {@code FALSE} are keywords in any casing, everything else is an identifier</li>
 *   <li>whitespace, skipped</li>
 *   <li>{@code #} up to the end of the line, skipped when comments are enabled</li>
 * </ul>
 * <p>
 * Any other character raises a {@link LexicalException}. The returned list always ends
 * with exactly one {@link TokenType#END_OF_INPUT} token.
 * </p>
 *
 * <p><strong>Positions:</strong> a newline moves to the next line and resets the column
 * to 1; every other character moves one column right. The offset counts characters.</p>
 *
 * <pre>{@code
 * List<Token> tokens = Tokenizer.tokenize("a and (NOT b) # trailing comment");
 * // IDENTIFIER('a'), AND('AND'), LEFT_PAREN('('), NOT('NOT'), IDENTIFIER('b'), RIGHT_PAREN(')'), END_OF_INPUT('')
 * }</pre>
 *
 * <p>Instances hold the scan cursor and are used once; the static entry points create them.</p>
 *
 * @since 1.0.0
 */
public final class Tokenizer {

    private final String source;
    private final boolean enableComments;
    private final int length;

    private int offset = 0;
    private int line = 1;
    private int column = 1;

    private Tokenizer(String source, boolean enableComments) {
        this.source = source;
        this.enableComments = enableComments;
        this.length = source.length();
    }

    /**
     * Tokenizes {@code source} with comments enabled.
     *
     * @param source the source text
     * @return the tokens, terminated by {@link TokenType#END_OF_INPUT}
     * @throws LexicalException on the first invalid character
     */
    public static List<Token> tokenize(String source) {
        return tokenize(source, true);
    }

    /**
     * Tokenizes {@code source}.
     *
     * @param source         the source text
     * @param enableComments whether {@code #} comments are skipped; when {@code false},
     *                       {@code #} is an invalid character
     * @return the tokens, terminated by {@link TokenType#END_OF_INPUT}
     * @throws LexicalException on the first invalid character
     */
    public static List<Token> tokenize(String source, boolean enableComments) {
        Objects.requireNonNull(source, "Source text is required");
        return new Tokenizer(source, enableComments).scan();
    }

    /**
     * Renders tokens for debugging, e.g. {@code IDENTIFIER('a')@1:1, AND('AND')@1:3, EOF@1:6}.
     *
     * @param tokens the tokens
     * @return a comma separated listing
     */
    public static String debugTokens(List<Token> tokens) {
        return tokens.stream()
                .map(token -> token.type() == TokenType.END_OF_INPUT
                        ? "EOF@" + token.location()
                        : token.toString())
                .collect(Collectors.joining(", "));
    }

    private List<Token> scan() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_INPUT);
        return tokens;
    }

    private Token nextToken() {
        do {
            skipWhitespace();
        } while (skipComment());

        SourceLocation location = currentLocation();
        if (offset >= length) {
            return new Token(TokenType.END_OF_INPUT, "", location);
        }

        char c = source.charAt(offset);
        if (c == '(') {
            advance(1);
            return new Token(TokenType.LEFT_PAREN, "(", location);
        }
        if (c == ')') {
            advance(1);
            return new Token(TokenType.RIGHT_PAREN, ")", location);
        }

        if (isWordStart(c)) {
            int end = offset + 1;
            while (end < length && isWordPart(source.charAt(end))) {
                end++;
            }
            String word = source.substring(offset, end);
            advance(word.length());

            String upper = word.toUpperCase(Locale.ROOT);
            return TokenType.keyword(upper)
                    .map(type -> new Token(type, upper, location))
                    .orElseGet(() -> new Token(TokenType.IDENTIFIER, word, location));
        }

        throw new LexicalException(c, location, source);
    }

    private void skipWhitespace() {
        while (offset < length && Character.isWhitespace(source.charAt(offset))) {
            advance(1);
        }
    }

    private boolean skipComment() {
        if (!enableComments || offset >= length || source.charAt(offset) != '#') {
            return false;
        }
        while (offset < length && source.charAt(offset) != '\n') {
            advance(1);
        }
        return true;
    }

    private void advance(int count) {
        for (int i = 0; i < count && offset < length; i++) {
            if (source.charAt(offset) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            offset++;
        }
    }

    private SourceLocation currentLocation() {
        return new SourceLocation(line, column, offset);
    }

    private static boolean isWordStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isWordPart(char c) {
        return isWordStart(c) || (c >= '0' && c <= '9');
    }
}
