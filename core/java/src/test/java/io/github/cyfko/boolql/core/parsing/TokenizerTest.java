package io.github.cyfko.boolql.core.parsing;

import io.github.cyfko.boolql.core.exception.LexicalException;
import io.github.cyfko.boolql.core.model.SourceLocation;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.model.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    // ========== Basic scanning ==========

    @Test
    @DisplayName("Should end every token list with END_OF_INPUT")
    void shouldEndWithEndOfInput() {
        List<Token> tokens = Tokenizer.tokenize("");

        assertEquals(1, tokens.size());
        assertEquals(TokenType.END_OF_INPUT, tokens.get(0).type());
        assertEquals("", tokens.get(0).lexeme());
        assertEquals(new SourceLocation(1, 1, 0), tokens.get(0).location());
    }

    @Test
    @DisplayName("Should scan operators, literals, identifiers and parentheses")
    void shouldScanAllTokenKinds() {
        List<Token> tokens = Tokenizer.tokenize("NOT (a AND TRUE) OR FALSE");

        assertEquals(List.of(
                TokenType.NOT, TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.AND,
                TokenType.BOOLEAN_LITERAL, TokenType.RIGHT_PAREN, TokenType.OR,
                TokenType.BOOLEAN_LITERAL, TokenType.END_OF_INPUT), types(tokens));
    }

    @ParameterizedTest
    @CsvSource({
            "and, AND, AND",
            "Or, OR, OR",
            "nOt, NOT, NOT",
            "true, BOOLEAN_LITERAL, TRUE",
            "False, BOOLEAN_LITERAL, FALSE"
    })
    @DisplayName("Should recognize keywords in any case and canonicalize their lexeme")
    void shouldCanonicalizeKeywords(String input, TokenType expectedType, String expectedLexeme) {
        Token token = Tokenizer.tokenize(input).get(0);

        assertEquals(expectedType, token.type());
        assertEquals(expectedLexeme, token.lexeme());
    }

    @ParameterizedTest
    @ValueSource(strings = {"camelCase", "_private", "x1", "ANDROID", "ORder", "NOTE", "TRUEish", "A_B_9"})
    @DisplayName("Should keep identifiers verbatim, including keyword prefixes")
    void shouldKeepIdentifierCase(String identifier) {
        List<Token> tokens = Tokenizer.tokenize(identifier);

        assertEquals(2, tokens.size());
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals(identifier, tokens.get(0).lexeme());
    }

    @Test
    @DisplayName("Should split words on parentheses without whitespace")
    void shouldSplitOnParentheses() {
        List<Token> tokens = Tokenizer.tokenize("(a)AND(b)");

        assertEquals(List.of(
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.AND,
                TokenType.LEFT_PAREN, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.END_OF_INPUT),
                types(tokens));
    }

    // ========== Positions ==========

    @Test
    @DisplayName("Should track line and column across newlines")
    void shouldTrackLines() {
        List<Token> tokens = Tokenizer.tokenize("A\nB\nC");

        assertEquals(new SourceLocation(1, 1, 0), tokens.get(0).location());
        assertEquals(new SourceLocation(2, 1, 2), tokens.get(1).location());
        assertEquals(new SourceLocation(3, 1, 4), tokens.get(2).location());
        assertEquals(new SourceLocation(3, 2, 5), tokens.get(3).location());
    }

    @Test
    @DisplayName("Should advance column by one per character")
    void shouldTrackColumns() {
        List<Token> tokens = Tokenizer.tokenize("  foo  AND\tbar");

        assertEquals(3, tokens.get(0).location().column());
        assertEquals(8, tokens.get(1).location().column());
        assertEquals(12, tokens.get(2).location().column());
        assertEquals(11, tokens.get(2).location().offset());
    }

    // ========== Comments ==========

    @Test
    @DisplayName("Should skip comments up to the end of the line")
    void shouldSkipComments() {
        List<Token> tokens = Tokenizer.tokenize("# header\nA AND # why\n  B # tail");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER, TokenType.END_OF_INPUT),
                types(tokens));
        assertEquals(new SourceLocation(2, 1, 9), tokens.get(0).location());
        assertEquals(new SourceLocation(3, 3, 23), tokens.get(2).location());
    }

    @Test
    @DisplayName("Should treat a comment-only source as empty")
    void shouldHandleCommentOnlySource() {
        List<Token> tokens = Tokenizer.tokenize("# nothing here");

        assertEquals(List.of(TokenType.END_OF_INPUT), types(tokens));
    }

    @Test
    @DisplayName("Should reject '#' when comments are disabled")
    void shouldRejectHashWhenCommentsDisabled() {
        LexicalException e = assertThrows(LexicalException.class, () -> Tokenizer.tokenize("A # c", false));

        assertEquals('#', e.getCharacter());
        assertEquals(new SourceLocation(1, 3, 2), e.getLocation().orElseThrow());
    }

    // ========== Errors ==========

    @ParameterizedTest
    @CsvSource({
            "A & B, &, 1, 3",
            "1A, 1, 1, 1",
            "A AND B!, !, 1, 8",
            "x = y, =, 1, 3"
    })
    @DisplayName("Should reject invalid characters with their location")
    void shouldRejectInvalidCharacters(String source, char character, int line, int column) {
        LexicalException e = assertThrows(LexicalException.class, () -> Tokenizer.tokenize(source));

        assertEquals(character, e.getCharacter());
        assertEquals(line, e.getLocation().orElseThrow().line());
        assertEquals(column, e.getLocation().orElseThrow().column());
        assertEquals(source, e.getSource().orElseThrow());
        assertTrue(e.getMessage().contains("'" + character + "'"));
    }

    @Test
    @DisplayName("Should report invalid characters on later lines")
    void shouldReportInvalidCharacterOnLaterLine() {
        String source = "A AND\n  B | C";

        LexicalException e = assertThrows(LexicalException.class, () -> Tokenizer.tokenize(source));

        assertEquals('|', e.getCharacter());
        assertEquals(new SourceLocation(2, 5, 10), e.getLocation().orElseThrow());
    }

    @Test
    @DisplayName("Should reject null source")
    void shouldRejectNullSource() {
        assertThrows(NullPointerException.class, () -> Tokenizer.tokenize(null));
    }

    // ========== Debug rendering ==========

    @Test
    @DisplayName("Should render tokens for debugging")
    void shouldRenderDebugTokens() {
        String rendered = Tokenizer.debugTokens(Tokenizer.tokenize("a and b"));

        assertEquals("IDENTIFIER('a')@1:1, AND('AND')@1:3, IDENTIFIER('b')@1:7, EOF@1:8", rendered);
    }
}
