package io.github.cyfko.boolql.core.exception;

import io.github.cyfko.boolql.core.model.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Message construction of the syntax error family.
 */
class ParseExceptionTest {

    private static final SourceLocation LOCATION = new SourceLocation(1, 3, 2);

    @Test
    @DisplayName("Should name a single expected alternative")
    void shouldFormatSingleAlternative() {
        UnexpectedTokenException exception = new UnexpectedTokenException(
                "end of expression", "IDENTIFIER('B')", LOCATION, "A B");

        assertEquals("Unexpected token 'IDENTIFIER('B')', expected end of expression", exception.getMessage());
        assertEquals(List.of("end of expression"), exception.getExpected());
        assertEquals("IDENTIFIER('B')", exception.getFound());
    }

    @Test
    @DisplayName("Should join two alternatives with 'or'")
    void shouldFormatTwoAlternatives() {
        UnexpectedTokenException exception = new UnexpectedTokenException(
                List.of("AND", "OR"), "NOT('NOT')", LOCATION, "A NOT B");

        assertEquals("Unexpected token 'NOT('NOT')', expected AND or OR", exception.getMessage());
    }

    @Test
    @DisplayName("Should list three or more alternatives")
    void shouldFormatManyAlternatives() {
        UnexpectedTokenException exception = new UnexpectedTokenException(
                List.of("a", "b", "c"), "X", LOCATION, "");

        assertEquals("Unexpected token 'X', expected one of [a, b, c]", exception.getMessage());
    }

    @Test
    @DisplayName("Should require at least one alternative")
    void shouldRejectEmptyAlternatives() {
        assertThrows(IllegalArgumentException.class,
                () -> new UnexpectedTokenException(List.of(), "X", LOCATION, ""));
    }

    @Test
    @DisplayName("Should describe the missing parenthesis side")
    void shouldDescribeMissingParenthesis() {
        MissingParenthesisException closing = new MissingParenthesisException(
                MissingParenthesisException.Kind.CLOSING, LOCATION, "(A");
        MissingParenthesisException opening = new MissingParenthesisException(
                MissingParenthesisException.Kind.OPENING, LOCATION, "A)");

        assertEquals("Missing closing parenthesis", closing.getMessage());
        assertEquals("Missing opening parenthesis", opening.getMessage());
        assertEquals(MissingParenthesisException.Kind.OPENING, opening.getKind());
        assertNull(closing.getCause());
    }

    @Test
    @DisplayName("Should name the operator lacking an operand")
    void shouldDescribeMissingOperand() {
        MissingOperandException exception = new MissingOperandException(
                "OR", List.of("identifier", "opening parenthesis"), "OR('OR')", LOCATION, "A OR OR B");

        assertEquals("Missing operand before operator 'OR', expected identifier or opening parenthesis",
                exception.getMessage());
        assertEquals("OR", exception.getOperator());
        assertEquals("OR('OR')", exception.getFound());
        assertEquals(List.of("identifier", "opening parenthesis"), exception.getExpected());
        assertInstanceOf(UnexpectedTokenException.class, exception);
    }

    @Test
    @DisplayName("Should state what was expected at end of input")
    void shouldDescribeEndOfInput() {
        EndOfInputException exception = new EndOfInputException("identifier", LOCATION, "A ");

        assertEquals("Unexpected end of input, expected identifier", exception.getMessage());
        assertEquals("identifier", exception.getExpected());
    }

    @Test
    @DisplayName("Should keep the offending character")
    void shouldKeepLexicalCharacter() {
        LexicalException exception = new LexicalException('@', LOCATION, "A @");

        assertEquals('@', exception.getCharacter());
        assertEquals("Unexpected character '@'", exception.getMessage());
    }
}
