package io.github.cyfko.boolql.core;

import io.github.cyfko.boolql.core.ast.And;
import io.github.cyfko.boolql.core.ast.BooleanLiteral;
import io.github.cyfko.boolql.core.ast.Expr;
import io.github.cyfko.boolql.core.ast.Not;
import io.github.cyfko.boolql.core.ast.Or;
import io.github.cyfko.boolql.core.ast.Variable;
import io.github.cyfko.boolql.core.config.CaseStyle;
import io.github.cyfko.boolql.core.config.ParenthesesMode;
import io.github.cyfko.boolql.core.config.PrettyOptions;
import io.github.cyfko.boolql.core.config.SyntaxPolicy;
import io.github.cyfko.boolql.core.exception.LexicalException;
import io.github.cyfko.boolql.core.exception.MissingParenthesisException;
import io.github.cyfko.boolql.core.exception.ParseException;
import io.github.cyfko.boolql.core.exception.UnknownVariableException;
import io.github.cyfko.boolql.core.model.SourceLocation;
import io.github.cyfko.boolql.core.model.Token;
import io.github.cyfko.boolql.core.model.TokenType;
import io.github.cyfko.boolql.core.utils.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the {@link BoolQl} pipeline: text to tokens to tree, then
 * optimization, evaluation, serialization and rendering.
 */
@DisplayName("BoolQl Facade Tests")
class BoolQlTest {

    private static final Variable A = new Variable("A");
    private static final Variable B = new Variable("B");
    private static final Variable C = new Variable("C");

    @Nested
    @DisplayName("Pipeline")
    class Pipeline {

        @Test
        @DisplayName("Should track token positions across lines")
        void shouldTrackPositions() {
            List<Token> tokens = BoolQl.tokenize("A\nB\nC");

            List<SourceLocation> identifiers = tokens.stream()
                    .filter(token -> token.type() == TokenType.IDENTIFIER)
                    .map(Token::location)
                    .collect(Collectors.toList());
            assertEquals(List.of(new SourceLocation(1, 1, 0), new SourceLocation(2, 1, 2), new SourceLocation(3, 1, 4)),
                    identifiers);
            assertEquals(TokenType.END_OF_INPUT, tokens.get(tokens.size() - 1).type());
        }

        @Test
        @DisplayName("Should tokenize with comments disabled on request")
        void shouldTokenizeWithoutComments() {
            assertThrows(LexicalException.class, () -> BoolQl.tokenize("A # c", false));
            assertEquals(2, BoolQl.tokenize("A # c", true).size());
        }

        @Test
        @DisplayName("Should parse with the documented precedence")
        void shouldParseWithPrecedence() {
            assertEquals(new Or(A, new And(B, new Not(C))), BoolQl.parse("A OR B AND NOT C"));
            assertEquals(new And(new Or(A, B), C), BoolQl.parse("(A OR B) AND C"));
        }

        @Test
        @DisplayName("Should fold a constant chain down to a variable")
        void shouldFoldConstantChain() {
            assertEquals(A, BoolQl.optimize(BoolQl.parse("TRUE AND (FALSE OR A)")));
        }

        @Test
        @DisplayName("Should return the same tree when nothing folds")
        void shouldKeepUnfoldableTree() {
            Expr tree = BoolQl.parse("A AND B");

            assertSame(tree, BoolQl.optimize(tree));
        }

        @Test
        @DisplayName("Should evaluate the documented examples")
        void shouldEvaluateExamples() {
            Map<String, Boolean> first = new HashMap<>();
            first.put("A", true);
            first.put("B", false);
            Map<String, Boolean> second = new HashMap<>(first);
            second.put("C", true);

            assertFalse(BoolQl.evaluate(BoolQl.parse("A AND B"), first));
            assertTrue(BoolQl.evaluate(BoolQl.parse("(A OR B) AND C"), second));
        }

        @Test
        @DisplayName("Should suggest the closest bound name")
        void shouldSuggestBoundName() {
            UnknownVariableException e = assertThrows(UnknownVariableException.class,
                    () -> BoolQl.evaluate(BoolQl.parse("UNKNON"), Map.of("UNKNOWN", true, "OTHER", false)));

            assertTrue(e.getSuggestions().contains("UNKNOWN"));
        }

        @Test
        @DisplayName("Should report a missing closing parenthesis")
        void shouldReportMissingParenthesis() {
            MissingParenthesisException e = assertThrows(MissingParenthesisException.class,
                    () -> BoolQl.parse("(A AND B"));

            assertEquals("closing", e.getKind().label());
        }

        @Test
        @DisplayName("Should apply a custom syntax policy")
        void shouldApplyPolicy() {
            assertThrows(ParseException.class,
                    () -> BoolQl.parse("A AND B", SyntaxPolicy.builder().maxExpressionLength(3).build()));
            assertThrows(LexicalException.class, () -> BoolQl.parse("A # x", SyntaxPolicy.strict()));
            assertEquals(A, BoolQl.parse("A # x", SyntaxPolicy.relaxed()));
        }
    }

    @Nested
    @DisplayName("Input size")
    class InputSize {

        @Test
        @DisplayName("Should parse a well-formed expression longer than 10,000 characters")
        void shouldParseLongExpression() {
            // given
            String source = "A" + " OR A".repeat(2500);

            // when
            Expr tree = BoolQl.parse(source);

            // then
            assertTrue(source.length() > 10_000);
            assertInstanceOf(Or.class, tree);
            assertTrue(BoolQl.validate(source).isValid());
            assertTrue(BoolQl.evaluate(tree, Map.of("A", true)));
        }

        @Test
        @DisplayName("Should report deep nesting as a syntax error instead of exhausting the stack")
        void shouldRejectDeepNesting() {
            String source = "(".repeat(4999) + "A" + ")".repeat(4999);

            ParseException e = assertThrows(ParseException.class, () -> BoolQl.parse(source));
            ValidationResult result = BoolQl.validate(source);

            assertEquals(new SourceLocation(1, 1001, 1000), e.getLocation().orElseThrow());
            assertFalse(result.isValid());
            assertTrue(result.getErrorMessage().startsWith(
                    "ParseException: Nesting too deep at LEFT_PAREN('(') (max depth: 1000)"));
        }

        @Test
        @DisplayName("Should keep the length limit of an explicit policy")
        void shouldKeepExplicitLengthLimit() {
            String source = "A" + " OR A".repeat(2500);

            ParseException e = assertThrows(ParseException.class,
                    () -> BoolQl.parse(source, SyntaxPolicy.defaults()));

            assertTrue(e.getMessage().startsWith("Expression too long (12501 characters, max: 10000)"));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @ParameterizedTest
        @ValueSource(strings = {
                "A",
                "TRUE",
                "NOT NOT x_1",
                "A OR B AND NOT C",
                "(A OR FALSE) AND NOT (B AND TRUE) OR NOT NOT C",
                "NOT (NOT (A AND (B OR (C AND NOT D))))"
        })
        @DisplayName("Should round-trip through JSON, optimize idempotently and soundly")
        void shouldHoldAlgebraicProperties(String source) {
            Expr tree = BoolQl.parse(source);
            Expr optimized = BoolQl.optimize(tree);

            assertEquals(tree, BoolQl.fromJson(BoolQl.toJson(tree)));
            assertEquals(optimized, BoolQl.optimize(optimized));

            List<String> names = List.copyOf(BoolQl.variables(tree));
            for (int mask = 0; mask < (1 << names.size()); mask++) {
                Map<String, Boolean> env = new HashMap<>();
                for (int i = 0; i < names.size(); i++) {
                    env.put(names.get(i), (mask & (1 << i)) != 0);
                }
                assertEquals(BoolQl.evaluate(tree, env), BoolQl.evaluate(optimized, env), source + " " + env);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "A OR (B OR C)",
                "NOT (A OR B) AND C",
                "a and (b or not c) or d"
        })
        @DisplayName("Should re-parse formatted output to an equal tree")
        void shouldRoundTripFormatting(String source) {
            Expr tree = BoolQl.parse(source);

            assertEquals(tree, BoolQl.parse(BoolQl.format(tree)));
            assertEquals(tree, BoolQl.parse(BoolQl.format(tree,
                    new PrettyOptions(CaseStyle.MIXED, ParenthesesMode.ALWAYS))));
        }
    }

    @Nested
    @DisplayName("Rendering and validation")
    class RenderingAndValidation {

        @Test
        @DisplayName("Should render the indented tree")
        void shouldPrettyPrint() {
            assertEquals("And\n  Var(name=A)\n  Not\n    BoolLit(value=false)",
                    BoolQl.prettyPrint(new And(A, new Not(BooleanLiteral.FALSE))));
        }

        @Test
        @DisplayName("Should format with default options")
        void shouldFormat() {
            assertEquals("(A OR b) AND NOT c", BoolQl.format(BoolQl.parse("((A or b)) and not (c)")));
        }

        @Test
        @DisplayName("Should list free variables in order")
        void shouldListVariables() {
            assertEquals(List.of("C", "A"), List.copyOf(BoolQl.variables(BoolQl.parse("C OR NOT A AND C"))));
        }

        @Test
        @DisplayName("Should validate well-formed input")
        void shouldValidateGoodInput() {
            assertTrue(BoolQl.validate("A AND (B OR C)").isValid());
        }

        @Test
        @DisplayName("Should carry the formatted diagnostic of invalid input")
        void shouldValidateBadInput() {
            ValidationResult result = BoolQl.validate("A AND\n(B OR C");

            assertFalse(result.isValid());
            String expected = String.join("\n",
                    "MissingParenthesisException: Missing closing parenthesis",
                    "  --> 2:8",
                    "       1 | A AND",
                    ">>>    2 | (B OR C",
                    "         |        ^");
            assertEquals(expected, result.getErrorMessage());
        }

        @Test
        @DisplayName("Should report lexical errors through validation")
        void shouldValidateLexicalError() {
            ValidationResult result = BoolQl.validate("A && B");

            assertFalse(result.isValid());
            assertTrue(result.getErrorMessage().startsWith("LexicalException: Unexpected character '&'"));
        }
    }
}
