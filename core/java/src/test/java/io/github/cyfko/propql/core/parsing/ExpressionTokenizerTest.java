package io.github.cyfko.propql.core.parsing;

import io.github.cyfko.propql.core.exception.ExpressionSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ExpressionTokenizer}.
 */
@DisplayName("ExpressionTokenizer Tests")
class ExpressionTokenizerTest {

    private static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        new ExpressionTokenizer(input).forEachRemaining(tokens::add);
        return tokens;
    }

    private static List<String> texts(String input) {
        return tokenize(input).stream().map(Token::text).toList();
    }

    @Test
    @DisplayName("Every reserved symbol is its own token")
    void testReservedSymbols() {
        List<Token> tokens = tokenize("()&|~01");

        assertEquals(List.of(
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.AND, TokenType.OR,
                TokenType.NOT, TokenType.FALSE, TokenType.TRUE
        ), tokens.stream().map(Token::type).toList());
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), tokens.stream().map(Token::position).toList());
    }

    @Test
    @DisplayName("Names are maximal runs of letters")
    void testMaximalNames() {
        assertEquals(List.of("abc", "&", "de"), texts("abc&de"));
        assertEquals(List.of("ab", "0", "cd"), texts("ab0cd"));
    }

    @Test
    @DisplayName("Whitespace separates names and is otherwise dropped")
    void testWhitespace() {
        assertEquals(List.of("ab", "cd"), texts("ab cd"));
        assertEquals(List.of("a", "&", "b"), texts(" \ta\n&  b \n"));
        assertTrue(tokenize(" \t\n").isEmpty());
    }

    @Test
    @DisplayName("Identifier tokens record their start position")
    void testIdentifierPosition() {
        Token token = tokenize("  ~ foo").get(1);

        assertEquals(TokenType.IDENTIFIER, token.type());
        assertEquals("foo", token.text());
        assertEquals(4, token.position());
    }

    @Test
    @DisplayName("Invalid symbol is reported with its position")
    void testInvalidSymbol() {
        ExpressionSyntaxException ex = assertThrows(ExpressionSyntaxException.class, () -> tokenize("a & !b"));
        assertEquals("Invalid symbol '!' at position 4", ex.getMessage());
    }

    @Test
    @DisplayName("Carriage return is not a separator")
    void testCarriageReturnRejected() {
        assertThrows(ExpressionSyntaxException.class, () -> tokenize("a\r\nb"));
    }

    @Test
    @DisplayName("Tokens are produced lazily, before an invalid symbol is reached")
    void testLazyTokenization() {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("ab & 2");

        assertEquals("ab", tokenizer.next().text());
        assertEquals("&", tokenizer.next().text());
        assertThrows(ExpressionSyntaxException.class, tokenizer::hasNext);
    }

    @Test
    @DisplayName("Exhausted tokenizer throws NoSuchElementException")
    void testExhausted() {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("a");

        assertTrue(tokenizer.hasNext());
        tokenizer.next();
        assertFalse(tokenizer.hasNext());
        assertEquals(1, tokenizer.position());
        assertThrows(NoSuchElementException.class, tokenizer::next);
    }

    @Test
    @DisplayName("End token describes itself as end of input")
    void testEndToken() {
        Token end = Token.end(3);

        assertEquals(TokenType.END, end.type());
        assertEquals("end of input", end.describe());
        assertEquals("'&'", new Token(TokenType.AND, "&", 0).describe());
    }
}
