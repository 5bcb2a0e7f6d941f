package com.ifblock.expression;

import com.ifblock.exception.ErrorKind;
import com.ifblock.exception.ExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTokenizer.
 */
class ExpressionTokenizerTest {

    private static List<TokenType> types(String input) {
        return new ExpressionTokenizer(input).tokenize().stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Should tokenize operators and punctuation")
    void operators() {
        assertEquals(List.of(TokenType.NOT, TokenType.LPAREN, TokenType.IDENT, TokenType.EQ, TokenType.NUMBER,
                        TokenType.RPAREN, TokenType.AND, TokenType.IDENT, TokenType.NE, TokenType.STRING,
                        TokenType.OR, TokenType.IDENT, TokenType.LPAREN, TokenType.IDENT, TokenType.COMMA,
                        TokenType.LBRACKET, TokenType.STRING, TokenType.RBRACKET, TokenType.RPAREN, TokenType.EOF),
                types("!(A == 1) && B != 'x' || in(C, ['y'])"));
    }

    @Test
    @DisplayName("Dotted identifiers are a single token")
    void dottedIdentifier() {
        List<Token> tokens = new ExpressionTokenizer("user.name.StartsWith").tokenize();

        assertEquals(2, tokens.size());
        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals("user.name.StartsWith", tokens.get(0).text());
    }

    @ParameterizedTest
    @ValueSource(strings = {"true", "TRUE", "True", "false", "FALSE"})
    @DisplayName("Boolean keywords are case-insensitive")
    void booleanKeywords(String keyword) {
        Token token = new ExpressionTokenizer(keyword).tokenize().get(0);

        assertEquals(TokenType.BOOLEAN, token.type());
        assertEquals(Boolean.parseBoolean(keyword), token.literal());
    }

    @Test
    @DisplayName("Should decode quoted strings with escapes")
    void strings() {
        List<Token> tokens = new ExpressionTokenizer("\"it's\" 'a\\'b' 'tab\\there'").tokenize();

        assertEquals("it's", tokens.get(0).literal());
        assertEquals("\"it's\"", tokens.get(0).text());
        assertEquals("a'b", tokens.get(1).literal());
        assertEquals("tab\there", tokens.get(2).literal());
    }

    @Test
    @DisplayName("Should read negative and fractional numbers")
    void numbers() {
        List<Token> tokens = new ExpressionTokenizer("-12.5 7").tokenize();

        assertEquals("-12.5", tokens.get(0).text());
        assertEquals(TokenType.NUMBER, tokens.get(1).type());
        assertEquals(6, tokens.get(1).position());
    }

    @ParameterizedTest
    @ValueSource(strings = {"A = 1", "A & B", "A | B", "A == 'open", "A # B", "A == 1 ; B"})
    @DisplayName("Should reject malformed input as a lex error")
    void lexErrors(String input) {
        ExpressionException ex = assertThrows(ExpressionException.class,
                () -> new ExpressionTokenizer(input).tokenize());

        assertEquals(ErrorKind.LEX_ERROR, ex.getError().kind());
        assertEquals(input, ex.getError().expression());
    }

    @Test
    @DisplayName("Lex errors carry the offending position")
    void lexErrorPosition() {
        ExpressionException ex = assertThrows(ExpressionException.class,
                () -> new ExpressionTokenizer("ROLE = 'x'").tokenize());

        assertEquals(5, ex.getPosition());
        assertTrue(ex.getError().message().contains("'='"));
    }
}
