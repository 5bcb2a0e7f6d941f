package com.ifblock.expression;

import com.ifblock.exception.ExpressionException;

import java.util.ArrayList;
import java.util.List;

import static com.ifblock.expression.ExpressionConfig.*;

/**
 * Tokenizer for condition expressions.
 * Converts input string into a sequence of tokens terminated by EOF.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final int length;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Tokenize the input string.
     *
     * @return List of tokens, always ending with EOF
     * @throws ExpressionException LexError on an unterminated string or unrecognized character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            int start = pos;

            switch (c) {
                case Operators.LEFT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.LPAREN, "(", null, start));
                }
                case Operators.RIGHT_PAREN -> {
                    advance();
                    tokens.add(new Token(TokenType.RPAREN, ")", null, start));
                }
                case Operators.LEFT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.LBRACKET, "[", null, start));
                }
                case Operators.RIGHT_BRACKET -> {
                    advance();
                    tokens.add(new Token(TokenType.RBRACKET, "]", null, start));
                }
                case Operators.COMMA -> {
                    advance();
                    tokens.add(new Token(TokenType.COMMA, ",", null, start));
                }
                case Operators.EQUALS -> {
                    advance();
                    if (!match(Operators.EQUALS)) {
                        throw error("Unexpected character '=' (use '==')", start);
                    }
                    tokens.add(new Token(TokenType.EQ, "==", null, start));
                }
                case Operators.BANG -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, start));
                    } else {
                        tokens.add(new Token(TokenType.NOT, "!", null, start));
                    }
                }
                case Operators.AMPERSAND -> {
                    advance();
                    if (!match(Operators.AMPERSAND)) {
                        throw error("Unexpected character '&' (use '&&')", start);
                    }
                    tokens.add(new Token(TokenType.AND, "&&", null, start));
                }
                case Operators.PIPE -> {
                    advance();
                    if (!match(Operators.PIPE)) {
                        throw error("Unexpected character '|' (use '||')", start);
                    }
                    tokens.add(new Token(TokenType.OR, "||", null, start));
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isNumberStart()) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", start);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase();

        TokenType keywordType = KEYWORDS.get(upper);
        if (keywordType != null) {
            return new Token(keywordType, text, BOOLEAN_VALUES.get(upper), start);
        }

        return new Token(TokenType.IDENT, text, null, start);
    }

    /**
     * Reads a numeric run; the parser decides whether it is a well-formed number.
     */
    private Token readNumber() {
        int start = pos;

        if (peek() == Operators.MINUS) {
            advance();
        }

        while (!isAtEnd() && (isDigit(peek()) || peek() == Operators.DOT)) {
            advance();
        }

        return new Token(TokenType.NUMBER, input.substring(start, pos), null, start);
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c) || c == Operators.DOT;
    }

    private boolean isNumberStart() {
        char c = peek();
        if (isDigit(c)) {
            return true;
        }
        return c == Operators.MINUS && pos + 1 < length && isDigit(input.charAt(pos + 1));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ExpressionException error(String message, int position) {
        return ExpressionException.lex(message, position, input);
    }
}
