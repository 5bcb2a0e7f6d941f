package com.ifblock.expression;

import com.ifblock.exception.ExpressionException;
import com.ifblock.expression.node.ArrayExpression;
import com.ifblock.expression.node.BinaryExpression;
import com.ifblock.expression.node.BinaryOperator;
import com.ifblock.expression.node.BuiltinFunction;
import com.ifblock.expression.node.CallExpression;
import com.ifblock.expression.node.Expression;
import com.ifblock.expression.node.LiteralExpression;
import com.ifblock.expression.node.NotExpression;
import com.ifblock.expression.node.VariableExpression;
import com.ifblock.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.ifblock.expression.ExpressionConfig.MAX_EXPRESSION_DEPTH;
import static com.ifblock.expression.ExpressionConfig.MAX_OPERATORS;
import static com.ifblock.expression.ExpressionConfig.PATH_SEPARATOR;

/**
 * Parser for condition expressions.
 * Converts tokens into an expression tree using recursive descent.
 * <p>
 * Grammar (precedence: ! > ==, != > && > ||, binary operators left-associative):
 * <pre>
 * expression := or
 * or         := and ('||' and)*
 * and        := equality ('&amp;&amp;' equality)*
 * equality   := unary (('==' | '!=') unary)*
 * unary      := '!' unary | primary
 * primary    := '(' expression ')' | literal | call | path
 * call       := IDENT '(' [argument (',' argument)*] ')'
 * argument   := expression | '[' [literal (',' literal)*] ']'
 * </pre>
 * An identifier of the form {@code receiver.name} followed by '(' is a
 * method-style call and desugars to {@code name(receiver, ...)}.
 * <p>
 * Nesting depth and operator count are capped so the resulting tree stays
 * shallow enough to evaluate recursively.
 */
public final class ExpressionParser {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final String input;
    private final List<Token> tokens;
    private int index;
    private int depth;
    private int operators;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root expression
     * @throws ExpressionException ParseError on malformed input
     */
    public Expression parse() {
        if (check(TokenType.EOF)) {
            throw error("Missing expression");
        }
        Expression result = parseExpression();
        if (!check(TokenType.EOF)) {
            throw error("Unexpected token '" + peek().text() + "'");
        }
        return result;
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (check(TokenType.OR)) {
            countOperator(advance());
            left = new BinaryExpression(BinaryOperator.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (check(TokenType.AND)) {
            countOperator(advance());
            left = new BinaryExpression(BinaryOperator.AND, left, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseUnary();
        while (check(TokenType.EQ) || check(TokenType.NE)) {
            Token token = advance();
            countOperator(token);
            BinaryOperator operator = token.type() == TokenType.EQ
                    ? BinaryOperator.EQUALS
                    : BinaryOperator.NOT_EQUALS;
            left = new BinaryExpression(operator, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (check(TokenType.NOT)) {
            descend(advance());
            Expression operand = parseUnary();
            depth--;
            return new NotExpression(operand);
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        // Parenthesized expression
        if (check(TokenType.LPAREN)) {
            Token open = advance();
            descend(open);
            Expression expr = parseExpression();
            if (!match(TokenType.RPAREN)) {
                throw error("Unmatched '(' opened at position " + open.position());
            }
            depth--;
            return expr;
        }

        if (match(TokenType.STRING)) {
            return new LiteralExpression(Value.of((String) previous().literal()));
        }
        if (match(TokenType.BOOLEAN)) {
            return new LiteralExpression(Value.of((Boolean) previous().literal()));
        }
        if (match(TokenType.NUMBER)) {
            return new LiteralExpression(parseNumber(previous()));
        }

        if (match(TokenType.IDENT)) {
            Token ident = previous();
            if (check(TokenType.LPAREN)) {
                return parseCall(ident);
            }
            return variable(ident);
        }

        if (check(TokenType.EOF)) {
            throw error("Missing operand");
        }
        if (check(TokenType.LBRACKET)) {
            throw error("Array literal is only allowed as the second argument of in()");
        }
        throw error("Unexpected token '" + peek().text() + "'");
    }

    private Expression parseCall(Token ident) {
        descend(ident);
        String text = ident.text();
        List<Expression> arguments = new ArrayList<>();
        String name = text;

        int dot = text.lastIndexOf(PATH_SEPARATOR);
        if (dot >= 0) {
            // Method-style call: receiver.name(args)
            String receiver = text.substring(0, dot);
            name = text.substring(dot + 1);
            arguments.add(new VariableExpression(checkPath(receiver, ident)));
        }

        String functionName = name;
        BuiltinFunction function = BuiltinFunction.fromName(functionName)
                .orElseThrow(() -> errorAt("Unknown function '" + functionName + "'", ident));

        Token open = consume(TokenType.LPAREN, "Expected '('");
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseArgument(function, arguments.size()));
            while (match(TokenType.COMMA)) {
                arguments.add(parseArgument(function, arguments.size()));
            }
        }
        if (!match(TokenType.RPAREN)) {
            if (check(TokenType.EOF)) {
                throw error("Unmatched '(' opened at position " + open.position());
            }
            throw error("Expected ',' or ')' in call to " + function.getName() + "()");
        }

        if (arguments.size() != function.getArity()) {
            throw errorAt(function.getName() + "() requires " + function.getArity()
                    + " argument" + (function.getArity() == 1 ? "" : "s")
                    + ", got " + arguments.size(), ident);
        }
        if (function == BuiltinFunction.IN && !(arguments.get(1) instanceof ArrayExpression)) {
            throw errorAt("in() requires an array literal as its second argument", ident);
        }
        depth--;
        return new CallExpression(function, arguments);
    }

    private Expression parseArgument(BuiltinFunction function, int position) {
        if (function == BuiltinFunction.EXISTS) {
            Token path = consume(TokenType.IDENT, "exists() requires a variable path");
            if (check(TokenType.LPAREN)) {
                throw error("exists() requires a variable path");
            }
            return variable(path);
        }
        if (check(TokenType.LBRACKET)) {
            if (function != BuiltinFunction.IN || position != 1) {
                throw error("Array literal is only allowed as the second argument of in()");
            }
            return parseArray();
        }
        return parseExpression();
    }

    private ArrayExpression parseArray() {
        Token open = consume(TokenType.LBRACKET, "Expected '['");
        List<Value> elements = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            elements.add(parseArrayElement());
            while (match(TokenType.COMMA)) {
                elements.add(parseArrayElement());
            }
        }
        if (!match(TokenType.RBRACKET)) {
            if (check(TokenType.EOF)) {
                throw error("Unmatched '[' opened at position " + open.position());
            }
            throw error("Expected ',' or ']' in array literal");
        }
        return new ArrayExpression(elements);
    }

    private Value parseArrayElement() {
        if (match(TokenType.STRING)) {
            return Value.of((String) previous().literal());
        }
        if (match(TokenType.BOOLEAN)) {
            return Value.of((Boolean) previous().literal());
        }
        if (match(TokenType.NUMBER)) {
            return parseNumber(previous());
        }
        throw error("Array elements must be literals");
    }

    private Value parseNumber(Token token) {
        if (!NUMBER.matcher(token.text()).matches()) {
            throw errorAt("Malformed number literal '" + token.text() + "'", token);
        }
        return Value.of(Double.parseDouble(token.text()));
    }

    private VariableExpression variable(Token ident) {
        return new VariableExpression(checkPath(ident.text(), ident));
    }

    private String checkPath(String path, Token token) {
        if (path.isEmpty() || path.endsWith(PATH_SEPARATOR) || path.contains("..")) {
            throw errorAt("Malformed variable path '" + token.text() + "'", token);
        }
        return path;
    }

    private void descend(Token token) {
        if (++depth > MAX_EXPRESSION_DEPTH) {
            throw errorAt("Expression nested too deeply (limit " + MAX_EXPRESSION_DEPTH + ")", token);
        }
    }

    private void countOperator(Token token) {
        if (++operators > MAX_OPERATORS) {
            throw errorAt("Expression has too many operators (limit " + MAX_OPERATORS + ")", token);
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionException error(String message) {
        return errorAt(message, peek());
    }

    private ExpressionException errorAt(String message, Token token) {
        return ExpressionException.parse(message, token.position(), input);
    }
}
