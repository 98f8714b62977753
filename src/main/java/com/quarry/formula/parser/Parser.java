package com.quarry.formula.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.quarry.formula.functions.FunctionDefinition;
import com.quarry.formula.functions.FunctionRegistry;
import com.quarry.formula.parser.Expr.ExprInterface;
import com.quarry.formula.parser.Expr.FieldRef;
import com.quarry.formula.parser.Expr.FunctionCall;
import com.quarry.formula.parser.Expr.Literal;

/**
 * Recursive-descent parser for the call-only formula grammar:
 *
 * <pre>
 *   formula := call
 *   call    := IDENT '(' (expr (',' expr)*)? ')'
 *   expr    := call | STRING | NUMBER | BOOLEAN | IDENT
 * </pre>
 *
 * Parenthesis balance is checked over the whole token stream before the structural parse.
 * When a registry is supplied, every call name and argument count is validated against it.
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final List<Token> tokens;
    private final FunctionRegistry registry;
    private final int maxDepth;
    private int current = 0;

    public Parser(List<Token> tokens) {
        this(tokens, null, DEFAULT_MAX_DEPTH);
    }

    /** @param registry catalog used for name/arity validation, or null to skip validation */
    public Parser(List<Token> tokens, FunctionRegistry registry, int maxDepth) {
        this.tokens = tokens;
        this.registry = registry;
        this.maxDepth = (maxDepth < 1) ? DEFAULT_MAX_DEPTH : maxDepth;
    }

    public FunctionCall parse() {
        checkBalancedParentheses();

        if (isAtEnd()) {
            throw new FormulaParseException(ParseErrorType.INVALID_FORMAT, "Formula is empty", 0, null);
        }
        if (!check(TokenType.IDENTIFIER) || peekNext().type != TokenType.LEFT_PAREN) {
            throw new FormulaParseException(ParseErrorType.INVALID_FORMAT,
                    "Invalid formula format. Use FUNCTION_NAME(args)", peek().position, null);
        }

        FunctionCall call = call(1);
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected '" + peek().lexeme + "' after end of formula.");
        }
        return call;
    }

    private void checkBalancedParentheses() {
        Deque<Token> open = new ArrayDeque<>();
        for (Token t : tokens) {
            if (t.type == TokenType.LEFT_PAREN) {
                open.push(t);
            } else if (t.type == TokenType.RIGHT_PAREN) {
                if (open.isEmpty()) {
                    throw new FormulaParseException(ParseErrorType.UNBALANCED_PARENTHESES,
                            "Unmatched ')' at position " + t.position, t.position, null);
                }
                open.pop();
            }
        }
        if (!open.isEmpty()) {
            Token unclosed = open.peek();
            throw new FormulaParseException(ParseErrorType.UNBALANCED_PARENTHESES,
                    "Unclosed '(' at position " + unclosed.position, unclosed.position, null);
        }
    }

    private FunctionCall call(int depth) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        if (depth > maxDepth) {
            throw new FormulaParseException(ParseErrorType.NESTING_TOO_DEEP,
                    "Formula nests deeper than " + maxDepth + " calls", name.position, name.lexeme);
        }

        FunctionDefinition def = null;
        if (registry != null) {
            def = registry.find(name.lexeme);
            if (def == null) {
                throw new FormulaParseException(ParseErrorType.UNKNOWN_FUNCTION,
                        "Unknown function: " + name.lexeme, name.position, name.lexeme);
            }
        }

        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression(depth));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");

        if (def != null && !def.acceptsArgumentCount(arguments.size())) {
            throw FormulaParseException.arity(name.lexeme, def.minArgs(), def.maxArgs(), arguments.size(), name.position);
        }
        return new FunctionCall(name.lexeme, arguments, name.position);
    }

    private ExprInterface expression(int depth) {
        Token t = peek();
        switch (t.type) {
            case IDENTIFIER:
                if (peekNext().type == TokenType.LEFT_PAREN) return call(depth + 1);
                advance();
                return new FieldRef(t.lexeme, t.position);
            case STRING:
                advance();
                return new Literal(Value.text((String) t.literal), t.position);
            case NUMBER:
                advance();
                return new Literal(Value.number((Double) t.literal), t.position);
            case BOOLEAN:
                advance();
                return new Literal(Value.bool((Boolean) t.literal), t.position);
            case EOF:
                throw error(t, "Unexpected end of formula.");
            default:
                throw error(t, "Expect expression, got '" + t.lexeme + "'.");
        }
    }

    private boolean match(TokenType type) {
        if (!check(type)) return false;
        advance();
        return true;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return (current + 1 < tokens.size()) ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private FormulaParseException error(Token token, String message) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new FormulaParseException(ParseErrorType.UNEXPECTED_TOKEN,
                "[position " + token.position + "] Error" + where + ": " + message, token.position, null);
    }
}
