package com.quarry.formula.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns formula text into tokens.
 *
 * Recognizes identifiers, parentheses, commas, double-quoted strings (backslash escapes),
 * numbers of the form -?digits(.digits)? and the reserved words true/false.
 * Whitespace between tokens is skipped; anything else is a lex error.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case ',': addToken(TokenType.COMMA); break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                string();
                break;
            case '-':
                if (!isDigit(peek())) throw error(start, c);
                number();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error(start, c);
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        if ("true".equals(text)) addToken(TokenType.BOOLEAN, Boolean.TRUE);
        else if ("false".equals(text)) addToken(TokenType.BOOLEAN, Boolean.FALSE);
        else addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    default: sb.append(escaped); break;
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) {
            throw new FormulaException(ErrorKind.LEX_ERROR, "Unterminated string starting at position " + start, start);
        }
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private FormulaException error(int position, char c) {
        return new FormulaException(ErrorKind.LEX_ERROR, "Unexpected character '" + c + "' at position " + position, position);
    }
}
