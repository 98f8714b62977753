package com.quarry.formula.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    /** Zero-based character offset of the first character of the token. */
    public final int position;

    public Token(TokenType type, String lexeme, Object literal, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.position = position;
    }

    @Override
    public String toString() {
        return type + "(" + lexeme + ")@" + position;
    }
}
