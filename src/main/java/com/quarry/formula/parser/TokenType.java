package com.quarry.formula.parser;

public enum TokenType {
    IDENTIFIER,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    STRING,
    NUMBER,
    BOOLEAN,
    EOF
}
