package com.spreadsheet.calc.engine.parser;

public enum TokenType {
    NUMBER,
    STRING,
    REFERENCE,
    IDENTIFIER,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON,
    EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    END
}
