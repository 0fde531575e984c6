package com.stratdsl.parser;

public enum TokenType {
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    STRING,
    NUMBER,
    BOOLEAN,
    SYMBOL,
    EOF;

    public boolean isOpening() {
        return this == LEFT_PAREN || this == LEFT_BRACKET || this == LEFT_BRACE;
    }

    public boolean isClosing() {
        return this == RIGHT_PAREN || this == RIGHT_BRACKET || this == RIGHT_BRACE;
    }
}
