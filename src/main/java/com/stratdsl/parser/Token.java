package com.stratdsl.parser;

import com.stratdsl.ast.SourcePosition;

/**
 * Lexical unit produced by {@link Tokenizer}. For strings {@code text} holds the unescaped
 * content without quotes.
 */
public record Token(TokenType type, String text, SourcePosition position) {

    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
