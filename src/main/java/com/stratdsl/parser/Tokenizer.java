package com.stratdsl.parser;

import com.stratdsl.ast.SourcePosition;
import com.stratdsl.exception.DslParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Character scanner turning strategy source into {@link Token}s while tracking line and column.
 *
 * <p>Lexical rules:
 * <ul>
 *   <li>Whitespace and commas separate tokens; {@code ;} starts a comment running to end of line</li>
 *   <li>{@code ( ) [ ] { }} are single-character tokens</li>
 *   <li>Strings are double-quoted with {@code \" \\ \n \t} escapes</li>
 *   <li>A bare token starting like a number must be a complete decimal literal</li>
 *   <li>{@code true} and {@code false} are booleans, every other bare token is a symbol</li>
 * </ul>
 */
public class Tokenizer {

    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int index;
    private int line = 1;
    private int column = 1;

    public Tokenizer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (index < source.length()) {
            char c = source.charAt(index);
            if (Character.isWhitespace(c) || c == ',') {
                advance();
            } else if (c == ';') {
                skipComment();
            } else if (c == '"') {
                readString();
            } else if (delimiterType(c) != null) {
                tokens.add(new Token(delimiterType(c), String.valueOf(c), position()));
                advance();
            } else {
                readBareToken();
            }
        }
        tokens.add(new Token(TokenType.EOF, "", position()));
        return tokens;
    }

    private void skipComment() {
        while (index < source.length() && source.charAt(index) != '\n') {
            advance();
        }
    }

    private void readString() {
        SourcePosition start = position();
        advance();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (index >= source.length()) {
                throw new DslParseException("Unterminated string literal", start);
            }
            char c = source.charAt(index);
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\\') {
                SourcePosition escapePosition = position();
                advance();
                if (index >= source.length()) {
                    throw new DslParseException("Unterminated string literal", start);
                }
                text.append(unescape(source.charAt(index), escapePosition));
            } else {
                text.append(c);
            }
            advance();
        }
        tokens.add(new Token(TokenType.STRING, text.toString(), start));
    }

    private char unescape(char c, SourcePosition escapePosition) {
        return switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case 'n' -> '\n';
            case 't' -> '\t';
            default -> throw new DslParseException("Unsupported escape sequence '\\" + c + "'", escapePosition);
        };
    }

    private void readBareToken() {
        SourcePosition start = position();
        int begin = index;
        while (index < source.length() && !terminatesBareToken(source.charAt(index))) {
            advance();
        }
        String text = source.substring(begin, index);
        tokens.add(new Token(classify(text, start), text, start));
    }

    private TokenType classify(String text, SourcePosition start) {
        if (looksNumeric(text)) {
            if (!NUMBER.matcher(text).matches()) {
                throw new DslParseException("Malformed numeric literal '" + text + "'", start);
            }
            return TokenType.NUMBER;
        }
        if ("true".equals(text) || "false".equals(text)) {
            return TokenType.BOOLEAN;
        }
        return TokenType.SYMBOL;
    }

    private static boolean looksNumeric(String text) {
        char first = text.charAt(0);
        if (Character.isDigit(first)) {
            return true;
        }
        if ((first == '+' || first == '-' || first == '.') && text.length() > 1) {
            char second = text.charAt(1);
            return Character.isDigit(second) || (first != '.' && second == '.');
        }
        return false;
    }

    private static boolean terminatesBareToken(char c) {
        return Character.isWhitespace(c) || c == ',' || c == ';' || c == '"' || delimiterType(c) != null;
    }

    private static TokenType delimiterType(char c) {
        return switch (c) {
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            default -> null;
        };
    }

    private SourcePosition position() {
        return new SourcePosition(line, column);
    }

    private void advance() {
        if (source.charAt(index) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        index++;
    }
}
