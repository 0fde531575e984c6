package com.stratdsl.exception;

import com.stratdsl.ast.SourcePosition;
import java.util.Map;

/**
 * Malformed strategy source: lexical errors, unbalanced brackets, bad numeric literals,
 * unpaired map keys, trailing forms, or nesting/size limits exceeded.
 */
public class DslParseException extends BaseException {

    private final SourcePosition position;

    public DslParseException(String message, SourcePosition position) {
        super(
                ErrorCode.PARSE_ERROR,
                message + " at line " + position.line() + ", column " + position.column(),
                Map.of("line", position.line(), "column", position.column()));
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public int getLine() {
        return position.line();
    }

    public int getColumn() {
        return position.column();
    }
}
