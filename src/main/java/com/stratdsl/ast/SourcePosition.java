package com.stratdsl.ast;

/**
 * 1-based line and column of the first character of a token or node.
 */
public record SourcePosition(int line, int column) {

    public static final SourcePosition START = new SourcePosition(1, 1);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
