package com.stratdsl.ast;

public enum NodeKind {
    ATOM,
    SYMBOL,
    LIST,
    VECTOR,
    MAP_LITERAL
}
