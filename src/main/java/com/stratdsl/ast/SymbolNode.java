package com.stratdsl.ast;

import java.util.Objects;

/**
 * Bare identifier: an operator name, a ticker, a keyword such as {@code :window}, or {@code nil}.
 */
public final class SymbolNode extends AstNode {

    private final String name;

    public SymbolNode(String name, SourcePosition position) {
        super(position);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public boolean isKeyword() {
        return name.length() > 1 && name.charAt(0) == ':';
    }

    public boolean isNil() {
        return "nil".equals(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SYMBOL;
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolNode other)) {
            return false;
        }
        return name.equals(other.name) && getPosition().equals(other.getPosition());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, getPosition());
    }
}
