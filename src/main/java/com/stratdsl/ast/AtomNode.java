package com.stratdsl.ast;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Literal value: a {@link BigDecimal} number, a {@link String} or a {@link Boolean}.
 */
public final class AtomNode extends AstNode {

    private final Object value;

    private AtomNode(Object value, SourcePosition position) {
        super(position);
        this.value = Objects.requireNonNull(value, "value");
    }

    public static AtomNode number(BigDecimal value, SourcePosition position) {
        return new AtomNode(value, position);
    }

    public static AtomNode string(String value, SourcePosition position) {
        return new AtomNode(value, position);
    }

    public static AtomNode bool(boolean value, SourcePosition position) {
        return new AtomNode(value, position);
    }

    public Object getValue() {
        return value;
    }

    public boolean isNumber() {
        return value instanceof BigDecimal;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ATOM;
    }

    @Override
    public String render() {
        if (value instanceof String s) {
            return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value instanceof BigDecimal number) {
            return number.toPlainString();
        }
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AtomNode other)) {
            return false;
        }
        return value.equals(other.value) && getPosition().equals(other.getPosition());
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, getPosition());
    }
}
