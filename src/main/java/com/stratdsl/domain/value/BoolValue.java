package com.stratdsl.domain.value;

public record BoolValue(boolean value) implements DslValue {

    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Kind kind() {
        return Kind.BOOL;
    }

    @Override
    public String render() {
        return Boolean.toString(value);
    }
}
