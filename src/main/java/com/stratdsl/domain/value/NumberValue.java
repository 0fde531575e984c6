package com.stratdsl.domain.value;

import java.math.BigDecimal;
import java.util.Objects;

public record NumberValue(BigDecimal value) implements DslValue {

    public NumberValue {
        Objects.requireNonNull(value, "value");
    }

    public static NumberValue of(BigDecimal value) {
        return new NumberValue(value);
    }

    public static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    @Override
    public String render() {
        return value.toPlainString();
    }
}
