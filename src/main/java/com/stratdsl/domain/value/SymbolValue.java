package com.stratdsl.domain.value;

import java.util.Objects;

/**
 * Opaque name such as a ticker. String literals evaluate to symbols as well.
 */
public record SymbolValue(String name) implements DslValue {

    public SymbolValue {
        Objects.requireNonNull(name, "name");
    }

    public static SymbolValue of(String name) {
        return new SymbolValue(name);
    }

    @Override
    public Kind kind() {
        return Kind.SYMBOL;
    }

    @Override
    public String render() {
        return name;
    }
}
