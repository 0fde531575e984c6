package com.stratdsl.domain.value;

/**
 * Runtime value produced by evaluating a strategy expression.
 *
 * <p>The set of variants is closed. Code consuming values switches on {@link #kind()} so the
 * compiler flags every switch that misses a variant when one is added.
 */
public sealed interface DslValue permits NumberValue, BoolValue, SymbolValue, FragmentValue, ListValue, MapValue {

    enum Kind {
        NUMBER,
        BOOL,
        SYMBOL,
        FRAGMENT,
        LIST,
        MAP
    }

    Kind kind();

    /** Compact human-readable form used in trace entries and log lines. */
    String render();
}
