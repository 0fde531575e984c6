package com.stratdsl.indicator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Fully resolved indicator lookup. Also the key of the per-evaluation memo cache, so parameter
 * values are stripped of trailing zeros to make {@code 14} and {@code 14.0} the same lookup.
 */
public record IndicatorRequest(String symbol, IndicatorType indicator, SortedMap<String, BigDecimal> params, Instant asOf) {

    public static final String WINDOW = "window";

    public IndicatorRequest {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(indicator, "indicator");
        Objects.requireNonNull(asOf, "asOf");
        SortedMap<String, BigDecimal> normalized = new TreeMap<>();
        params.forEach((key, value) -> normalized.put(key, value.stripTrailingZeros()));
        params = Collections.unmodifiableSortedMap(normalized);
    }

    public static IndicatorRequest of(String symbol, IndicatorType indicator, Map<String, BigDecimal> params, Instant asOf) {
        return new IndicatorRequest(symbol, indicator, new TreeMap<>(params), asOf);
    }

    public int window() {
        BigDecimal window = params.get(WINDOW);
        return window != null ? window.intValueExact() : indicator.getDefaultWindow();
    }

    /** Cache-style key in the same shape the indicator subsystem logs: SYMBOL:TYPE:params. */
    public String describe() {
        return symbol + ":" + indicator.name() + ":" + params;
    }
}
