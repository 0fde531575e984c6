package com.stratdsl.indicator;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Indicators addressable from strategy source, with the DSL operator name and the window
 * used when the expression gives none.
 */
public enum IndicatorType {
    RSI("rsi", 14),
    MOVING_AVERAGE_PRICE("moving-average-price", 200),
    EXPONENTIAL_MOVING_AVERAGE_PRICE("exponential-moving-average-price", 12),
    MOVING_AVERAGE_RETURN("moving-average-return", 21),
    CUMULATIVE_RETURN("cumulative-return", 60),
    STDEV_RETURN("stdev-return", 6),
    STDEV_PRICE("stdev-price", 6),
    MAX_DRAWDOWN("max-drawdown", 60),
    CURRENT_PRICE("current-price", 1);

    private static final Map<String, IndicatorType> BY_DSL_NAME =
            Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(IndicatorType::getDslName, Function.identity()));

    private final String dslName;
    private final int defaultWindow;

    IndicatorType(String dslName, int defaultWindow) {
        this.dslName = dslName;
        this.defaultWindow = defaultWindow;
    }

    public String getDslName() {
        return dslName;
    }

    public int getDefaultWindow() {
        return defaultWindow;
    }

    public static Optional<IndicatorType> fromDslName(String name) {
        return Optional.ofNullable(BY_DSL_NAME.get(name));
    }
}
