package com.stratdsl.indicator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only source of indicator values for a symbol as of a point in time.
 */
public interface IndicatorService {

    /**
     * @param symbol    ticker to compute the indicator for
     * @param indicator which indicator
     * @param params    named parameters, at least {@code window}
     * @param asOf      evaluation instant; only data at or before it may be used
     * @return the indicator value, or null when there is not enough data
     */
    BigDecimal get(String symbol, IndicatorType indicator, Map<String, BigDecimal> params, Instant asOf);
}
