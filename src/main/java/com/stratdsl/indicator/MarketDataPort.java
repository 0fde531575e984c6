package com.stratdsl.indicator;

import com.stratdsl.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only access to historical bars. Implementations must never return data after {@code asOf}.
 */
public interface MarketDataPort {

    /** Up to {@code maxBars} most recent bars closed at or before {@code asOf}, oldest first. */
    List<PriceBar> getBars(String symbol, Instant asOf, int maxBars);

    /** Close of the latest bar at or before {@code asOf}, or null when none exists. */
    BigDecimal getLatestPrice(String symbol, Instant asOf);
}
