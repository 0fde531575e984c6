package com.stratdsl.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One closed OHLCV bar for a symbol. {@code timestamp} is the bar close time.
 */
@Value
@Builder
public class PriceBar {

    Instant timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    /** Bar whose open, high, low and close are all {@code price}. */
    public static PriceBar ofClose(Instant timestamp, BigDecimal price) {
        return PriceBar.builder()
                .timestamp(timestamp)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(0)
                .build();
    }
}
