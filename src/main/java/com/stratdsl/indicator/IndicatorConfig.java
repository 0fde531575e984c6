package com.stratdsl.indicator;

import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for indicator computation, bound from application.yml under the
 * {@code indicators} prefix.
 */
@Data
@ConfigurationProperties(prefix = "indicators")
public class IndicatorConfig {

    /** Bars requested from the market data port per lookup, at least window + 1 is always fetched. */
    private int historyBars = 400;

    /** Trading days per year used to annualize return volatility. */
    private int annualizationDays = 252;

    /** RSI reported when the series is shorter than the RSI window. */
    private BigDecimal neutralRsi = BigDecimal.valueOf(50);
}
