package com.stratdsl.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.stratdsl.domain.model.PriceBar;
import com.stratdsl.indicator.InMemoryMarketDataPort;
import com.stratdsl.indicator.IndicatorConfig;
import com.stratdsl.indicator.IndicatorType;
import com.stratdsl.indicator.Ta4jIndicatorService;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Ta4jIndicatorService over small hand-checked close series.
 */
class Ta4jIndicatorServiceTest {

    private static final Instant FIRST_CLOSE = Instant.parse("2024-01-02T21:00:00Z");

    private InMemoryMarketDataPort marketDataPort;
    private IndicatorConfig indicatorConfig;
    private Ta4jIndicatorService indicatorService;

    @BeforeEach
    void setUp() {
        marketDataPort = new InMemoryMarketDataPort();
        indicatorConfig = new IndicatorConfig();
        indicatorService = new Ta4jIndicatorService(marketDataPort, indicatorConfig);
    }

    /** Loads daily closes for {@code symbol} and returns the time of the last one. */
    private Instant closes(String symbol, double... prices) {
        Instant time = FIRST_CLOSE;
        for (int i = 0; i < prices.length; i++) {
            time = FIRST_CLOSE.plus(Duration.ofDays(i));
            marketDataPort.putBar(symbol, PriceBar.ofClose(time, BigDecimal.valueOf(prices[i])));
        }
        return time;
    }

    private BigDecimal get(String symbol, IndicatorType type, int window, Instant asOf) {
        return indicatorService.get(symbol, type, Map.of("window", BigDecimal.valueOf(window)), asOf);
    }

    @Nested
    @DisplayName("Price averages")
    class PriceAverages {

        @Test
        @DisplayName("moving-average-price is the mean of the last window closes")
        void sma() {
            Instant asOf = closes("SPY", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

            assertThat(get("SPY", IndicatorType.MOVING_AVERAGE_PRICE, 3, asOf)).isEqualByComparingTo("9");
        }

        @Test
        @DisplayName("bars after asOf are invisible")
        void noLookAhead() {
            Instant asOf = closes("SPY", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

            Instant earlier = asOf.minus(Duration.ofDays(5));
            assertThat(get("SPY", IndicatorType.MOVING_AVERAGE_PRICE, 3, earlier)).isEqualByComparingTo("4");
        }

        @Test
        @DisplayName("too few bars for the window is unavailable")
        void tooShort() {
            Instant asOf = closes("SPY", 1, 2);

            assertThat(get("SPY", IndicatorType.MOVING_AVERAGE_PRICE, 3, asOf)).isNull();
            assertThat(get("SPY", IndicatorType.EXPONENTIAL_MOVING_AVERAGE_PRICE, 3, asOf)).isNull();
        }

        @Test
        @DisplayName("EMA of a constant series is that constant")
        void emaConstant() {
            Instant asOf = closes("SPY", 5, 5, 5, 5, 5, 5);

            assertThat(get("SPY", IndicatorType.EXPONENTIAL_MOVING_AVERAGE_PRICE, 3, asOf)).isEqualByComparingTo("5");
        }
    }

    @Nested
    @DisplayName("Returns")
    class Returns {

        @Test
        @DisplayName("cumulative-return is the percent change over the window")
        void cumulativeReturn() {
            Instant asOf = closes("QQQ", 100, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110);

            BigDecimal value = get("QQQ", IndicatorType.CUMULATIVE_RETURN, 5, asOf);

            assertThat(value.doubleValue()).isCloseTo(5.0 / 105.0 * 100.0, within(1e-6));
        }

        @Test
        @DisplayName("cumulative-return without enough history is zero")
        void cumulativeReturnShort() {
            Instant asOf = closes("QQQ", 100, 110);

            assertThat(get("QQQ", IndicatorType.CUMULATIVE_RETURN, 5, asOf)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("moving-average-return averages daily percent returns")
        void movingAverageReturn() {
            Instant asOf = closes("QQQ", 100, 110, 121);

            BigDecimal value = get("QQQ", IndicatorType.MOVING_AVERAGE_RETURN, 2, asOf);

            assertThat(value.doubleValue()).isCloseTo(10.0, within(1e-6));
        }

        @Test
        @DisplayName("volatility of a flat series is zero")
        void flatVolatility() {
            Instant asOf = closes("BND", 70, 70, 70, 70, 70, 70, 70, 70);

            assertThat(get("BND", IndicatorType.STDEV_RETURN, 5, asOf)).isEqualByComparingTo("0");
            assertThat(get("BND", IndicatorType.STDEV_PRICE, 5, asOf)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("volatility of a moving series is positive")
        void positiveVolatility() {
            Instant asOf = closes("TQQQ", 50, 55, 49, 60, 52, 58, 47, 63);

            assertThat(get("TQQQ", IndicatorType.STDEV_RETURN, 5, asOf)).isPositive();
            assertThat(get("TQQQ", IndicatorType.STDEV_PRICE, 5, asOf)).isPositive();
        }
    }

    @Nested
    @DisplayName("RSI")
    class Rsi {

        @Test
        @DisplayName("series shorter than the window reports the neutral value")
        void neutral() {
            Instant asOf = closes("SPY", 1, 2, 3);

            assertThat(get("SPY", IndicatorType.RSI, 14, asOf)).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("neutral value is configurable")
        void configuredNeutral() {
            indicatorConfig.setNeutralRsi(new BigDecimal("45"));
            Instant asOf = closes("SPY", 1, 2, 3);

            assertThat(get("SPY", IndicatorType.RSI, 14, asOf)).isEqualByComparingTo("45");
        }

        @Test
        @DisplayName("strictly rising series has RSI 100")
        void risingSeries() {
            Instant asOf = closes("SPY", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);

            assertThat(get("SPY", IndicatorType.RSI, 5, asOf)).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("RSI stays within 0..100")
        void bounded() {
            Instant asOf = closes("SPY", 10, 12, 11, 13, 12, 9, 14, 15, 13, 12, 16);

            assertThat(get("SPY", IndicatorType.RSI, 5, asOf)).isBetween(BigDecimal.ZERO, BigDecimal.valueOf(100));
        }
    }

    @Nested
    @DisplayName("Drawdown and price")
    class DrawdownAndPrice {

        @Test
        @DisplayName("max-drawdown is the largest peak-to-trough decline in percent")
        void maxDrawdown() {
            Instant asOf = closes("SPY", 100, 120, 90, 110);

            assertThat(get("SPY", IndicatorType.MAX_DRAWDOWN, 4, asOf)).isEqualByComparingTo("25");
        }

        @Test
        @DisplayName("max-drawdown only looks at the window")
        void maxDrawdownWindow() {
            Instant asOf = closes("SPY", 100, 50, 60, 66);

            assertThat(get("SPY", IndicatorType.MAX_DRAWDOWN, 2, asOf)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("current-price is the latest close")
        void currentPrice() {
            Instant asOf = closes("SPY", 100, 101.5);

            assertThat(indicatorService.get("SPY", IndicatorType.CURRENT_PRICE, Map.of(), asOf))
                    .isEqualByComparingTo("101.5");
        }

        @Test
        @DisplayName("unknown symbol yields no value")
        void unknownSymbol() {
            assertThat(get("NOPE", IndicatorType.MOVING_AVERAGE_PRICE, 3, FIRST_CLOSE)).isNull();
        }
    }
}
