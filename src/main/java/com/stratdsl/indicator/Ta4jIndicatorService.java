package com.stratdsl.indicator;

import com.stratdsl.domain.model.PriceBar;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.ROCIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * {@link IndicatorService} computing indicator values with ta4j over bars read from a
 * {@link MarketDataPort}.
 *
 * <p>Every lookup builds a fresh {@link BarSeries} from the bars visible at {@code asOf}, so
 * results depend only on the market snapshot and the request. Memoization across repeated
 * lookups within one evaluation is the evaluation context's job, not this service's.
 *
 * <p>Definitions (percent values are multiplied by 100):
 * <ul>
 *   <li>rsi: Wilder RSI over the close; the neutral value when the series is too short</li>
 *   <li>moving-average-price / exponential-moving-average-price: SMA / EMA of the close</li>
 *   <li>moving-average-return: mean of daily percent returns</li>
 *   <li>cumulative-return: percent change from the close {@code window} bars ago</li>
 *   <li>stdev-return: population standard deviation of daily percent returns, annualized</li>
 *   <li>stdev-price: population standard deviation of the close</li>
 *   <li>max-drawdown: largest peak-to-trough decline over the window, in percent</li>
 * </ul>
 */
public class Ta4jIndicatorService implements IndicatorService {

    private static final Logger log = LoggerFactory.getLogger(Ta4jIndicatorService.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int RESULT_SCALE = 10;

    private final MarketDataPort marketDataPort;
    private final IndicatorConfig indicatorConfig;

    public Ta4jIndicatorService(MarketDataPort marketDataPort, IndicatorConfig indicatorConfig) {
        this.marketDataPort = marketDataPort;
        this.indicatorConfig = indicatorConfig;
    }

    @Override
    public BigDecimal get(String symbol, IndicatorType indicator, Map<String, BigDecimal> params, Instant asOf) {
        IndicatorRequest request = IndicatorRequest.of(symbol, indicator, params, asOf);
        int window = request.window();
        if (window < 1) {
            throw new IllegalArgumentException("Indicator window must be positive: " + window);
        }

        if (indicator == IndicatorType.CURRENT_PRICE) {
            return marketDataPort.getLatestPrice(symbol, asOf);
        }

        int barsNeeded = Math.max(indicatorConfig.getHistoryBars(), window + 1);
        List<PriceBar> bars = marketDataPort.getBars(symbol, asOf, barsNeeded);
        if (bars.isEmpty()) {
            log.debug("No bars for {} as of {}", request.describe(), asOf);
            return null;
        }

        BigDecimal value = compute(indicator, window, symbol, bars);
        log.debug("Computed {} = {}", request.describe(), value);
        return value;
    }

    private BigDecimal compute(IndicatorType indicator, int window, String symbol, List<PriceBar> bars) {
        BarSeries series = BarSeriesFactory.fromBars(symbol, bars);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        int end = series.getEndIndex();
        int count = series.getBarCount();

        return switch (indicator) {
            case RSI -> count <= window
                    ? indicatorConfig.getNeutralRsi()
                    : valueAt(new RSIIndicator(close, window), end);
            case MOVING_AVERAGE_PRICE -> count < window ? null : valueAt(new SMAIndicator(close, window), end);
            case EXPONENTIAL_MOVING_AVERAGE_PRICE -> count < window
                    ? null
                    : valueAt(new EMAIndicator(close, window), end);
            case MOVING_AVERAGE_RETURN -> count <= window
                    ? null
                    : valueAt(new SMAIndicator(new ROCIndicator(close, 1), window), end);
            case CUMULATIVE_RETURN -> count <= window ? BigDecimal.ZERO : valueAt(new ROCIndicator(close, window), end);
            case STDEV_RETURN -> count <= window ? BigDecimal.ZERO : annualizedReturnVolatility(close, window, end);
            case STDEV_PRICE -> count < window ? null : valueAt(new StandardDeviationIndicator(close, window), end);
            case MAX_DRAWDOWN -> maxDrawdown(bars.subList(Math.max(0, bars.size() - window), bars.size()));
            case CURRENT_PRICE -> bars.get(bars.size() - 1).getClose();
        };
    }

    private BigDecimal annualizedReturnVolatility(ClosePriceIndicator close, int window, int end) {
        BigDecimal daily = valueAt(new StandardDeviationIndicator(new ROCIndicator(close, 1), window), end);
        if (daily == null) {
            return null;
        }
        BigDecimal annualization = BigDecimal.valueOf(indicatorConfig.getAnnualizationDays()).sqrt(MathContext.DECIMAL64);
        return daily.multiply(annualization).setScale(RESULT_SCALE, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal maxDrawdown(List<PriceBar> bars) {
        BigDecimal peak = null;
        BigDecimal worst = BigDecimal.ZERO;
        for (PriceBar bar : bars) {
            BigDecimal price = bar.getClose();
            if (peak == null || price.compareTo(peak) > 0) {
                peak = price;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(price).divide(peak, MathContext.DECIMAL64);
                if (drawdown.compareTo(worst) > 0) {
                    worst = drawdown;
                }
            }
        }
        return worst.multiply(HUNDRED).setScale(RESULT_SCALE, RoundingMode.HALF_EVEN);
    }

    private static BigDecimal valueAt(Indicator<Num> indicator, int index) {
        double value = indicator.getValue(index).doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(RESULT_SCALE, RoundingMode.HALF_EVEN);
    }
}
