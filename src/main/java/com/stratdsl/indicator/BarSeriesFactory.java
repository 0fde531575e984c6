package com.stratdsl.indicator;

import com.stratdsl.domain.model.PriceBar;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

/**
 * Builds ta4j {@link BarSeries} instances from {@link PriceBar} snapshots.
 *
 * <p>ta4j rejects bars whose end time does not advance, so bars are sorted and later duplicates
 * of a timestamp are skipped.
 */
public final class BarSeriesFactory {

    private BarSeriesFactory() {}

    public static BarSeries fromBars(String name, List<PriceBar> bars) {
        BarSeries series = new BaseBarSeriesBuilder().withName(name).build();
        Instant previous = null;
        List<PriceBar> ordered = bars.stream()
                .sorted(Comparator.comparing(PriceBar::getTimestamp))
                .toList();
        for (PriceBar bar : ordered) {
            if (previous != null && !bar.getTimestamp().isAfter(previous)) {
                continue;
            }
            series.addBar(
                    bar.getTimestamp().atZone(ZoneOffset.UTC),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume());
            previous = bar.getTimestamp();
        }
        return series;
    }
}
