package com.stratdsl.indicator;

import com.stratdsl.domain.model.PriceBar;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MarketDataPort} over bars held in memory, keyed by symbol and bar close time.
 *
 * <p>Used as the default port and as the market snapshot in tests and replays. Loading a bar
 * with an existing timestamp replaces it.
 */
public class InMemoryMarketDataPort implements MarketDataPort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMarketDataPort.class);

    private final Map<String, NavigableMap<Instant, PriceBar>> barsBySymbol = new ConcurrentHashMap<>();

    public void putBars(String symbol, Collection<PriceBar> bars) {
        NavigableMap<Instant, PriceBar> series =
                barsBySymbol.computeIfAbsent(symbol, key -> new ConcurrentSkipListMap<>());
        bars.forEach(bar -> series.put(bar.getTimestamp(), bar));
        log.debug("Loaded {} bars for {} ({} total)", bars.size(), symbol, series.size());
    }

    public void putBar(String symbol, PriceBar bar) {
        putBars(symbol, List.of(bar));
    }

    public Set<String> symbols() {
        return barsBySymbol.keySet();
    }

    public void clear() {
        barsBySymbol.clear();
    }

    @Override
    public List<PriceBar> getBars(String symbol, Instant asOf, int maxBars) {
        NavigableMap<Instant, PriceBar> series = barsBySymbol.get(symbol);
        if (series == null || maxBars <= 0) {
            return List.of();
        }
        List<PriceBar> visible = new ArrayList<>(series.headMap(asOf, true).values());
        int from = Math.max(0, visible.size() - maxBars);
        return List.copyOf(visible.subList(from, visible.size()));
    }

    @Override
    public BigDecimal getLatestPrice(String symbol, Instant asOf) {
        NavigableMap<Instant, PriceBar> series = barsBySymbol.get(symbol);
        if (series == null) {
            return null;
        }
        Map.Entry<Instant, PriceBar> latest = series.floorEntry(asOf);
        return latest != null ? latest.getValue().getClose() : null;
    }
}
