package com.stratdsl.domain.model;

import com.stratdsl.exception.InvalidAllocationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Final, normalized allocation emitted by the engine.
 *
 * <p>Invariants checked on construction: at least one symbol, no negative weight, and weights
 * summing to one within {@link #SUM_TOLERANCE}. Instances are immutable and safe to publish.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StrategyAllocation {

    public static final BigDecimal SUM_TOLERANCE = new BigDecimal("0.000001");

    private final String correlationId;
    private final Instant asOf;
    private final SortedMap<String, BigDecimal> weights;
    private final boolean fallback;

    public StrategyAllocation(String correlationId, Instant asOf, Map<String, BigDecimal> weights, boolean fallback) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.asOf = Objects.requireNonNull(asOf, "asOf");
        this.weights = Collections.unmodifiableSortedMap(validated(weights));
        this.fallback = fallback;
    }

    /** Single-symbol allocation used when evaluation fails. */
    public static StrategyAllocation cashFallback(String cashSymbol, String correlationId, Instant asOf) {
        return new StrategyAllocation(correlationId, asOf, Map.of(cashSymbol, BigDecimal.ONE), true);
    }

    public BigDecimal weightOf(String symbol) {
        return weights.getOrDefault(symbol, BigDecimal.ZERO);
    }

    public BigDecimal totalWeight() {
        return weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static SortedMap<String, BigDecimal> validated(Map<String, BigDecimal> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new InvalidAllocationException("Allocation must contain at least one symbol");
        }
        SortedMap<String, BigDecimal> copy = new TreeMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : weights.entrySet()) {
            BigDecimal weight = Objects.requireNonNull(entry.getValue(), "weight");
            if (weight.signum() < 0) {
                throw new InvalidAllocationException(
                        "Negative weight for " + entry.getKey(), Map.of("symbol", entry.getKey(), "weight", weight));
            }
            copy.put(entry.getKey(), weight);
            total = total.add(weight);
        }
        if (total.subtract(BigDecimal.ONE).abs().compareTo(SUM_TOLERANCE) > 0) {
            throw new InvalidAllocationException(
                    "Allocation weights must sum to 1 but sum to " + total.toPlainString(), Map.of("total", total));
        }
        return copy;
    }
}
