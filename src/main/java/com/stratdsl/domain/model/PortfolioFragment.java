package com.stratdsl.domain.model;

import com.stratdsl.ast.SourcePosition;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Intermediate, not-yet-normalized mapping of symbol to weight produced by portfolio operators.
 *
 * <p>Weights are kept sorted by symbol so iteration order never depends on evaluation order.
 * Combining fragments always sums weights of a symbol present in both; nothing is overwritten.
 * The producing operator and node position are kept as provenance for traces and errors.
 */
public final class PortfolioFragment {

    public static final MathContext ARITHMETIC = MathContext.DECIMAL128;

    private final SortedMap<String, BigDecimal> weights;
    private final String sourceOperator;
    private final SourcePosition sourcePosition;

    private PortfolioFragment(SortedMap<String, BigDecimal> weights, String sourceOperator, SourcePosition position) {
        this.weights = Collections.unmodifiableSortedMap(weights);
        this.sourceOperator = sourceOperator;
        this.sourcePosition = position;
    }

    public static PortfolioFragment empty() {
        return new PortfolioFragment(new TreeMap<>(), null, null);
    }

    public static PortfolioFragment of(Map<String, BigDecimal> weights) {
        SortedMap<String, BigDecimal> copy = new TreeMap<>();
        weights.forEach((symbol, weight) -> copy.merge(
                Objects.requireNonNull(symbol, "symbol"), Objects.requireNonNull(weight, "weight"), BigDecimal::add));
        return new PortfolioFragment(copy, null, null);
    }

    public static PortfolioFragment single(String symbol) {
        SortedMap<String, BigDecimal> weights = new TreeMap<>();
        weights.put(symbol, BigDecimal.ONE);
        return new PortfolioFragment(weights, null, null);
    }

    public SortedMap<String, BigDecimal> getWeights() {
        return weights;
    }

    public Set<String> symbols() {
        return weights.keySet();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public BigDecimal totalWeight() {
        return weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public PortfolioFragment merge(PortfolioFragment other) {
        SortedMap<String, BigDecimal> merged = new TreeMap<>(weights);
        other.weights.forEach((symbol, weight) -> merged.merge(symbol, weight, BigDecimal::add));
        return new PortfolioFragment(merged, sourceOperator, sourcePosition);
    }

    public PortfolioFragment scale(BigDecimal factor) {
        SortedMap<String, BigDecimal> scaled = new TreeMap<>();
        weights.forEach((symbol, weight) -> scaled.put(symbol, weight.multiply(factor, ARITHMETIC)));
        return new PortfolioFragment(scaled, sourceOperator, sourcePosition);
    }

    /**
     * Weights divided by their total. Callers must reject a zero total first.
     *
     * @throws ArithmeticException if the total weight is zero
     */
    public PortfolioFragment normalized() {
        BigDecimal total = totalWeight();
        if (total.signum() == 0) {
            throw new ArithmeticException("Cannot normalize a fragment with zero total weight");
        }
        SortedMap<String, BigDecimal> normalized = new TreeMap<>();
        weights.forEach((symbol, weight) -> normalized.put(symbol, weight.divide(total, ARITHMETIC)));
        return new PortfolioFragment(normalized, sourceOperator, sourcePosition);
    }

    public PortfolioFragment withProvenance(String operator, SourcePosition position) {
        return new PortfolioFragment(new TreeMap<>(weights), operator, position);
    }

    public String getSourceOperator() {
        return sourceOperator;
    }

    public SourcePosition getSourcePosition() {
        return sourcePosition;
    }

    public String render() {
        return weights.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue().toPlainString())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    /** Equality is by weights only; provenance is informational. */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PortfolioFragment other)) {
            return false;
        }
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "PortfolioFragment" + render();
    }
}
