package com.stratdsl.allocation;

import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.domain.value.FragmentValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.exception.InvalidAllocationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the raw result of an evaluation into a {@link StrategyAllocation}.
 *
 * <p>Steps:
 * <ol>
 *   <li>Accept a fragment, or a single symbol meaning 100 % in it</li>
 *   <li>Reject negative weights and a zero total</li>
 *   <li>Divide every weight by the total</li>
 *   <li>Quantize to {@code scale} decimals (half-even) and drop weights that round to zero</li>
 *   <li>Add the rounding remainder {@code 1 - sum} to the largest weight, ties going to the
 *       alphabetically first symbol, so the weights sum to exactly one</li>
 * </ol>
 */
public class AllocationConverter {

    private static final Logger log = LoggerFactory.getLogger(AllocationConverter.class);

    public static final int DEFAULT_SCALE = 6;

    private final int scale;

    public AllocationConverter() {
        this(DEFAULT_SCALE);
    }

    public AllocationConverter(int scale) {
        if (scale < 1) {
            throw new IllegalArgumentException("Allocation scale must be positive: " + scale);
        }
        this.scale = scale;
    }

    public StrategyAllocation toAllocation(DslValue value, String correlationId, Instant asOf) {
        PortfolioFragment fragment = switch (value.kind()) {
            case FRAGMENT -> ((FragmentValue) value).fragment();
            case SYMBOL -> PortfolioFragment.single(((SymbolValue) value).name());
            case NUMBER -> throw new InvalidAllocationException(
                    "Cannot allocate to a scalar: " + value.render(), Map.of("kind", value.kind().name()));
            case BOOL, LIST, MAP -> throw new InvalidAllocationException(
                    "Strategy produced a " + value.kind() + " which is not an allocation: " + value.render(),
                    Map.of("kind", value.kind().name()));
        };
        return new StrategyAllocation(correlationId, asOf, normalize(fragment.getWeights()), false);
    }

    /**
     * Normalizes raw weights to sum to exactly one at this converter's scale.
     *
     * @throws InvalidAllocationException on a negative weight, an empty map or a zero total
     */
    public SortedMap<String, BigDecimal> normalize(Map<String, BigDecimal> rawWeights) {
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : rawWeights.entrySet()) {
            if (entry.getValue().signum() < 0) {
                throw new InvalidAllocationException(
                        "Negative weight " + entry.getValue().toPlainString() + " for " + entry.getKey(),
                        Map.of("symbol", entry.getKey(), "weight", entry.getValue()));
            }
            total = total.add(entry.getValue());
        }
        if (total.signum() == 0) {
            throw new InvalidAllocationException(
                    "Allocation has zero total weight", Map.of("symbols", String.join(",", rawWeights.keySet())));
        }

        SortedMap<String, BigDecimal> quantized = new TreeMap<>();
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : new TreeMap<>(rawWeights).entrySet()) {
            BigDecimal weight = entry.getValue()
                    .divide(total, PortfolioFragment.ARITHMETIC)
                    .setScale(scale, RoundingMode.HALF_EVEN);
            if (weight.signum() > 0) {
                quantized.put(entry.getKey(), weight);
                sum = sum.add(weight);
            }
        }

        BigDecimal remainder = BigDecimal.ONE.setScale(scale).subtract(sum);
        String target = quantized.entrySet().stream()
                .max(Comparator.<Map.Entry<String, BigDecimal>, BigDecimal>comparing(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElseThrow(() -> new InvalidAllocationException("All weights round to zero"));
        quantized.put(target, quantized.get(target).add(remainder));
        if (remainder.signum() != 0) {
            log.debug("Applied rounding remainder {} to {}", remainder.toPlainString(), target);
        }
        return quantized;
    }

    public int getScale() {
        return scale;
    }
}
