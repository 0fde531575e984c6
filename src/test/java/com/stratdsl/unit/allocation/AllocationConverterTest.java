package com.stratdsl.unit.allocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stratdsl.allocation.AllocationConverter;
import com.stratdsl.domain.model.PortfolioFragment;
import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.domain.value.BoolValue;
import com.stratdsl.domain.value.FragmentValue;
import com.stratdsl.domain.value.ListValue;
import com.stratdsl.domain.value.NumberValue;
import com.stratdsl.domain.value.SymbolValue;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.exception.InvalidAllocationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AllocationConverter covering accepted result kinds, normalization, the
 * six-decimal rounding policy and rejection of invalid weights.
 */
class AllocationConverterTest {

    private static final Instant AS_OF = Instant.parse("2024-06-03T20:00:00Z");

    private final AllocationConverter converter = new AllocationConverter();

    private static Map<String, BigDecimal> raw(Object... pairs) {
        Map<String, BigDecimal> weights = new TreeMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            weights.put((String) pairs[i], new BigDecimal(pairs[i + 1].toString()));
        }
        return weights;
    }

    @Nested
    @DisplayName("Result kinds")
    class ResultKinds {

        @Test
        @DisplayName("single symbol becomes 100 %")
        void symbol() {
            StrategyAllocation allocation = converter.toAllocation(SymbolValue.of("SPY"), "c1", AS_OF);

            assertThat(allocation.getWeights()).containsExactly(Map.entry("SPY", new BigDecimal("1.000000")));
            assertThat(allocation.isFallback()).isFalse();
            assertThat(allocation.getCorrelationId()).isEqualTo("c1");
            assertThat(allocation.getAsOf()).isEqualTo(AS_OF);
        }

        @Test
        @DisplayName("fragment is normalized")
        void fragment() {
            StrategyAllocation allocation = converter.toAllocation(
                    FragmentValue.of(PortfolioFragment.of(raw("A", "2", "B", "6"))), "c1", AS_OF);

            assertThat(allocation.getWeights())
                    .containsEntry("A", new BigDecimal("0.250000"))
                    .containsEntry("B", new BigDecimal("0.750000"));
        }

        @Test
        @DisplayName("scalar result is rejected")
        void scalar() {
            assertThatThrownBy(() -> converter.toAllocation(NumberValue.of(1), "c1", AS_OF))
                    .isInstanceOf(InvalidAllocationException.class)
                    .hasMessageContaining("Cannot allocate to a scalar");
        }

        @Test
        @DisplayName("boolean and list results are rejected")
        void nonAllocations() {
            assertThatThrownBy(() -> converter.toAllocation(BoolValue.TRUE, "c1", AS_OF))
                    .isInstanceOf(InvalidAllocationException.class)
                    .hasMessageContaining("BOOL");
            assertThatThrownBy(() -> converter.toAllocation(ListValue.EMPTY, "c1", AS_OF))
                    .isInstanceOf(InvalidAllocationException.class)
                    .extracting(e -> ((InvalidAllocationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_ALLOCATION);
        }
    }

    @Nested
    @DisplayName("Rounding")
    class Rounding {

        @Test
        @DisplayName("thirds: remainder goes to the alphabetically first of the tied largest")
        void thirds() {
            SortedMap<String, BigDecimal> weights = converter.normalize(raw("C", 1, "A", 1, "B", 1));

            assertThat(weights).containsExactly(
                    Map.entry("A", new BigDecimal("0.333334")),
                    Map.entry("B", new BigDecimal("0.333333")),
                    Map.entry("C", new BigDecimal("0.333333")));
        }

        @Test
        @DisplayName("negative remainder is taken from the largest weight")
        void negativeRemainder() {
            SortedMap<String, BigDecimal> weights = converter.normalize(raw("A", 1, "B", 1, "C", 1, "D", 3));

            assertThat(weights.get("D")).isEqualTo(new BigDecimal("0.499999"));
            assertThat(weights.get("A")).isEqualTo(new BigDecimal("0.166667"));
            assertThat(sum(weights)).isEqualByComparingTo(BigDecimal.ONE);
        }

        @Test
        @DisplayName("near-equal weights quantize to an exact sum of one")
        void nearEqual() {
            SortedMap<String, BigDecimal> weights = converter.normalize(raw("A", "0.5", "B", "0.5000001"));

            assertThat(weights.get("A")).isEqualTo(new BigDecimal("0.500000"));
            assertThat(weights.get("B")).isEqualTo(new BigDecimal("0.500000"));
        }

        @Test
        @DisplayName("weights rounding to zero are dropped")
        void dropsDust() {
            SortedMap<String, BigDecimal> weights = converter.normalize(raw("A", "1", "B", "0.0000001"));

            assertThat(weights).containsOnlyKeys("A");
            assertThat(weights.get("A")).isEqualTo(new BigDecimal("1.000000"));
        }

        @Test
        @DisplayName("custom scale")
        void customScale() {
            SortedMap<String, BigDecimal> weights = new AllocationConverter(2).normalize(raw("A", 1, "B", 1, "C", 1));

            assertThat(weights.get("A")).isEqualTo(new BigDecimal("0.34"));
            assertThat(weights.get("B")).isEqualTo(new BigDecimal("0.33"));
        }

        private BigDecimal sum(Map<String, BigDecimal> weights) {
            return weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        }
    }

    @Nested
    @DisplayName("Invalid weights")
    class InvalidWeights {

        @Test
        @DisplayName("zero total is rejected")
        void zeroTotal() {
            assertThatThrownBy(() -> converter.normalize(raw("A", 0, "B", 0)))
                    .isInstanceOf(InvalidAllocationException.class)
                    .hasMessageContaining("zero total weight");
        }

        @Test
        @DisplayName("negative weight is rejected")
        void negative() {
            assertThatThrownBy(() -> converter.normalize(raw("A", "1.5", "B", "-0.5")))
                    .isInstanceOf(InvalidAllocationException.class)
                    .hasMessageContaining("Negative weight -0.5 for B");
        }

        @Test
        @DisplayName("empty fragment is rejected")
        void empty() {
            assertThatThrownBy(() -> converter.toAllocation(FragmentValue.of(PortfolioFragment.empty()), "c1", AS_OF))
                    .isInstanceOf(InvalidAllocationException.class);
        }

        @Test
        @DisplayName("scale must be positive")
        void invalidScale() {
            assertThatThrownBy(() -> new AllocationConverter(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
