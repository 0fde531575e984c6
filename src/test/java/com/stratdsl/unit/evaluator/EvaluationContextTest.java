package com.stratdsl.unit.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.stratdsl.domain.model.PriceBar;
import com.stratdsl.evaluator.EvaluationContext;
import com.stratdsl.evaluator.EvaluationLimits;
import com.stratdsl.event.EventPublisherHelper;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.indicator.InMemoryMarketDataPort;
import com.stratdsl.indicator.IndicatorRequest;
import com.stratdsl.indicator.IndicatorService;
import com.stratdsl.indicator.IndicatorType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EvaluationContextTest {

    private static final Instant AS_OF = Instant.parse("2024-06-03T20:00:00Z");

    @Mock
    private IndicatorService indicatorService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private InMemoryMarketDataPort marketDataPort;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        marketDataPort = new InMemoryMarketDataPort();
        context = EvaluationContext.builder()
                .indicatorService(indicatorService)
                .marketDataPort(marketDataPort)
                .eventPublisher(eventPublisherHelper)
                .correlationId("corr-7")
                .asOf(AS_OF)
                .limits(new EvaluationLimits(3, 2))
                .build();
    }

    private static IndicatorRequest rsi(String window) {
        return IndicatorRequest.of("SPY", IndicatorType.RSI, Map.of(IndicatorRequest.WINDOW, new BigDecimal(window)), AS_OF);
    }

    @Nested
    @DisplayName("Indicator lookups")
    class IndicatorLookups {

        @Test
        @DisplayName("equal requests are served from the memo after the first lookup")
        void memoizesEqualRequests() {
            when(indicatorService.get(eq("SPY"), eq(IndicatorType.RSI), anyMap(), eq(AS_OF)))
                    .thenReturn(new BigDecimal("61.2"));

            assertThat(context.indicator(rsi("14"))).isEqualByComparingTo("61.2");
            assertThat(context.indicator(rsi("14.00"))).isEqualByComparingTo("61.2");

            verify(indicatorService, times(1)).get(eq("SPY"), eq(IndicatorType.RSI), anyMap(), eq(AS_OF));
            assertThat(context.getMemoSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("different windows are different lookups")
        void differentWindows() {
            when(indicatorService.get(anyString(), any(), anyMap(), any())).thenReturn(BigDecimal.ONE);

            context.indicator(rsi("10"));
            context.indicator(rsi("14"));

            assertThat(context.getMemoSize()).isEqualTo(2);
        }

        @Test
        @DisplayName("missing value is INDICATOR_UNAVAILABLE and is not memoized")
        void missingValue() {
            when(indicatorService.get(anyString(), any(), anyMap(), any())).thenReturn(null);

            assertThatThrownBy(() -> context.indicator(rsi("10")))
                    .isInstanceOf(DslEvaluationException.class)
                    .extracting(e -> ((DslEvaluationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INDICATOR_UNAVAILABLE);
            assertThat(context.getMemoSize()).isZero();
        }

        @Test
        @DisplayName("current price comes from the market data port")
        void currentPrice() {
            marketDataPort.putBar("SPY", PriceBar.ofClose(AS_OF.minusSeconds(86_400), new BigDecimal("530.10")));
            marketDataPort.putBar("SPY", PriceBar.ofClose(AS_OF.plusSeconds(86_400), new BigDecimal("999")));

            BigDecimal price = context.indicator(
                    IndicatorRequest.of("SPY", IndicatorType.CURRENT_PRICE, Map.of(), AS_OF));

            assertThat(price).isEqualByComparingTo("530.10");
        }

        @Test
        @DisplayName("reset clears the memo")
        void resetClearsMemo() {
            when(indicatorService.get(anyString(), any(), anyMap(), any())).thenReturn(BigDecimal.TEN);
            context.indicator(rsi("10"));

            context.reset();

            assertThat(context.getMemoSize()).isZero();
        }
    }

    @Nested
    @DisplayName("Budget")
    class Budget {

        @Test
        @DisplayName("visits beyond the budget fail")
        void visitBudget() {
            context.recordVisit(1);
            context.recordVisit(1);
            context.recordVisit(1);

            assertThatThrownBy(() -> context.recordVisit(1))
                    .isInstanceOf(DslEvaluationException.class)
                    .hasMessageContaining("Node visit budget of 3 exceeded");
        }

        @Test
        @DisplayName("depth beyond the limit fails")
        void depthLimit() {
            assertThatThrownBy(() -> context.recordVisit(3))
                    .isInstanceOf(DslEvaluationException.class)
                    .extracting(e -> ((DslEvaluationException) e).getErrorCode())
                    .isEqualTo(ErrorCode.BUDGET_EXCEEDED);
        }
    }

    @Nested
    @DisplayName("Decisions")
    class Decisions {

        @Test
        @DisplayName("decisions carry the evaluation correlation id")
        void publishesWithCorrelationId() {
            context.publishDecision(this, "BRANCH", "took then", Map.of("branch", "then"));

            verify(eventPublisherHelper).publishDecision(this, "BRANCH", "took then", "corr-7", Map.of("branch", "then"));
        }

        @Test
        @DisplayName("no publisher attached is a no-op")
        void withoutPublisher() {
            EvaluationContext bare = EvaluationContext.builder().asOf(AS_OF).build();

            assertThatCode(() -> bare.publishDecision(this, "BRANCH", "m", Map.of())).doesNotThrowAnyException();
            assertThat(bare.getLimits()).isEqualTo(EvaluationLimits.DEFAULTS);
        }
    }
}
