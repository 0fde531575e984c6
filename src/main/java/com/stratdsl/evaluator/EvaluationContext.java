package com.stratdsl.evaluator;

import com.stratdsl.event.EventPublisherHelper;
import com.stratdsl.exception.BaseException;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.indicator.IndicatorRequest;
import com.stratdsl.indicator.IndicatorService;
import com.stratdsl.indicator.IndicatorType;
import com.stratdsl.indicator.MarketDataPort;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything an operator may touch while a strategy is evaluated.
 *
 * <p>Bundles the read-only collaborators (indicators, market data, decision publisher) with the
 * per-evaluation state: the indicator memo cache and the node-visit counter. One context serves
 * exactly one evaluation on one thread; {@link #reset()} is called by the evaluator on entry.
 *
 * <p>Indicator lookups go through {@link #indicator(IndicatorRequest)} so that repeated lookups
 * of the same (symbol, indicator, params, asOf) within an evaluation hit the collaborator once.
 */
@Getter
public class EvaluationContext {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContext.class);

    private final IndicatorService indicatorService;
    private final MarketDataPort marketDataPort;
    private final EventPublisherHelper eventPublisher;
    private final String correlationId;
    private final Instant asOf;
    private final EvaluationLimits limits;

    @Getter(AccessLevel.NONE)
    private final Map<IndicatorRequest, BigDecimal> indicatorMemo = new HashMap<>();

    private int nodeVisits;

    @Builder
    public EvaluationContext(
            IndicatorService indicatorService,
            MarketDataPort marketDataPort,
            EventPublisherHelper eventPublisher,
            String correlationId,
            Instant asOf,
            EvaluationLimits limits) {
        this.indicatorService = indicatorService;
        this.marketDataPort = marketDataPort;
        this.eventPublisher = eventPublisher;
        this.correlationId = correlationId;
        this.asOf = Objects.requireNonNull(asOf, "asOf");
        this.limits = limits != null ? limits : EvaluationLimits.DEFAULTS;
    }

    /** Clears the memo cache and the visit counter. */
    public void reset() {
        indicatorMemo.clear();
        nodeVisits = 0;
    }

    /**
     * Counts one node visit at {@code depth}.
     *
     * @throws DslEvaluationException with {@link ErrorCode#BUDGET_EXCEEDED} past either limit
     */
    public void recordVisit(int depth) {
        nodeVisits++;
        if (nodeVisits > limits.maxNodeVisits()) {
            throw new DslEvaluationException(
                    ErrorCode.BUDGET_EXCEEDED, "Node visit budget of " + limits.maxNodeVisits() + " exceeded");
        }
        if (depth > limits.maxDepth()) {
            throw new DslEvaluationException(
                    ErrorCode.BUDGET_EXCEEDED, "Evaluation depth limit of " + limits.maxDepth() + " exceeded");
        }
    }

    /**
     * Memoized indicator lookup.
     *
     * @throws DslEvaluationException with {@link ErrorCode#INDICATOR_UNAVAILABLE} when the value
     *     is missing or the lookup fails
     */
    public BigDecimal indicator(IndicatorRequest request) {
        BigDecimal cached = indicatorMemo.get(request);
        if (cached != null) {
            log.debug("Indicator memo hit: {}", request.describe());
            return cached;
        }
        BigDecimal value = lookup(request);
        if (value == null) {
            throw new DslEvaluationException(
                    ErrorCode.INDICATOR_UNAVAILABLE, "No " + request.indicator().getDslName() + " value for "
                            + request.symbol() + " " + request.params());
        }
        indicatorMemo.put(request, value);
        return value;
    }

    private BigDecimal lookup(IndicatorRequest request) {
        try {
            if (request.indicator() == IndicatorType.CURRENT_PRICE) {
                requireCollaborator(marketDataPort, "market data port");
                return marketDataPort.getLatestPrice(request.symbol(), request.asOf());
            }
            requireCollaborator(indicatorService, "indicator service");
            return indicatorService.get(request.symbol(), request.indicator(), request.params(), request.asOf());
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DslEvaluationException(
                    ErrorCode.INDICATOR_UNAVAILABLE, "Indicator lookup failed for " + request.describe(), e);
        }
    }

    private static void requireCollaborator(Object collaborator, String name) {
        if (collaborator == null) {
            throw new DslEvaluationException(ErrorCode.INDICATOR_UNAVAILABLE, "No " + name + " configured");
        }
    }

    /**
     * Publishes a branch or selection decision when a publisher is attached. A failing listener is
     * logged and never affects the evaluation.
     */
    public void publishDecision(Object source, String category, String message, Map<String, Object> details) {
        if (eventPublisher == null) {
            return;
        }
        try {
            eventPublisher.publishDecision(source, category, message, correlationId, details);
        } catch (RuntimeException e) {
            log.error("Failed to publish {} decision for {}", category, correlationId, e);
        }
    }

    public int getMemoSize() {
        return indicatorMemo.size();
    }
}
