package com.stratdsl.engine;

import com.stratdsl.allocation.AllocationConverter;
import com.stratdsl.ast.AstNode;
import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.evaluator.EvaluationContext;
import com.stratdsl.evaluator.EvaluationLimits;
import com.stratdsl.evaluator.EvaluationTrace;
import com.stratdsl.evaluator.StrategyEvaluator;
import com.stratdsl.event.EventPublisherHelper;
import com.stratdsl.event.StrategyEvaluationRequestedEvent;
import com.stratdsl.exception.BaseException;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.DslParseException;
import com.stratdsl.exception.ErrorCode;
import com.stratdsl.exception.InvalidAllocationException;
import com.stratdsl.indicator.IndicatorService;
import com.stratdsl.indicator.MarketDataPort;
import com.stratdsl.parser.StrategyParser;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Single entry point turning an {@link EvaluationRequest} into a published allocation.
 *
 * <p>Pipeline per request:
 * <ol>
 *   <li>Fill in a missing correlation id from the event id, or generate one</li>
 *   <li>Claim the request id in the {@link ProcessedRequestCache}; a repeat returns
 *       {@link EvaluationStatus#DUPLICATE} without evaluating or publishing anything</li>
 *   <li>Resolve the AST (pre-parsed, inline source or strategy file)</li>
 *   <li>Evaluate it with a fresh {@link EvaluationContext} and {@link EvaluationTrace}</li>
 *   <li>Convert the result with the {@link AllocationConverter}</li>
 *   <li>Publish {@code StrategyEvaluatedEvent} and {@code PortfolioAllocationProducedEvent}</li>
 * </ol>
 *
 * <p>This is the only place where evaluation failures are handled. Parse, evaluation, allocation
 * and unexpected runtime errors all end in the cash fallback allocation with a failure entry in
 * the trace; no exception leaves {@link #evaluate(EvaluationRequest)}.
 */
@Service
public class StrategyEngine {

    private static final Logger log = LoggerFactory.getLogger(StrategyEngine.class);

    private final StrategyParser strategyParser;
    private final StrategyEvaluator strategyEvaluator;
    private final AllocationConverter allocationConverter;
    private final ProcessedRequestCache processedRequestCache;
    private final StrategySourceLoader strategySourceLoader;
    private final IndicatorService indicatorService;
    private final MarketDataPort marketDataPort;
    private final EventPublisherHelper eventPublisherHelper;
    private final EngineConfig engineConfig;
    private final Clock clock;

    public StrategyEngine(
            StrategyParser strategyParser,
            StrategyEvaluator strategyEvaluator,
            AllocationConverter allocationConverter,
            ProcessedRequestCache processedRequestCache,
            StrategySourceLoader strategySourceLoader,
            IndicatorService indicatorService,
            MarketDataPort marketDataPort,
            EventPublisherHelper eventPublisherHelper,
            EngineConfig engineConfig,
            Clock clock) {
        this.strategyParser = strategyParser;
        this.strategyEvaluator = strategyEvaluator;
        this.allocationConverter = allocationConverter;
        this.processedRequestCache = processedRequestCache;
        this.strategySourceLoader = strategySourceLoader;
        this.indicatorService = indicatorService;
        this.marketDataPort = marketDataPort;
        this.eventPublisherHelper = eventPublisherHelper;
        this.engineConfig = engineConfig;
        this.clock = clock;
    }

    @EventListener
    public void onEvaluationRequested(StrategyEvaluationRequestedEvent event) {
        evaluate(event.getRequest());
    }

    public EvaluationResult evaluate(EvaluationRequest incoming) {
        EvaluationRequest request = withCorrelationId(incoming);
        String requestId = request.idempotencyKey();
        String correlationId = request.getCorrelationId();
        Instant receivedAt = clock.instant();

        if (!processedRequestCache.claim(requestId, receivedAt)) {
            log.debug("Duplicate evaluation request {} (correlation {}) ignored", requestId, correlationId);
            return EvaluationResult.duplicate(requestId, correlationId);
        }

        Instant asOf = request.getAsOf() != null ? request.getAsOf() : receivedAt;
        EvaluationTrace trace = new EvaluationTrace(clock);
        StrategyAllocation allocation = null;
        BaseException failure = null;

        try {
            AstNode ast = resolveAst(request);
            EvaluationContext context = EvaluationContext.builder()
                    .indicatorService(indicatorService)
                    .marketDataPort(marketDataPort)
                    .eventPublisher(eventPublisherHelper)
                    .correlationId(correlationId)
                    .asOf(asOf)
                    .limits(new EvaluationLimits(
                            engineConfig.getEvaluation().getMaxNodeVisits(),
                            engineConfig.getEvaluation().getMaxDepth()))
                    .build();
            DslValue value = strategyEvaluator.evaluate(ast, context, trace);
            allocation = allocationConverter.toAllocation(value, correlationId, asOf);
        } catch (BaseException e) {
            failure = e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure evaluating strategy for {}", correlationId, e);
            failure = new DslEvaluationException(
                    ErrorCode.INTERNAL_ERROR, "Unexpected evaluation failure: " + e.getMessage(), e);
        }

        EvaluationStatus status = EvaluationStatus.EVALUATED;
        if (failure != null) {
            trace.failure(stageOf(failure), failure);
            allocation = StrategyAllocation.cashFallback(engineConfig.getCashSymbol(), correlationId, asOf);
            status = EvaluationStatus.FALLBACK;
            log.warn(
                    "Strategy evaluation {} fell back to {}: [{}] {}",
                    correlationId,
                    engineConfig.getCashSymbol(),
                    failure.getErrorCode().getCode(),
                    failure.getMessage());
        }

        EvaluationResult result = EvaluationResult.builder()
                .requestId(requestId)
                .correlationId(correlationId)
                .status(status)
                .allocation(allocation)
                .trace(trace.entries())
                .errorCode(failure != null ? failure.getErrorCode().getCode() : null)
                .errorMessage(failure != null ? failure.getMessage() : null)
                .build();

        publish(request, result);
        log.info(
                "Strategy evaluation {} {}: weights={}, traceEntries={}",
                correlationId,
                status,
                allocation.getWeights(),
                result.getTrace().size());
        return result;
    }

    /**
     * Requests arriving without a correlation id take the event id, or a generated id when neither
     * is set. A generated id never matches an earlier request.
     */
    private static EvaluationRequest withCorrelationId(EvaluationRequest request) {
        if (hasText(request.getCorrelationId())) {
            return request;
        }
        String correlationId = hasText(request.getEventId())
                ? request.getEventId()
                : UUID.randomUUID().toString();
        log.warn("Evaluation request without correlation id, using {}", correlationId);
        return request.toBuilder().correlationId(correlationId).build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private AstNode resolveAst(EvaluationRequest request) {
        if (request.getAst() != null) {
            return request.getAst();
        }
        return strategyParser.parse(strategySourceLoader.load(request));
    }

    private static String stageOf(BaseException failure) {
        if (failure instanceof DslParseException) {
            return "parse";
        }
        if (failure instanceof InvalidAllocationException) {
            return "allocate";
        }
        if (failure instanceof DslEvaluationException) {
            return "evaluate";
        }
        return "load";
    }

    private void publish(EvaluationRequest request, EvaluationResult result) {
        Instant publishedAt = clock.instant();
        String correlationId = request.getCorrelationId();
        String causationId = request.effectiveCausationId();
        try {
            eventPublisherHelper.publishStrategyEvaluated(
                    this, correlationId, causationId, publishedAt, result.getTrace(), !result.isFallback());
        } catch (RuntimeException e) {
            log.error("Failed to publish StrategyEvaluatedEvent for {}", correlationId, e);
        }
        try {
            eventPublisherHelper.publishAllocationProduced(
                    this, correlationId, causationId, publishedAt, result.getAllocation());
        } catch (RuntimeException e) {
            log.error("Failed to publish PortfolioAllocationProducedEvent for {}", correlationId, e);
        }
    }
}
