package com.stratdsl.event;

import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.engine.EvaluationRequest;
import com.stratdsl.evaluator.TraceEntry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for
 * the engine's events.
 *
 * <p>All methods are non-blocking from the caller's point of view as far as the listeners allow:
 * delivery depends on whether listeners are synchronous {@code @EventListener} or
 * {@code @Async @EventListener}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Evaluation ----

    public void publishStrategyEvaluated(
            Object source,
            String correlationId,
            String causationId,
            Instant occurredAt,
            List<TraceEntry> trace,
            boolean succeeded) {
        applicationEventPublisher.publishEvent(
                new StrategyEvaluatedEvent(source, correlationId, causationId, occurredAt, trace, succeeded));
    }

    public void publishAllocationProduced(
            Object source, String correlationId, String causationId, Instant occurredAt, StrategyAllocation allocation) {
        applicationEventPublisher.publishEvent(
                new PortfolioAllocationProducedEvent(source, correlationId, causationId, occurredAt, allocation));
    }

    public void publishEvaluationRequested(Object source, EvaluationRequest request) {
        applicationEventPublisher.publishEvent(new StrategyEvaluationRequestedEvent(source, request));
    }

    // ---- Decision ----

    public void publishDecision(
            Object source, String category, String message, String correlationId, Map<String, Object> context) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message, correlationId, context));
    }
}
