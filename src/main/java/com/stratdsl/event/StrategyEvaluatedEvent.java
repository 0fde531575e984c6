package com.stratdsl.event;

import com.stratdsl.evaluator.TraceEntry;
import java.time.Instant;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per processed evaluation request with the full evaluation trace, successful or not.
 */
public class StrategyEvaluatedEvent extends ApplicationEvent {

    private final String correlationId;
    private final String causationId;
    private final Instant occurredAt;
    private final List<TraceEntry> trace;
    private final boolean succeeded;

    public StrategyEvaluatedEvent(
            Object source,
            String correlationId,
            String causationId,
            Instant occurredAt,
            List<TraceEntry> trace,
            boolean succeeded) {
        super(source);
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.occurredAt = occurredAt;
        this.trace = List.copyOf(trace);
        this.succeeded = succeeded;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getCausationId() {
        return causationId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public List<TraceEntry> getTrace() {
        return trace;
    }

    /** False when the evaluation fell back to the cash allocation. */
    public boolean isSucceeded() {
        return succeeded;
    }
}
