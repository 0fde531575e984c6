package com.stratdsl.event;

import com.stratdsl.domain.model.StrategyAllocation;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per processed evaluation request with the resulting allocation, which is the
 * cash fallback when evaluation failed.
 *
 * <p>Key listeners: downstream rebalancing and allocation audit.
 */
public class PortfolioAllocationProducedEvent extends ApplicationEvent {

    private final String correlationId;
    private final String causationId;
    private final Instant occurredAt;
    private final StrategyAllocation allocation;

    public PortfolioAllocationProducedEvent(
            Object source, String correlationId, String causationId, Instant occurredAt, StrategyAllocation allocation) {
        super(source);
        this.correlationId = correlationId;
        this.causationId = causationId;
        this.occurredAt = occurredAt;
        this.allocation = allocation;
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

    public StrategyAllocation getAllocation() {
        return allocation;
    }
}
