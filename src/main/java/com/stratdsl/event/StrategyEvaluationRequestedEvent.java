package com.stratdsl.event;

import com.stratdsl.engine.EvaluationRequest;
import org.springframework.context.ApplicationEvent;

/**
 * Inbound request to evaluate a strategy, consumed by the strategy engine.
 */
public class StrategyEvaluationRequestedEvent extends ApplicationEvent {

    private final EvaluationRequest request;

    public StrategyEvaluationRequestedEvent(Object source, EvaluationRequest request) {
        super(source);
        this.request = request;
    }

    public EvaluationRequest getRequest() {
        return request;
    }
}
