package com.stratdsl.engine;

import com.stratdsl.ast.AstNode;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Request to evaluate one strategy. Exactly one of {@code ast}, {@code source} and
 * {@code strategyPath} is expected; they are tried in that order.
 *
 * <p>{@code eventId} identifies the delivery for de-duplication; when absent the correlation id
 * is used. {@code asOf} defaults to the engine clock.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"source", "ast"})
public class EvaluationRequest {

    private final String correlationId;
    private final String causationId;
    private final String eventId;
    private final String source;
    private final String strategyPath;
    private final AstNode ast;
    private final Instant asOf;

    public String idempotencyKey() {
        return eventId != null && !eventId.isBlank() ? eventId : correlationId;
    }

    public String effectiveCausationId() {
        return causationId != null ? causationId : correlationId;
    }
}
