package com.stratdsl.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an evaluation takes a decision worth auditing: which branch of an {@code if}
 * was taken, which candidates a {@code filter} kept.
 *
 * <p>Examples:
 * <ul>
 *   <li>"Condition (> (rsi "SPY" {:window 10}) 80) is true, taking then branch"</li>
 *   <li>"Selected [TQQQ] from 3 candidates by (cumulative-return {:window 5})"</li>
 * </ul>
 */
public class DecisionEvent extends ApplicationEvent {

    private final String category;
    private final String message;
    private final String correlationId;
    private final Map<String, Object> context;
    private final Instant occurredAt;

    /**
     * @param source        the component that made the decision
     * @param category      classification, e.g. "BRANCH" or "SELECTION"
     * @param message       human-readable description of the decision
     * @param correlationId the evaluation the decision belongs to
     * @param context       additional structured data for the decision log
     */
    public DecisionEvent(
            Object source, String category, String message, String correlationId, Map<String, Object> context) {
        super(source);
        this.category = category;
        this.message = message;
        this.correlationId = correlationId;
        this.context = context != null ? new HashMap<>(context) : new HashMap<>();
        this.occurredAt = Instant.now();
    }

    public String getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
