package com.stratdsl.engine;

import com.stratdsl.domain.model.StrategyAllocation;
import com.stratdsl.evaluator.TraceEntry;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link StrategyEngine#evaluate(EvaluationRequest)}. Carries an allocation for every
 * status except {@link EvaluationStatus#DUPLICATE}.
 */
@Getter
@Builder
@ToString(exclude = "trace")
public class EvaluationResult {

    private final String requestId;
    private final String correlationId;
    private final EvaluationStatus status;
    private final StrategyAllocation allocation;

    @Builder.Default
    private final List<TraceEntry> trace = List.of();

    private final String errorCode;
    private final String errorMessage;

    public static EvaluationResult duplicate(String requestId, String correlationId) {
        return EvaluationResult.builder()
                .requestId(requestId)
                .correlationId(correlationId)
                .status(EvaluationStatus.DUPLICATE)
                .build();
    }

    public Optional<StrategyAllocation> allocation() {
        return Optional.ofNullable(allocation);
    }

    public boolean isFallback() {
        return status == EvaluationStatus.FALLBACK;
    }

    public boolean isDuplicate() {
        return status == EvaluationStatus.DUPLICATE;
    }
}
