package com.stratdsl.api.dto.response;

import com.stratdsl.engine.EvaluationResult;
import com.stratdsl.evaluator.TraceEntry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EvaluationResponse {

    private final String requestId;
    private final String correlationId;
    private final String status;
    private final Instant asOf;
    private final Map<String, BigDecimal> weights;
    private final String errorCode;
    private final String errorMessage;
    private final List<TraceStep> trace;

    public static EvaluationResponse from(EvaluationResult result) {
        EvaluationResponseBuilder builder = EvaluationResponse.builder()
                .requestId(result.getRequestId())
                .correlationId(result.getCorrelationId())
                .status(result.getStatus().name())
                .errorCode(result.getErrorCode())
                .errorMessage(result.getErrorMessage())
                .trace(result.getTrace().stream().map(TraceStep::from).collect(Collectors.toList()));
        result.allocation().ifPresent(allocation -> builder.asOf(allocation.getAsOf()).weights(allocation.getWeights()));
        return builder.build();
    }

    @Getter
    @Builder
    public static class TraceStep {
        private final int sequence;
        private final int depth;
        private final String position;
        private final String operator;
        private final String outcome;
        private final String result;
        private final String message;
        private final Map<String, String> annotations;

        static TraceStep from(TraceEntry entry) {
            return TraceStep.builder()
                    .sequence(entry.getSequence())
                    .depth(entry.getDepth())
                    .position(entry.getPosition() != null ? entry.getPosition().toString() : null)
                    .operator(entry.getOperator())
                    .outcome(entry.getOutcome().name())
                    .result(entry.getResult() != null ? entry.getResult().render() : null)
                    .message(entry.getMessage())
                    .annotations(entry.getAnnotations().isEmpty() ? null : entry.getAnnotations())
                    .build();
        }
    }
}
