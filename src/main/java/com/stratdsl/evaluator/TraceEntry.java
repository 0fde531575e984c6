package com.stratdsl.evaluator;

import com.stratdsl.ast.NodeKind;
import com.stratdsl.ast.SourcePosition;
import com.stratdsl.domain.value.DslValue;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One step of an evaluation: the node visited, the operator applied (if any), its evaluated
 * inputs and its result, or the error that stopped it.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class TraceEntry {

    private final int sequence;
    private final int depth;
    private final NodeKind nodeKind;
    private final SourcePosition position;
    private final String operator;

    @Builder.Default
    private final List<DslValue> inputs = List.of();

    private final DslValue result;
    private final TraceOutcome outcome;
    private final String errorCode;
    private final String message;

    @Builder.Default
    private final Map<String, String> annotations = Map.of();

    private final Instant timestamp;

    public boolean isFailure() {
        return outcome == TraceOutcome.FAILURE;
    }

    public boolean isNodeVisit() {
        return outcome != TraceOutcome.NOTICE;
    }

    /**
     * Timestamp-free rendering of the entry. Two evaluations of the same AST over the same market
     * snapshot produce identical structures.
     */
    public String structure() {
        String renderedInputs = inputs.stream().map(DslValue::render).collect(Collectors.joining(" "));
        return sequence + "|" + depth + "|" + nodeKind + "|" + position + "|" + (operator != null ? operator : "-")
                + "|" + renderedInputs + "|" + (result != null ? result.render() : "-") + "|" + outcome
                + "|" + (errorCode != null ? errorCode : "-") + "|" + annotations;
    }
}
