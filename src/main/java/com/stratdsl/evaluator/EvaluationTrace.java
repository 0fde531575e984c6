package com.stratdsl.evaluator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.SourcePosition;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.exception.BaseException;
import com.stratdsl.exception.DslEvaluationException;
import com.stratdsl.exception.DslParseException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Append-only log of {@link TraceEntry} built during one evaluation.
 *
 * <p>Not thread-safe; every evaluation owns its own trace. Entries are appended in completion
 * order, so a call's entry follows the entries of its arguments.
 */
public class EvaluationTrace {

    private final Clock clock;
    private final List<TraceEntry> entries = new ArrayList<>();

    public EvaluationTrace(Clock clock) {
        this.clock = clock;
    }

    public void success(
            AstNode node, int depth, String operator, List<DslValue> inputs, DslValue result, Map<String, String> annotations) {
        append(TraceEntry.builder()
                .depth(depth)
                .nodeKind(node.getKind())
                .position(node.getPosition())
                .operator(operator)
                .inputs(List.copyOf(inputs))
                .result(result)
                .outcome(TraceOutcome.SUCCESS)
                .annotations(copyOf(annotations)));
    }

    public void failure(AstNode node, int depth, String operator, BaseException error) {
        append(TraceEntry.builder()
                .depth(depth)
                .nodeKind(node.getKind())
                .position(node.getPosition())
                .operator(operator)
                .outcome(TraceOutcome.FAILURE)
                .errorCode(error.getErrorCode().getCode())
                .message(error.getMessage()));
    }

    /**
     * Failure that happened outside any node, e.g. while parsing or converting the result.
     * Parse and evaluation errors keep their source position.
     */
    public void failure(String stage, BaseException error) {
        SourcePosition position = null;
        if (error instanceof DslParseException parseError) {
            position = parseError.getPosition();
        } else if (error instanceof DslEvaluationException evaluationError) {
            position = evaluationError.getPosition();
        }
        append(TraceEntry.builder()
                .depth(0)
                .position(position)
                .operator(stage)
                .outcome(TraceOutcome.FAILURE)
                .errorCode(error.getErrorCode().getCode())
                .message(error.getMessage()));
    }

    public void notice(AstNode node, int depth, String message) {
        append(TraceEntry.builder()
                .depth(depth)
                .nodeKind(node.getKind())
                .position(node.getPosition())
                .outcome(TraceOutcome.NOTICE)
                .message(message));
    }

    private void append(TraceEntry.TraceEntryBuilder builder) {
        entries.add(builder.sequence(entries.size() + 1).timestamp(clock.instant()).build());
    }

    /** Snapshot of the entries recorded so far. */
    public List<TraceEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean hasFailures() {
        return entries.stream().anyMatch(TraceEntry::isFailure);
    }

    public List<String> structure() {
        return entries.stream().map(TraceEntry::structure).collect(Collectors.toList());
    }

    private static Map<String, String> copyOf(Map<String, String> annotations) {
        return annotations == null || annotations.isEmpty() ? Map.of() : new LinkedHashMap<>(annotations);
    }
}
