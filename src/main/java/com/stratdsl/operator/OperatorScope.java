package com.stratdsl.operator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.ast.ListNode;
import com.stratdsl.domain.value.DslValue;
import com.stratdsl.evaluator.EvaluationContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handle given to a {@link LazyOperator} for one call: evaluates child nodes on demand, exposes
 * the context and registry, and collects annotations for the call's trace entry.
 */
public class OperatorScope {

    private final NodeEvaluator nodeEvaluator;
    private final EvaluationContext context;
    private final OperatorRegistry registry;
    private final ListNode call;
    private final Map<String, String> annotations = new LinkedHashMap<>();

    public OperatorScope(NodeEvaluator nodeEvaluator, EvaluationContext context, OperatorRegistry registry, ListNode call) {
        this.nodeEvaluator = nodeEvaluator;
        this.context = context;
        this.registry = registry;
        this.call = call;
    }

    public DslValue evaluate(AstNode node) {
        return nodeEvaluator.evaluate(node);
    }

    public EvaluationContext context() {
        return context;
    }

    public OperatorRegistry registry() {
        return registry;
    }

    public ListNode call() {
        return call;
    }

    public void annotate(String key, String value) {
        annotations.put(key, value);
    }

    public Map<String, String> annotations() {
        return Collections.unmodifiableMap(annotations);
    }
}
