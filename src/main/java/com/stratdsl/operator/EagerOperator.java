package com.stratdsl.operator;

import com.stratdsl.domain.value.DslValue;
import com.stratdsl.evaluator.EvaluationContext;
import java.util.List;

/**
 * Operator receiving its arguments already evaluated, left to right.
 */
@FunctionalInterface
public interface EagerOperator {

    DslValue apply(List<DslValue> args, EvaluationContext context);
}
