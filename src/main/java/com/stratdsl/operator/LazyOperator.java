package com.stratdsl.operator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.domain.value.DslValue;
import java.util.List;

/**
 * Operator receiving its arguments unevaluated. It decides which of them to evaluate, and in
 * what order, through {@link OperatorScope#evaluate(AstNode)}.
 */
@FunctionalInterface
public interface LazyOperator {

    DslValue apply(List<AstNode> args, OperatorScope scope);
}
