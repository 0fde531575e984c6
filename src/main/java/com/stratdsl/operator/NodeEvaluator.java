package com.stratdsl.operator;

import com.stratdsl.ast.AstNode;
import com.stratdsl.domain.value.DslValue;

@FunctionalInterface
public interface NodeEvaluator {

    DslValue evaluate(AstNode node);
}
