package com.stratdsl.exception;

import com.stratdsl.ast.SourcePosition;

public class UnknownOperatorException extends DslEvaluationException {

    private final String operatorName;

    public UnknownOperatorException(String operatorName) {
        super(ErrorCode.UNKNOWN_OPERATOR, "Unknown operator: " + operatorName);
        this.operatorName = operatorName;
    }

    public UnknownOperatorException(String operatorName, SourcePosition position) {
        super(ErrorCode.UNKNOWN_OPERATOR, "Unknown operator: " + operatorName, position);
        this.operatorName = operatorName;
    }

    public String getOperatorName() {
        return operatorName;
    }
}
