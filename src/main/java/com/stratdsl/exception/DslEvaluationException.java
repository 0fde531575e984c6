package com.stratdsl.exception;

import com.stratdsl.ast.SourcePosition;

/**
 * Failure while evaluating a parsed strategy.
 *
 * <p>Operators usually throw without knowing where they were called from; the evaluator
 * attaches the position of the node being evaluated via {@link #attachPosition} before the
 * exception leaves that node. Once set, the position is never overwritten, so the innermost
 * failing node wins.
 */
public class DslEvaluationException extends BaseException {

    private SourcePosition position;

    public DslEvaluationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public DslEvaluationException(ErrorCode errorCode, String message, SourcePosition position) {
        super(errorCode, message);
        this.position = position;
    }

    public DslEvaluationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static DslEvaluationException typeMismatch(String operator, String expected, Object actual) {
        return new DslEvaluationException(
                ErrorCode.TYPE_MISMATCH, String.format("%s expects %s but got %s", operator, expected, actual));
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position != null;
    }

    public DslEvaluationException attachPosition(SourcePosition nodePosition) {
        if (this.position == null) {
            this.position = nodePosition;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return position == null ? message : message + " at " + position;
    }
}
