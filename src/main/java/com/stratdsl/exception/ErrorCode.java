package com.stratdsl.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    PARSE_ERROR("PARSE_ERROR", 400),
    NOT_FOUND("NOT_FOUND", 404),
    UNKNOWN_OPERATOR("UNKNOWN_OPERATOR", 422),
    ARITY_MISMATCH("ARITY_MISMATCH", 422),
    TYPE_MISMATCH("TYPE_MISMATCH", 422),
    EVALUATION_ERROR("EVALUATION_ERROR", 422),
    INVALID_ALLOCATION("INVALID_ALLOCATION", 422),
    BUDGET_EXCEEDED("BUDGET_EXCEEDED", 422),
    INDICATOR_UNAVAILABLE("INDICATOR_UNAVAILABLE", 424),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
