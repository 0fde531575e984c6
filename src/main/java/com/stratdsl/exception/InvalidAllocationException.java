package com.stratdsl.exception;

import java.util.Map;

/**
 * The evaluated strategy result cannot be turned into a normalized allocation: a scalar
 * result, an unsupported value kind, a negative weight or a zero total.
 */
public class InvalidAllocationException extends BaseException {

    public InvalidAllocationException(String message) {
        super(ErrorCode.INVALID_ALLOCATION, message);
    }

    public InvalidAllocationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_ALLOCATION, message, details);
    }
}
