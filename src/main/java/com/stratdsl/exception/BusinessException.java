package com.stratdsl.exception;

import java.util.Map;

/**
 * Rejected request that never reached the interpreter, e.g. a REST call naming neither
 * an inline source nor a strategy file.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
