package com.stratdsl.api.dto.response;

import com.stratdsl.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned by the REST layer for requests rejected before reaching the engine.
 */
@Getter
@Builder
public class ApiErrorResponse {

    private final String code;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
