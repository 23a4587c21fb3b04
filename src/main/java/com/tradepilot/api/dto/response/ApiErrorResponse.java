package com.tradepilot.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradepilot.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope returned by {@link com.tradepilot.exception.GlobalExceptionHandler}.
 *
 * <p>{@code code} is the stable machine-readable {@link ErrorCode}; {@code details}
 * carries error-specific data such as risk violations or field validation messages.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiErrorResponse {

    private final boolean success;
    private final String code;
    private final int status;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .success(false)
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
