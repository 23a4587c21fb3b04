package com.tradepilot.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope applied to every {@code /api} body by
 * {@link com.tradepilot.config.ApiResponseAdvice}. Collections also carry their size.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data, Integer count, Instant timestamp) {
        this.data = data;
        this.count = count;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> collection ? collection.size() : null;
        return new ApiResponse<>(data, count, Instant.now());
    }
}
