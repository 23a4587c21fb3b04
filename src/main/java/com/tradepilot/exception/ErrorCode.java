package com.tradepilot.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    ORDER_IN_FLIGHT("ORDER_IN_FLIGHT", 409),
    INVALID_ORDER_STATE("INVALID_ORDER_STATE", 409),
    INSUFFICIENT_HISTORY("INSUFFICIENT_HISTORY", 422),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),
    ORDER_REJECTED("ORDER_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    ENGINE_UNAVAILABLE("ENGINE_UNAVAILABLE", 503),
    EXCHANGE_TIMEOUT("EXCHANGE_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
