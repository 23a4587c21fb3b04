package com.tradepilot.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The exchange rejected the order (insufficient margin, invalid size). Terminal for
 * the signal and never retried.
 */
@Getter
public class OrderRejectedException extends BaseException {

    private final String idempotencyKey;

    public OrderRejectedException(String instrumentId, String idempotencyKey, String reason) {
        super(
                ErrorCode.ORDER_REJECTED,
                "Order rejected by exchange for " + instrumentId + ": " + reason,
                Map.of("instrumentId", instrumentId, "idempotencyKey", idempotencyKey, "reason", String.valueOf(reason)));
        this.idempotencyKey = idempotencyKey;
    }
}
