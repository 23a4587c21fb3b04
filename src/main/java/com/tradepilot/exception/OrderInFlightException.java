package com.tradepilot.exception;

import java.util.Map;

/**
 * The instrument already has an order that is pending, acknowledged, partially filled
 * or awaiting reconciliation. A second order would break the single-open-order rule.
 */
public class OrderInFlightException extends BaseException {

    public OrderInFlightException(String instrumentId, String idempotencyKey) {
        super(
                ErrorCode.ORDER_IN_FLIGHT,
                "Order already in flight for " + instrumentId + ": key=" + idempotencyKey,
                Map.of("instrumentId", instrumentId, "idempotencyKey", idempotencyKey));
    }
}
