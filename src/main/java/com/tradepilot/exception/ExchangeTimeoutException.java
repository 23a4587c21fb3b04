package com.tradepilot.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The exchange never confirmed the submission within the retry bound. The order has
 * been moved to UNKNOWN and waits for operator reconciliation.
 */
@Getter
public class ExchangeTimeoutException extends BaseException {

    private final String idempotencyKey;

    public ExchangeTimeoutException(String instrumentId, String idempotencyKey, int attempts) {
        super(
                ErrorCode.EXCHANGE_TIMEOUT,
                String.format(
                        "Exchange did not confirm order for %s after %d attempts: key=%s",
                        instrumentId, attempts, idempotencyKey),
                Map.of("instrumentId", instrumentId, "idempotencyKey", idempotencyKey, "attempts", attempts));
        this.idempotencyKey = idempotencyKey;
    }
}
