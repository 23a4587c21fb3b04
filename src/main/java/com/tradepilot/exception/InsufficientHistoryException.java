package com.tradepilot.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Fewer bars are cached than the indicator lookback requires. Recoverable: the
 * cycle is skipped and retried on the next tick.
 */
@Getter
public class InsufficientHistoryException extends BaseException {

    private final String instrumentId;
    private final int required;
    private final int available;

    public InsufficientHistoryException(String instrumentId, int required, int available) {
        super(
                ErrorCode.INSUFFICIENT_HISTORY,
                String.format("Insufficient history for %s: required=%d available=%d", instrumentId, required, available),
                Map.of("instrumentId", instrumentId, "required", required, "available", available));
        this.instrumentId = instrumentId;
        this.required = required;
        this.available = available;
    }
}
