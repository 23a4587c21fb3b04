package com.tradepilot.exchange;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The exchange's answer to a placement: accepted with an exchange order id, or
 * rejected with a reason.
 */
@Getter
@ToString
@Builder
public class ExchangeResponse {

    private final boolean accepted;

    /** Exchange-assigned order ID. Null if rejected. */
    private final String exchangeOrderId;

    /** Null if accepted. */
    private final String rejectionReason;

    public static ExchangeResponse accepted(String exchangeOrderId) {
        return ExchangeResponse.builder().accepted(true).exchangeOrderId(exchangeOrderId).build();
    }

    public static ExchangeResponse rejected(String reason) {
        return ExchangeResponse.builder().accepted(false).rejectionReason(reason).build();
    }
}
