package com.tradepilot.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single limit breach found during {@link PositionRiskTracker#authorize}.
 *
 * <p>The code is machine-readable (POSITION_SIZE_EXCEEDED, TOTAL_NOTIONAL_EXCEEDED, ...);
 * the message is for the operator. All violations are collected, not just the first.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String POSITION_SIZE_EXCEEDED = "POSITION_SIZE_EXCEEDED";
    public static final String INSTRUMENT_NOTIONAL_EXCEEDED = "INSTRUMENT_NOTIONAL_EXCEEDED";
    public static final String MAX_OPEN_POSITIONS_REACHED = "MAX_OPEN_POSITIONS_REACHED";
    public static final String TOTAL_NOTIONAL_EXCEEDED = "TOTAL_NOTIONAL_EXCEEDED";
    public static final String INVALID_ORDER_SIZE = "INVALID_ORDER_SIZE";

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
