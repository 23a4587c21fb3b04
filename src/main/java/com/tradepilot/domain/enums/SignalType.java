package com.tradepilot.domain.enums;

/**
 * Decision produced by one evaluation cycle of the strategy.
 *
 * <p>Only ENTER_LONG and ENTER_SHORT from FLAT, and EXIT from LONG or SHORT, are
 * transitions the evaluator hands to the Order Execution Manager. HOLD never is.
 */
public enum SignalType {
    ENTER_LONG,
    ENTER_SHORT,
    EXIT,
    HOLD;

    /** Whether this signal is a permitted transition from the given position side. */
    public boolean isPermittedFrom(PositionSide side) {
        return switch (this) {
            case ENTER_LONG, ENTER_SHORT -> side == PositionSide.FLAT;
            case EXIT -> side != PositionSide.FLAT;
            case HOLD -> false;
        };
    }

    public boolean isEntry() {
        return this == ENTER_LONG || this == ENTER_SHORT;
    }
}
