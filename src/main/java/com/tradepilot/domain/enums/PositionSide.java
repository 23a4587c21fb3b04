package com.tradepilot.domain.enums;

/**
 * Direction of a position. FLAT always carries a size of zero.
 *
 * <p>The Signal Evaluator uses the same three values as its per-instrument state,
 * mirrored read-only from the Position &amp; Risk Tracker.
 */
public enum PositionSide {
    FLAT,
    LONG,
    SHORT;

    /** The side an order must take to open or grow a position in this direction. */
    public OrderSide entrySide() {
        return switch (this) {
            case LONG -> OrderSide.BUY;
            case SHORT -> OrderSide.SELL;
            case FLAT -> throw new IllegalStateException("FLAT has no entry side");
        };
    }

    /** The side an order must take to reduce or close a position in this direction. */
    public OrderSide exitSide() {
        return entrySide().opposite();
    }
}
