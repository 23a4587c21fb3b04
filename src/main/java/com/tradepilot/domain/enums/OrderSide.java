package com.tradepilot.domain.enums;

/** Buy or sell side of an order. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for exit orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
