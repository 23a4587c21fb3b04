package com.tradepilot.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Pre-trade authorization denied an order. */
    ORDER_DENIED,

    /** An order's exchange state could not be confirmed; exposure is uncertain until reconciled. */
    UNCONFIRMED_ORDER
}
