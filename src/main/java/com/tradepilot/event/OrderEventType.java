package com.tradepilot.event;

/**
 * Classifies the order state change carried by an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** Order stored as PENDING and handed to the exchange. */
    SUBMITTED,

    /** Exchange acknowledged the order. */
    ACKED,

    /** Some but not all of the size executed. */
    PARTIALLY_FILLED,

    /** All requested size executed. */
    FILLED,

    /** Exchange rejected the order. Terminal. */
    REJECTED,

    /** Order cancelled. Terminal. */
    CANCELLED,

    /** Submission could not be confirmed after all retries; needs operator reconciliation. */
    UNKNOWN,

    /** Operator resolved an UNKNOWN order into a terminal state. */
    RESOLVED
}
