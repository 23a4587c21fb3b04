package com.tradepilot.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an order.
 *
 * <p>Transitions are monotonic: an order never returns to an earlier state.
 * <ul>
 *   <li>PENDING: stored locally, submission to the exchange in progress</li>
 *   <li>ACKED: accepted by the exchange, no fills yet</li>
 *   <li>PARTIALLY_FILLED: some but not all of the size has executed</li>
 *   <li>FILLED, REJECTED, CANCELLED: terminal</li>
 *   <li>UNKNOWN: the exchange outcome could not be confirmed after all retries;
 *       surfaced for operator reconciliation and resolved by a late exchange event
 *       or by the operator</li>
 * </ul>
 */
public enum OrderStatus {
    PENDING,
    ACKED,
    PARTIALLY_FILLED,
    FILLED,
    REJECTED,
    CANCELLED,
    UNKNOWN;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(FILLED, REJECTED, CANCELLED);

    /** States that occupy the single open-order slot of an instrument. */
    private static final Set<OrderStatus> IN_FLIGHT = EnumSet.of(PENDING, ACKED, PARTIALLY_FILLED, UNKNOWN);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    /** Returns true if moving from this status to {@code next} keeps the lifecycle monotonic. */
    public boolean canTransitionTo(OrderStatus next) {
        if (next == this) {
            return next == PARTIALLY_FILLED;
        }
        return switch (this) {
            case PENDING -> true;
            case ACKED -> next == PARTIALLY_FILLED || next == FILLED || next == CANCELLED;
            case PARTIALLY_FILLED -> next == FILLED || next == CANCELLED;
            case UNKNOWN -> next != PENDING;
            case FILLED, REJECTED, CANCELLED -> false;
        };
    }
}
