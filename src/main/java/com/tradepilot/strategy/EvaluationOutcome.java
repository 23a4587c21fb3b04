package com.tradepilot.strategy;

/** What the {@link SignalEvaluator} did with one snapshot. */
public enum EvaluationOutcome {

    /** Snapshot sequence not newer than the last evaluated one; discarded without evaluation. */
    STALE,

    /** No rule matched. */
    HOLD,

    /** A rule read a NaN indicator value; treated as HOLD. */
    SENTINEL,

    /** A rule matched but the mirrored state does not permit the transition. */
    SUPPRESSED,

    /** An entry matched inside the trade cooldown window. */
    COOLDOWN,

    /** A rule matched and the signal should go to the Order Execution Manager. */
    ACTIONABLE
}
