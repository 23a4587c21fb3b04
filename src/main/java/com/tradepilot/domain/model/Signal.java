package com.tradepilot.domain.model;

import com.tradepilot.domain.enums.SignalType;
import java.time.Instant;

/**
 * The strategy's decision for one evaluation cycle.
 *
 * @param instrumentId the instrument evaluated
 * @param type         the decision
 * @param sequence     sequence of the snapshot that produced it; also the idempotency seed
 * @param snapshot     the snapshot the rules were applied to
 * @param ruleName     name of the rule that fired, or null for HOLD
 * @param createdAt    evaluation time
 */
public record Signal(
        String instrumentId,
        SignalType type,
        long sequence,
        IndicatorSnapshot snapshot,
        String ruleName,
        Instant createdAt) {

    public static Signal hold(IndicatorSnapshot snapshot, Instant createdAt) {
        return new Signal(snapshot.getInstrumentId(), SignalType.HOLD, snapshot.getSequence(), snapshot, null, createdAt);
    }
}
