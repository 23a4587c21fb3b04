package com.tradepilot.strategy;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.Signal;

/**
 * Result of evaluating one snapshot.
 *
 * @param signal  the signal produced; HOLD unless a rule matched. Null when STALE.
 * @param outcome how the evaluator disposed of it
 * @param state   the mirrored position side the rules were applied to
 */
public record SignalEvaluation(Signal signal, EvaluationOutcome outcome, PositionSide state) {

    public boolean isActionable() {
        return outcome == EvaluationOutcome.ACTIONABLE;
    }
}
