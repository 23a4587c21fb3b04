package com.tradepilot.engine;

import com.tradepilot.domain.model.Order;
import com.tradepilot.strategy.EvaluationOutcome;
import com.tradepilot.strategy.SignalEvaluation;

/**
 * What one trading cycle did for an instrument.
 *
 * @param instrumentId  the instrument
 * @param barsAppended  new bars accepted into the cache
 * @param evaluation    the evaluator's result; null if the cycle did not reach evaluation
 * @param order         the order submitted for an actionable signal, if any
 * @param error         message of the error that ended the cycle early, if any
 */
public record CycleResult(
        String instrumentId, int barsAppended, SignalEvaluation evaluation, Order order, String error) {

    public static CycleResult skipped(String instrumentId, int barsAppended) {
        return new CycleResult(instrumentId, barsAppended, null, null, null);
    }

    public static CycleResult failed(String instrumentId, int barsAppended, SignalEvaluation evaluation, String error) {
        return new CycleResult(instrumentId, barsAppended, evaluation, null, error);
    }

    public EvaluationOutcome outcome() {
        return evaluation != null ? evaluation.outcome() : null;
    }

    public boolean isSuccessful() {
        return error == null;
    }
}
