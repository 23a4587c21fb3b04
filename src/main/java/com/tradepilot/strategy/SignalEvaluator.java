package com.tradepilot.strategy;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.IndicatorSnapshot;
import com.tradepilot.domain.model.Position;
import com.tradepilot.domain.model.Signal;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.risk.PositionRiskTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies the configured {@link StrategyRuleBook} to indicator snapshots and decides
 * whether a signal should be acted on.
 *
 * <p>Per instrument the evaluator keeps:
 * <ul>
 *   <li>the last evaluated snapshot sequence; snapshots at or below it are STALE and
 *       are discarded without touching any other state</li>
 *   <li>the previous snapshot, used by crossing conditions</li>
 *   <li>the time of the last submitted trade, for the entry cooldown</li>
 * </ul>
 *
 * <p>The mirrored position side is read from {@link PositionRiskTracker} at the start
 * of every evaluation, so it reflects every fill applied so far. Calls for one
 * instrument are serialized by its lane; the per-instrument state is still guarded so
 * the REST evaluate endpoint cannot interleave with a scheduled cycle.
 */
@Service
public class SignalEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SignalEvaluator.class);

    private final StrategyRuleBook ruleBook;
    private final PositionRiskTracker positionRiskTracker;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final Duration cooldown;

    private final Map<String, InstrumentState> states = new ConcurrentHashMap<>();

    public SignalEvaluator(
            StrategyRuleBook ruleBook,
            StrategyConfig strategyConfig,
            PositionRiskTracker positionRiskTracker,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.ruleBook = ruleBook;
        this.positionRiskTracker = positionRiskTracker;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.cooldown = Duration.ofSeconds(strategyConfig.getCooldownSeconds());
    }

    /**
     * Evaluates one snapshot. Only an ACTIONABLE result should be passed on to the
     * Order Execution Manager.
     */
    public SignalEvaluation evaluate(IndicatorSnapshot snapshot) {
        String instrumentId = snapshot.getInstrumentId();
        InstrumentState state = states.computeIfAbsent(instrumentId, id -> new InstrumentState());

        synchronized (state) {
            if (snapshot.getSequence() <= state.lastEvaluatedSequence) {
                log.debug(
                        "Stale snapshot discarded: instrument={} seq={} lastEvaluated={}",
                        instrumentId,
                        snapshot.getSequence(),
                        state.lastEvaluatedSequence);
                return new SignalEvaluation(null, EvaluationOutcome.STALE, positionRiskTracker.sideOf(instrumentId));
            }

            Position position = positionRiskTracker.getPosition(instrumentId);
            PositionSide side = position.getSide();
            Instant now = clock.instant();

            SignalEvaluation evaluation = applyRules(snapshot, state.previousSnapshot, position, side, now);

            state.lastEvaluatedSequence = snapshot.getSequence();
            state.previousSnapshot = snapshot;

            if (evaluation.outcome() == EvaluationOutcome.ACTIONABLE
                    && evaluation.signal().type().isEntry()
                    && inCooldown(state, now)) {
                evaluation = new SignalEvaluation(evaluation.signal(), EvaluationOutcome.COOLDOWN, side);
            }

            logOutcome(evaluation);
            return evaluation;
        }
    }

    /** Starts the entry cooldown for the instrument. Called once an order has been submitted. */
    public void recordTrade(String instrumentId, Instant at) {
        InstrumentState state = states.computeIfAbsent(instrumentId, id -> new InstrumentState());
        synchronized (state) {
            state.lastTradeAt = at;
        }
    }

    /** Sequence of the last snapshot evaluated for the instrument, or 0 if none. */
    public long lastEvaluatedSequence(String instrumentId) {
        InstrumentState state = states.get(instrumentId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.lastEvaluatedSequence;
        }
    }

    public StrategyRuleBook getRuleBook() {
        return ruleBook;
    }

    // ==================== Rule evaluation ====================

    private SignalEvaluation applyRules(
            IndicatorSnapshot snapshot,
            IndicatorSnapshot previous,
            Position position,
            PositionSide side,
            Instant now) {
        for (StrategyRule rule : ruleBook.getRules()) {
            if (!rule.appliesTo(side)) {
                continue;
            }
            RuleMatcher.Match match = RuleMatcher.matches(rule, snapshot, previous, position);
            if (match == RuleMatcher.Match.SENTINEL) {
                log.debug(
                        "Sentinel input, holding: instrument={} seq={} rule={}",
                        snapshot.getInstrumentId(),
                        snapshot.getSequence(),
                        rule.getName());
                return new SignalEvaluation(Signal.hold(snapshot, now), EvaluationOutcome.SENTINEL, side);
            }
            if (match == RuleMatcher.Match.MET) {
                Signal signal = new Signal(
                        snapshot.getInstrumentId(), rule.getSignal(), snapshot.getSequence(), snapshot, rule.getName(), now);
                if (rule.getSignal() == SignalType.HOLD) {
                    return new SignalEvaluation(signal, EvaluationOutcome.HOLD, side);
                }
                EvaluationOutcome outcome = rule.getSignal().isPermittedFrom(side)
                        ? EvaluationOutcome.ACTIONABLE
                        : EvaluationOutcome.SUPPRESSED;
                return new SignalEvaluation(signal, outcome, side);
            }
        }
        return new SignalEvaluation(Signal.hold(snapshot, now), EvaluationOutcome.HOLD, side);
    }

    private boolean inCooldown(InstrumentState state, Instant now) {
        return state.lastTradeAt != null && now.isBefore(state.lastTradeAt.plus(cooldown));
    }

    private void logOutcome(SignalEvaluation evaluation) {
        Signal signal = evaluation.signal();
        switch (evaluation.outcome()) {
            case HOLD, SENTINEL -> log.debug(
                    "No action: instrument={} seq={} outcome={}",
                    signal.instrumentId(),
                    signal.sequence(),
                    evaluation.outcome());
            default -> {
                log.info(
                        "Signal {}: instrument={} seq={} type={} rule={} state={}",
                        evaluation.outcome(),
                        signal.instrumentId(),
                        signal.sequence(),
                        signal.type(),
                        signal.ruleName(),
                        evaluation.state());
                Map<String, Object> context = new HashMap<>();
                context.put("sequence", signal.sequence());
                context.put("signal", signal.type().name());
                context.put("rule", signal.ruleName());
                context.put("state", evaluation.state().name());
                context.put("outcome", evaluation.outcome().name());
                eventPublisherHelper.publishDecision(
                        this,
                        "SIGNAL",
                        signal.type() + " via " + signal.ruleName() + " -> " + evaluation.outcome(),
                        signal.instrumentId(),
                        context);
            }
        }
    }

    private static final class InstrumentState {
        private long lastEvaluatedSequence;
        private IndicatorSnapshot previousSnapshot;
        private Instant lastTradeAt;
    }
}
