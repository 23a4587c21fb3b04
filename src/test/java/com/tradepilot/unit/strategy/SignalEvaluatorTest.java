package com.tradepilot.unit.strategy;

import static com.tradepilot.support.TestInstruments.BTC;
import static com.tradepilot.support.TestInstruments.ETH;
import static com.tradepilot.support.TestInstruments.fill;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.IndicatorSnapshot;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.risk.RiskLimits;
import com.tradepilot.strategy.EvaluationOutcome;
import com.tradepilot.strategy.RuleCondition;
import com.tradepilot.strategy.SignalEvaluation;
import com.tradepilot.strategy.SignalEvaluator;
import com.tradepilot.strategy.StrategyConfig;
import com.tradepilot.strategy.StrategyRule;
import com.tradepilot.strategy.StrategyRuleBook;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SignalEvaluator: rule matching, the transition gate, the stale guard,
 * sentinel handling and the entry cooldown.
 */
class SignalEvaluatorTest {

    private static final Instant NOW = Instant.parse("2025-01-06T10:00:00Z");
    private static final String FAST = "SMA:5";
    private static final String SLOW = "SMA:10";
    private static final String LTP = "LTP:0";

    private EventPublisherHelper eventPublisherHelper;
    private PositionRiskTracker positionRiskTracker;
    private SignalEvaluator evaluator;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = mock(EventPublisherHelper.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        positionRiskTracker = new PositionRiskTracker(RiskLimits.builder().build(), eventPublisherHelper, clock);

        // the entry rule applies in every state so the transition gate is exercised
        StrategyRuleBook ruleBook = new StrategyRuleBook(
                "TEST",
                List.of(
                        StrategyRule.builder()
                                .name("long-stop")
                                .signal(SignalType.EXIT)
                                .appliesTo(EnumSet.of(PositionSide.LONG))
                                .conditions(List.of(RuleCondition.stopLossPct(3.0)))
                                .build(),
                        StrategyRule.builder()
                                .name("golden-cross")
                                .signal(SignalType.ENTER_LONG)
                                .conditions(List.of(RuleCondition.crossesAbove(FAST, SLOW)))
                                .build()));

        StrategyConfig strategyConfig = new StrategyConfig();
        strategyConfig.setCooldownSeconds(300);
        evaluator = new SignalEvaluator(ruleBook, strategyConfig, positionRiskTracker, eventPublisherHelper, clock);
    }

    @Nested
    @DisplayName("Crossing rules")
    class Crossing {

        @Test
        @DisplayName("Fast SMA crossing above slow at seq 5 while FLAT is an actionable ENTER_LONG")
        void crossoverFromFlat() {
            evaluator.evaluate(snapshot(BTC, 4, 9.0, 10.0, 100.0));

            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 5, 11.0, 10.0, 100.0));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.ACTIONABLE);
            assertThat(evaluation.signal().type()).isEqualTo(SignalType.ENTER_LONG);
            assertThat(evaluation.signal().sequence()).isEqualTo(5);
            assertThat(evaluation.signal().ruleName()).isEqualTo("golden-cross");
            assertThat(evaluation.state()).isEqualTo(PositionSide.FLAT);
            verify(eventPublisherHelper).publishDecision(eq(evaluator), eq("SIGNAL"), anyString(), eq(BTC), anyMap());
        }

        @Test
        @DisplayName("Without a previous snapshot no crossing can be detected")
        void firstSnapshotHolds() {
            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 1, 11.0, 10.0, 100.0));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.HOLD);
            assertThat(evaluation.signal().type()).isEqualTo(SignalType.HOLD);
        }

        @Test
        @DisplayName("Staying above is not a new crossing")
        void stayingAboveHolds() {
            evaluator.evaluate(snapshot(BTC, 1, 11.0, 10.0, 100.0));

            assertThat(evaluator.evaluate(snapshot(BTC, 2, 12.0, 10.0, 100.0)).outcome())
                    .isEqualTo(EvaluationOutcome.HOLD);
        }

        @Test
        @DisplayName("Previous snapshots are tracked per instrument")
        void perInstrumentHistory() {
            evaluator.evaluate(snapshot(BTC, 1, 9.0, 10.0, 100.0));

            // ETH has no previous snapshot of its own
            assertThat(evaluator.evaluate(snapshot(ETH, 2, 11.0, 10.0, 100.0)).outcome())
                    .isEqualTo(EvaluationOutcome.HOLD);
        }
    }

    @Nested
    @DisplayName("Transition gate")
    class TransitionGate {

        @Test
        @DisplayName("ENTER_LONG while already LONG is suppressed")
        void enterWhileLongSuppressed() {
            positionRiskTracker.apply(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"));
            evaluator.evaluate(snapshot(BTC, 4, 9.0, 10.0, 100.0));

            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 5, 11.0, 10.0, 100.0));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.SUPPRESSED);
            assertThat(evaluation.isActionable()).isFalse();
            assertThat(evaluation.state()).isEqualTo(PositionSide.LONG);
        }

        @Test
        @DisplayName("Stop loss from LONG emits an actionable EXIT")
        void stopLossExit() {
            positionRiskTracker.apply(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"));

            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 1, 10.0, 10.0, 96.5));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.ACTIONABLE);
            assertThat(evaluation.signal().type()).isEqualTo(SignalType.EXIT);
            assertThat(evaluation.signal().ruleName()).isEqualTo("long-stop");
        }

        @Test
        @DisplayName("Price above the stop level holds")
        void aboveStopHolds() {
            positionRiskTracker.apply(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"));

            assertThat(evaluator.evaluate(snapshot(BTC, 1, 10.0, 10.0, 97.5)).outcome())
                    .isEqualTo(EvaluationOutcome.HOLD);
        }
    }

    @Nested
    @DisplayName("Stale guard")
    class StaleGuard {

        @Test
        @DisplayName("A snapshot at or below the last evaluated sequence is discarded")
        void staleDiscarded() {
            evaluator.evaluate(snapshot(BTC, 4, 9.0, 10.0, 100.0));
            evaluator.evaluate(snapshot(BTC, 5, 9.5, 10.0, 100.0));

            SignalEvaluation replay = evaluator.evaluate(snapshot(BTC, 5, 11.0, 10.0, 100.0));
            SignalEvaluation older = evaluator.evaluate(snapshot(BTC, 3, 11.0, 10.0, 100.0));

            assertThat(replay.outcome()).isEqualTo(EvaluationOutcome.STALE);
            assertThat(replay.signal()).isNull();
            assertThat(older.outcome()).isEqualTo(EvaluationOutcome.STALE);
            assertThat(evaluator.lastEvaluatedSequence(BTC)).isEqualTo(5);
        }

        @Test
        @DisplayName("A stale snapshot does not replace the previous snapshot used for crossings")
        void staleDoesNotTouchState() {
            evaluator.evaluate(snapshot(BTC, 5, 9.0, 10.0, 100.0));
            evaluator.evaluate(snapshot(BTC, 2, 12.0, 10.0, 100.0));

            // still crossing relative to seq 5
            assertThat(evaluator.evaluate(snapshot(BTC, 6, 11.0, 10.0, 100.0)).outcome())
                    .isEqualTo(EvaluationOutcome.ACTIONABLE);
        }

        @Test
        @DisplayName("Unknown instrument reports sequence 0")
        void unknownInstrument() {
            assertThat(evaluator.lastEvaluatedSequence("XRP-USDT")).isZero();
        }
    }

    @Nested
    @DisplayName("Sentinel values")
    class Sentinels {

        @Test
        @DisplayName("A NaN input holds and publishes nothing")
        void nanHolds() {
            evaluator.evaluate(snapshot(BTC, 1, 9.0, 10.0, 100.0));

            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 2, Double.NaN, 10.0, 100.0));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.SENTINEL);
            assertThat(evaluation.signal().type()).isEqualTo(SignalType.HOLD);
            verify(eventPublisherHelper, never())
                    .publishDecision(any(), anyString(), anyString(), anyString(), anyMap());
        }

        @Test
        @DisplayName("A sentinel snapshot still advances the sequence")
        void sentinelAdvancesSequence() {
            evaluator.evaluate(snapshot(BTC, 7, Double.NaN, 10.0, 100.0));

            assertThat(evaluator.lastEvaluatedSequence(BTC)).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Cooldown")
    class Cooldown {

        @Test
        @DisplayName("An entry within the cooldown after a trade is held back")
        void entryInCooldown() {
            evaluator.recordTrade(BTC, NOW.minusSeconds(60));
            evaluator.evaluate(snapshot(BTC, 1, 9.0, 10.0, 100.0));

            SignalEvaluation evaluation = evaluator.evaluate(snapshot(BTC, 2, 11.0, 10.0, 100.0));

            assertThat(evaluation.outcome()).isEqualTo(EvaluationOutcome.COOLDOWN);
            assertThat(evaluation.signal().type()).isEqualTo(SignalType.ENTER_LONG);
        }

        @Test
        @DisplayName("Once the cooldown has elapsed entries are actionable again")
        void cooldownElapsed() {
            evaluator.recordTrade(BTC, NOW.minusSeconds(301));
            evaluator.evaluate(snapshot(BTC, 1, 9.0, 10.0, 100.0));

            assertThat(evaluator.evaluate(snapshot(BTC, 2, 11.0, 10.0, 100.0)).outcome())
                    .isEqualTo(EvaluationOutcome.ACTIONABLE);
        }

        @Test
        @DisplayName("Exits are never held back by the cooldown")
        void exitIgnoresCooldown() {
            positionRiskTracker.apply(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"));
            evaluator.recordTrade(BTC, NOW.minusSeconds(10));

            assertThat(evaluator.evaluate(snapshot(BTC, 1, 10.0, 10.0, 90.0)).outcome())
                    .isEqualTo(EvaluationOutcome.ACTIONABLE);
        }
    }

    private static IndicatorSnapshot snapshot(String instrumentId, long sequence, double fast, double slow, double ltp) {
        Map<String, Double> values = new java.util.HashMap<>();
        values.put(FAST, fast);
        values.put(SLOW, slow);
        values.put(LTP, ltp);
        return new IndicatorSnapshot(instrumentId, sequence, NOW.minusSeconds(60), values);
    }
}
