package com.tradepilot.strategy;

import static com.tradepilot.strategy.ConditionOperator.GT;
import static com.tradepilot.strategy.ConditionOperator.LT;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.indicator.IndicatorDefinition;
import com.tradepilot.indicator.IndicatorFactory;
import com.tradepilot.indicator.IndicatorType;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Built-in rule sets, selected with {@code tradepilot.strategy.preset}.
 *
 * <p>Each preset lists its rules in priority order and the indicators those rules read,
 * so the configured indicator set can be checked against it at startup.
 */
public enum StrategyPreset {

    /**
     * Trend filter with RSI pullback entries. Long when price is above SMA(20) but
     * RSI(14) is oversold, short on the mirror image. Exits on a 3% stop, a 6% target,
     * or RSI reaching the opposite extreme.
     */
    TREND_RSI {
        @Override
        public List<StrategyRule> rules() {
            String price = IndicatorFactory.ltpKey();
            String sma = key(IndicatorType.SMA, 20);
            String rsi = key(IndicatorType.RSI, 14);
            return List.of(
                    rule("long-stop-loss", SignalType.EXIT, PositionSide.LONG, RuleCondition.stopLossPct(3.0)),
                    rule("long-take-profit", SignalType.EXIT, PositionSide.LONG, RuleCondition.takeProfitPct(6.0)),
                    rule("long-rsi-exit", SignalType.EXIT, PositionSide.LONG, RuleCondition.compare(rsi, GT, 70.0)),
                    rule("short-stop-loss", SignalType.EXIT, PositionSide.SHORT, RuleCondition.stopLossPct(3.0)),
                    rule("short-take-profit", SignalType.EXIT, PositionSide.SHORT, RuleCondition.takeProfitPct(6.0)),
                    rule("short-rsi-exit", SignalType.EXIT, PositionSide.SHORT, RuleCondition.compare(rsi, LT, 30.0)),
                    rule(
                            "trend-rsi-long",
                            SignalType.ENTER_LONG,
                            PositionSide.FLAT,
                            RuleCondition.compare(price, GT, sma),
                            RuleCondition.compare(rsi, LT, 30.0)),
                    rule(
                            "trend-rsi-short",
                            SignalType.ENTER_SHORT,
                            PositionSide.FLAT,
                            RuleCondition.compare(price, LT, sma),
                            RuleCondition.compare(rsi, GT, 70.0)));
        }

        @Override
        public List<IndicatorDefinition> indicators() {
            return List.of(
                    IndicatorDefinition.of(IndicatorType.SMA, 20),
                    IndicatorDefinition.of(IndicatorType.RSI, 14),
                    IndicatorDefinition.of(IndicatorType.LTP, Map.of()));
        }
    },

    /** Fast SMA(10) crossing slow SMA(20); the opposite cross exits. */
    SMA_CROSSOVER {
        @Override
        public List<StrategyRule> rules() {
            String fast = key(IndicatorType.SMA, 10);
            String slow = key(IndicatorType.SMA, 20);
            return List.of(
                    rule("long-cross-exit", SignalType.EXIT, PositionSide.LONG, RuleCondition.crossesBelow(fast, slow)),
                    rule("short-cross-exit", SignalType.EXIT, PositionSide.SHORT, RuleCondition.crossesAbove(fast, slow)),
                    rule("golden-cross", SignalType.ENTER_LONG, PositionSide.FLAT, RuleCondition.crossesAbove(fast, slow)),
                    rule("death-cross", SignalType.ENTER_SHORT, PositionSide.FLAT, RuleCondition.crossesBelow(fast, slow)));
        }

        @Override
        public List<IndicatorDefinition> indicators() {
            return List.of(IndicatorDefinition.of(IndicatorType.SMA, 10), IndicatorDefinition.of(IndicatorType.SMA, 20));
        }
    },

    /**
     * SMA(5)/SMA(10) trend filter with a MACD(12,26,9) signal-line cross as trigger and
     * RSI(14) as an overbought/oversold guard. The opposite MACD cross exits.
     */
    MACD_TREND {
        @Override
        public List<StrategyRule> rules() {
            String fast = key(IndicatorType.SMA, 5);
            String slow = key(IndicatorType.SMA, 10);
            String rsi = key(IndicatorType.RSI, 14);
            String macd = IndicatorFactory.buildKey(IndicatorType.MACD, 12, "value");
            String signal = IndicatorFactory.buildKey(IndicatorType.MACD, 12, "signal");
            return List.of(
                    rule("long-macd-exit", SignalType.EXIT, PositionSide.LONG, RuleCondition.crossesBelow(macd, signal)),
                    rule("short-macd-exit", SignalType.EXIT, PositionSide.SHORT, RuleCondition.crossesAbove(macd, signal)),
                    rule(
                            "macd-trend-long",
                            SignalType.ENTER_LONG,
                            PositionSide.FLAT,
                            RuleCondition.compare(fast, GT, slow),
                            RuleCondition.crossesAbove(macd, signal),
                            RuleCondition.compare(rsi, LT, 70.0)),
                    rule(
                            "macd-trend-short",
                            SignalType.ENTER_SHORT,
                            PositionSide.FLAT,
                            RuleCondition.compare(fast, LT, slow),
                            RuleCondition.crossesBelow(macd, signal),
                            RuleCondition.compare(rsi, GT, 30.0)));
        }

        @Override
        public List<IndicatorDefinition> indicators() {
            return List.of(
                    IndicatorDefinition.of(IndicatorType.SMA, 5),
                    IndicatorDefinition.of(IndicatorType.SMA, 10),
                    IndicatorDefinition.of(IndicatorType.RSI, 14),
                    IndicatorDefinition.of(
                            IndicatorType.MACD, Map.of("shortPeriod", 12, "longPeriod", 26, "signalPeriod", 9)));
        }
    };

    /** Rules in priority order. */
    public abstract List<StrategyRule> rules();

    /** Indicators the rules read. */
    public abstract List<IndicatorDefinition> indicators();

    private static String key(IndicatorType type, int period) {
        return IndicatorFactory.buildKey(type, period, null);
    }

    private static StrategyRule rule(String name, SignalType signal, PositionSide side, RuleCondition... conditions) {
        return StrategyRule.builder()
                .name(name)
                .signal(signal)
                .appliesTo(EnumSet.of(side))
                .conditions(List.of(conditions))
                .build();
    }
}
