package com.tradepilot.strategy;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.IndicatorSnapshot;
import com.tradepilot.domain.model.Position;

/**
 * Pure evaluation of {@link RuleCondition}s against a snapshot, the previous snapshot
 * of the same instrument and the current position.
 *
 * <p>Crossings follow the usual convention: CROSSES_ABOVE holds when the indicator was
 * below the reference on the previous snapshot and is at or above it now. Without a
 * previous snapshot, or with NaN values in it, no crossing is reported.
 */
final class RuleMatcher {

    /** Result of one condition. SENTINEL means a current input was NaN. */
    enum Match {
        MET,
        NOT_MET,
        SENTINEL
    }

    private RuleMatcher() {}

    /** Evaluates all conditions of a rule (AND). A sentinel input short-circuits. */
    static Match matches(StrategyRule rule, IndicatorSnapshot current, IndicatorSnapshot previous, Position position) {
        if (current.anySentinel(rule.inputKeys())) {
            return Match.SENTINEL;
        }
        for (RuleCondition condition : rule.getConditions()) {
            if (!holds(condition, current, previous, position)) {
                return Match.NOT_MET;
            }
        }
        return Match.MET;
    }

    static boolean holds(
            RuleCondition condition, IndicatorSnapshot current, IndicatorSnapshot previous, Position position) {
        String left = condition.priceOrIndicatorKey();
        return switch (condition.getType()) {
            case COMPARE -> condition.getOperator().test(current.get(left), rightHandSide(condition, current));
            case CROSSES_ABOVE -> {
                if (previous == null) {
                    yield false;
                }
                double before = previous.get(left) - rightHandSide(condition, previous);
                double now = current.get(left) - rightHandSide(condition, current);
                yield before < 0 && now >= 0;
            }
            case CROSSES_BELOW -> {
                if (previous == null) {
                    yield false;
                }
                double before = previous.get(left) - rightHandSide(condition, previous);
                double now = current.get(left) - rightHandSide(condition, current);
                yield before > 0 && now <= 0;
            }
            case STOP_LOSS_PCT -> movedAgainst(position, current.get(left), condition.getValue());
            case TAKE_PROFIT_PCT -> movedInFavour(position, current.get(left), condition.getValue());
        };
    }

    private static double rightHandSide(RuleCondition condition, IndicatorSnapshot snapshot) {
        if (condition.getReference() != null) {
            return snapshot.get(condition.getReference());
        }
        return condition.getValue() != null ? condition.getValue() : Double.NaN;
    }

    private static boolean movedAgainst(Position position, double price, double percent) {
        if (position == null || !position.isOpen() || position.getAverageEntryPrice() == null) {
            return false;
        }
        double entry = position.getAverageEntryPrice().doubleValue();
        return position.getSide() == PositionSide.LONG
                ? price <= entry * (1 - percent / 100.0)
                : price >= entry * (1 + percent / 100.0);
    }

    private static boolean movedInFavour(Position position, double price, double percent) {
        if (position == null || !position.isOpen() || position.getAverageEntryPrice() == null) {
            return false;
        }
        double entry = position.getAverageEntryPrice().doubleValue();
        return position.getSide() == PositionSide.LONG
                ? price >= entry * (1 + percent / 100.0)
                : price <= entry * (1 - percent / 100.0);
    }
}
