package com.tradepilot.strategy;

import com.tradepilot.indicator.IndicatorFactory;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One predicate of a {@link StrategyRule}, bound from configuration or built by a
 * {@link StrategyPreset}.
 *
 * <p>The right-hand side is either another indicator ({@link #reference}) or a constant
 * ({@link #value}); reference wins when both are set. For the percentage variants
 * {@link #value} is the percentage and {@link #indicator} the price key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    private ConditionType type;

    /** Left-hand indicator key, e.g. {@code RSI:14}. */
    private String indicator;

    private ConditionOperator operator;

    /** Right-hand indicator key, e.g. {@code SMA:20}. */
    private String reference;

    /** Right-hand constant, or the percentage for STOP_LOSS_PCT / TAKE_PROFIT_PCT. */
    private Double value;

    public static RuleCondition compare(String indicator, ConditionOperator operator, String reference) {
        return RuleCondition.builder()
                .type(ConditionType.COMPARE)
                .indicator(indicator)
                .operator(operator)
                .reference(reference)
                .build();
    }

    public static RuleCondition compare(String indicator, ConditionOperator operator, double value) {
        return RuleCondition.builder()
                .type(ConditionType.COMPARE)
                .indicator(indicator)
                .operator(operator)
                .value(value)
                .build();
    }

    public static RuleCondition crossesAbove(String indicator, String reference) {
        return RuleCondition.builder()
                .type(ConditionType.CROSSES_ABOVE)
                .indicator(indicator)
                .reference(reference)
                .build();
    }

    public static RuleCondition crossesBelow(String indicator, String reference) {
        return RuleCondition.builder()
                .type(ConditionType.CROSSES_BELOW)
                .indicator(indicator)
                .reference(reference)
                .build();
    }

    public static RuleCondition stopLossPct(double percent) {
        return RuleCondition.builder()
                .type(ConditionType.STOP_LOSS_PCT)
                .indicator(IndicatorFactory.ltpKey())
                .value(percent)
                .build();
    }

    public static RuleCondition takeProfitPct(double percent) {
        return RuleCondition.builder()
                .type(ConditionType.TAKE_PROFIT_PCT)
                .indicator(IndicatorFactory.ltpKey())
                .value(percent)
                .build();
    }

    /** Indicator keys this condition reads from the current snapshot. */
    public List<String> inputKeys() {
        List<String> keys = new ArrayList<>(2);
        keys.add(priceOrIndicatorKey());
        if (reference != null) {
            keys.add(reference);
        }
        return keys;
    }

    String priceOrIndicatorKey() {
        if (indicator == null
                && (type == ConditionType.STOP_LOSS_PCT || type == ConditionType.TAKE_PROFIT_PCT)) {
            return IndicatorFactory.ltpKey();
        }
        return indicator;
    }

    @Override
    public String toString() {
        String rhs = reference != null ? reference : String.valueOf(value);
        return switch (type) {
            case COMPARE -> indicator + " " + operator + " " + rhs;
            case CROSSES_ABOVE -> indicator + " crosses above " + rhs;
            case CROSSES_BELOW -> indicator + " crosses below " + rhs;
            case STOP_LOSS_PCT -> "stop loss " + value + "%";
            case TAKE_PROFIT_PCT -> "take profit " + value + "%";
        };
    }
}
