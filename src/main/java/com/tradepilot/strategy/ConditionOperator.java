package com.tradepilot.strategy;

/** Comparison operators for {@link ConditionType#COMPARE} conditions. */
public enum ConditionOperator {
    GT,
    GTE,
    LT,
    LTE;

    public boolean test(double left, double right) {
        return switch (this) {
            case GT -> left > right;
            case GTE -> left >= right;
            case LT -> left < right;
            case LTE -> left <= right;
        };
    }
}
