package com.tradepilot.strategy;

/**
 * The closed set of condition variants a {@link StrategyRule} can be built from.
 *
 * <ul>
 *   <li>COMPARE: {@code indicator op (reference | value)} on the current snapshot</li>
 *   <li>CROSSES_ABOVE / CROSSES_BELOW: the indicator moved from one side of
 *       {@code reference | value} to the other between the previous and current snapshot</li>
 *   <li>STOP_LOSS_PCT / TAKE_PROFIT_PCT: the price ({@code indicator}, LTP by default) moved
 *       {@code value} percent against / in favour of the open position's average entry</li>
 * </ul>
 */
public enum ConditionType {
    COMPARE,
    CROSSES_ABOVE,
    CROSSES_BELOW,
    STOP_LOSS_PCT,
    TAKE_PROFIT_PCT
}
