package com.tradepilot.indicator;

/**
 * Supported technical indicator types.
 *
 * <p>Multi-output types (MACD, BOLLINGER, STOCHASTIC) produce several keyed values per
 * snapshot. LTP is a pseudo-indicator carrying the raw close, so rules can compare
 * price directly against an indicator.
 */
public enum IndicatorType {
    SMA,
    EMA,
    RSI,
    MACD,
    BOLLINGER,
    ATR,
    STOCHASTIC,
    ROC,
    LTP
}
