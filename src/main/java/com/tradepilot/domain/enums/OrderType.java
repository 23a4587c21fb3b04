package com.tradepilot.domain.enums;

/** Order execution type. Strategy signals are always submitted as MARKET orders. */
public enum OrderType {
    MARKET,
    LIMIT
}
