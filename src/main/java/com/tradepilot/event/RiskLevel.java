package com.tradepilot.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>WARNING for a denied order (signal dropped, nothing at risk), CRITICAL when the
 * operator must act, such as an order stuck in UNKNOWN.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
