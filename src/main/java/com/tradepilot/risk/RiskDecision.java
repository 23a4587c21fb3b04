package com.tradepilot.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of {@link PositionRiskTracker#authorize}: allowed (no violations) or denied
 * (one or more violations).
 */
@Getter
public class RiskDecision {

    private final boolean allowed;
    private final List<RiskViolation> violations;

    private RiskDecision(boolean allowed, List<RiskViolation> violations) {
        this.allowed = allowed;
        this.violations = violations;
    }

    public static RiskDecision allow() {
        return new RiskDecision(true, Collections.emptyList());
    }

    public static RiskDecision deny(List<RiskViolation> violations) {
        return new RiskDecision(false, List.copyOf(violations));
    }

    public boolean isDenied() {
        return !allowed;
    }
}
