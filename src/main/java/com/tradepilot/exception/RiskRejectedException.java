package com.tradepilot.exception;

import com.tradepilot.risk.RiskViolation;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Pre-trade risk check denied the order. No order is placed; the signal is dropped.
 */
@Getter
public class RiskRejectedException extends BaseException {

    private final String instrumentId;
    private final List<RiskViolation> violations;

    public RiskRejectedException(String instrumentId, List<RiskViolation> violations) {
        super(
                ErrorCode.RISK_LIMIT_EXCEEDED,
                "Risk check rejected order for " + instrumentId + ": " + violations,
                Map.of("instrumentId", instrumentId, "violations", violations.stream().map(RiskViolation::getCode).toList()));
        this.instrumentId = instrumentId;
        this.violations = List.copyOf(violations);
    }
}
