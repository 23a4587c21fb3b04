package com.tradepilot.risk;

import com.tradepilot.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/** A denied authorization, kept for the reporting surface. */
public record RiskRejection(
        Instant rejectedAt,
        String instrumentId,
        OrderSide side,
        BigDecimal size,
        BigDecimal referencePrice,
        List<RiskViolation> violations) {}
