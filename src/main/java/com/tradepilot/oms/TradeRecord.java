package com.tradepilot.oms;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * One applied fill as it appears in the trade history, with the position it left behind.
 */
public record TradeRecord(
        String fillId,
        String idempotencyKey,
        String instrumentId,
        OrderSide side,
        BigDecimal size,
        BigDecimal price,
        Instant executedAt,
        PositionSide positionSideAfter,
        BigDecimal positionSizeAfter,
        BigDecimal realizedPnlAfter) {}
