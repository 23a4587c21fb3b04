package com.tradepilot.domain.model;

import com.tradepilot.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Current exposure in one instrument.
 *
 * <p>Instances are immutable snapshots: the {@link com.tradepilot.risk.PositionRiskTracker}
 * owns the only mutable view and replaces the snapshot atomically on every fill. Size is
 * always non-negative and the direction is carried by {@link #getSide()}; FLAT implies zero.
 *
 * <p>Unrealized P&amp;L is derived from the last mark price and never stored.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Position {

    private final String instrumentId;

    @Builder.Default
    private final PositionSide side = PositionSide.FLAT;

    @Builder.Default
    private final BigDecimal size = BigDecimal.ZERO;

    /** Weighted average entry price of the open size. Null when flat. */
    private final BigDecimal averageEntryPrice;

    /** Accumulated realized P&amp;L across all closes in this instrument. */
    @Builder.Default
    private final BigDecimal realizedPnl = BigDecimal.ZERO;

    /** Last known market price, used for exposure and unrealized P&amp;L. */
    private final BigDecimal markPrice;

    private final Instant openedAt;
    private final Instant closedAt;
    private final Instant updatedAt;

    public static Position flat(String instrumentId) {
        return Position.builder().instrumentId(instrumentId).build();
    }

    public boolean isOpen() {
        return side != PositionSide.FLAT;
    }

    /** Signed size: positive for LONG, negative for SHORT, zero for FLAT. */
    public BigDecimal signedSize() {
        return side == PositionSide.SHORT ? size.negate() : size;
    }

    /** Price used for valuation: mark price if known, otherwise the average entry. */
    public BigDecimal valuationPrice() {
        if (markPrice != null) {
            return markPrice;
        }
        return averageEntryPrice != null ? averageEntryPrice : BigDecimal.ZERO;
    }

    /** Absolute market value of the open size. */
    public BigDecimal notional() {
        if (!isOpen()) {
            return BigDecimal.ZERO;
        }
        return size.multiply(valuationPrice());
    }

    /** (mark - entry) * signedSize. Zero when flat or when no mark price is known. */
    public BigDecimal unrealizedPnl() {
        if (!isOpen() || markPrice == null || averageEntryPrice == null) {
            return BigDecimal.ZERO;
        }
        return markPrice.subtract(averageEntryPrice).multiply(signedSize());
    }
}
