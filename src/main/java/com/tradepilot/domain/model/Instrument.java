package com.tradepilot.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Getter;

/**
 * A tradable instrument (currency pair, contract) with its trading constraints.
 *
 * <p>Immutable after load. Built by {@link com.tradepilot.config.InstrumentRegistry}
 * from the {@code tradepilot.instruments} configuration section.
 *
 * <p>The per-instrument risk limits live here so the Position &amp; Risk Tracker
 * can check them without a second lookup. A null limit disables that check.
 */
@Getter
@Builder
public class Instrument {

    private final String id;

    /** Minimum price increment. */
    private final BigDecimal tickSize;

    /** Quantity step: every order size is a whole multiple of this. */
    private final BigDecimal lotSize;

    private final BigDecimal minOrderSize;

    /** Maximum absolute position size. Null = unlimited. */
    private final BigDecimal maxPositionSize;

    /** Maximum notional value of the position at mark price. Null = unlimited. */
    private final BigDecimal maxNotional;

    /** Number of lots traded per entry signal. */
    @Builder.Default
    private final int orderLots = 1;

    /** Size of one entry order: {@code orderLots * lotSize}, never below the minimum order size. */
    public BigDecimal entryOrderSize() {
        BigDecimal size = lotSize.multiply(BigDecimal.valueOf(orderLots));
        if (minOrderSize != null && size.compareTo(minOrderSize) < 0) {
            return roundUpToLot(minOrderSize);
        }
        return size;
    }

    private BigDecimal roundUpToLot(BigDecimal size) {
        BigDecimal lots = size.divide(lotSize, 0, RoundingMode.UP);
        return lots.multiply(lotSize);
    }
}
