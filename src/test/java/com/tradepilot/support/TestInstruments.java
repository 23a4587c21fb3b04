package com.tradepilot.support;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.Instrument;
import java.math.BigDecimal;
import java.time.Instant;

/** Instrument and fill fixtures. */
public final class TestInstruments {

    public static final String BTC = "BTC-USDT";
    public static final String ETH = "ETH-USDT";

    private TestInstruments() {}

    /** Lot size 1, no per-instrument limits. */
    public static Instrument unlimited(String id) {
        return Instrument.builder()
                .id(id)
                .tickSize(new BigDecimal("0.01"))
                .lotSize(BigDecimal.ONE)
                .minOrderSize(BigDecimal.ONE)
                .build();
    }

    public static Instrument limited(String id, String maxPositionSize, String maxNotional) {
        return Instrument.builder()
                .id(id)
                .tickSize(new BigDecimal("0.01"))
                .lotSize(BigDecimal.ONE)
                .minOrderSize(BigDecimal.ONE)
                .maxPositionSize(maxPositionSize != null ? new BigDecimal(maxPositionSize) : null)
                .maxNotional(maxNotional != null ? new BigDecimal(maxNotional) : null)
                .build();
    }

    public static FillEvent fill(String fillId, String key, String instrumentId, OrderSide side, String size, String price) {
        return FillEvent.builder()
                .fillId(fillId)
                .idempotencyKey(key)
                .instrumentId(instrumentId)
                .side(side)
                .size(new BigDecimal(size))
                .price(new BigDecimal(price))
                .timestamp(Instant.parse("2025-01-06T09:30:00Z"))
                .build();
    }
}
