package com.tradepilot.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One OHLCV bar for an instrument, identified by its end time.
 *
 * <p>Bars arrive from the feed without a sequence. The {@link com.tradepilot.marketdata.MarketDataCache}
 * stamps each accepted bar with the next per-instrument sequence via {@link #withSequence(long)};
 * that number flows into the indicator snapshot and drives the evaluator's stale guard.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class PriceBar {

    private final Instant timestamp;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    /** Assigned by the cache on append. Zero until then. */
    private final long sequence;

    public PriceBar withSequence(long sequence) {
        return toBuilder().sequence(sequence).build();
    }
}
