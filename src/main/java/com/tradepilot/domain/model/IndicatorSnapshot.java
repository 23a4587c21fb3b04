package com.tradepilot.domain.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Immutable set of indicator values computed from the bar that closed at {@link #getBarTime()}.
 *
 * <p>Keys follow the {@code TYPE:period[:field]} format produced by
 * {@link com.tradepilot.indicator.IndicatorFactory#buildKey}. A value of {@link Double#NaN}
 * is the sentinel for "not computable" (insufficient data, division by zero); rules
 * reading a sentinel make the whole evaluation HOLD.
 */
@Getter
public class IndicatorSnapshot {

    private final String instrumentId;

    /** Sequence of the bar this snapshot was computed from. Strictly increasing per instrument. */
    private final long sequence;

    private final Instant barTime;
    private final Map<String, Double> values;

    public IndicatorSnapshot(String instrumentId, long sequence, Instant barTime, Map<String, Double> values) {
        this.instrumentId = instrumentId;
        this.sequence = sequence;
        this.barTime = barTime;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Returns the value for the key, or NaN if the indicator is not part of this snapshot. */
    public double get(String key) {
        Double value = values.get(key);
        return value != null ? value : Double.NaN;
    }

    public boolean isSentinel(String key) {
        return Double.isNaN(get(key));
    }

    public boolean anySentinel(Collection<String> keys) {
        return keys.stream().anyMatch(this::isSentinel);
    }

    @Override
    public String toString() {
        return "IndicatorSnapshot{" + instrumentId + " seq=" + sequence + " " + values + "}";
    }
}
