package com.tradepilot.marketdata;

import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.exception.InsufficientHistoryException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the most recent bounded history of bars per instrument.
 *
 * <p>One {@link InstrumentBarBuffer} per instrument, created on first append. The
 * capacity ({@code tradepilot.market-data.capacity}) must cover the slowest
 * indicator's lookback; the scheduler verifies this at startup.
 */
@Component
public class MarketDataCache {

    private final int capacity;
    private final Map<String, InstrumentBarBuffer> buffers = new ConcurrentHashMap<>();

    public MarketDataCache(@Value("${tradepilot.market-data.capacity:200}") int capacity) {
        this.capacity = capacity;
    }

    /**
     * Appends a bar to the instrument's history.
     *
     * @return the stored bar carrying its sequence, or empty if it was a duplicate or out of order
     */
    public Optional<PriceBar> append(String instrumentId, PriceBar bar) {
        return buffer(instrumentId).append(bar);
    }

    /**
     * Returns a copy of the last {@code n} bars in chronological order.
     *
     * @throws InsufficientHistoryException if fewer than {@code n} bars exist
     */
    public List<PriceBar> history(String instrumentId, int n) {
        InstrumentBarBuffer buffer = buffers.get(instrumentId);
        if (buffer == null) {
            throw new InsufficientHistoryException(instrumentId, n, 0);
        }
        return buffer.history(n);
    }

    public Optional<PriceBar> latest(String instrumentId) {
        InstrumentBarBuffer buffer = buffers.get(instrumentId);
        return buffer != null ? buffer.latest() : Optional.empty();
    }

    public int size(String instrumentId) {
        InstrumentBarBuffer buffer = buffers.get(instrumentId);
        return buffer != null ? buffer.size() : 0;
    }

    public int getCapacity() {
        return capacity;
    }

    private InstrumentBarBuffer buffer(String instrumentId) {
        return buffers.computeIfAbsent(instrumentId, id -> new InstrumentBarBuffer(id, capacity));
    }
}
