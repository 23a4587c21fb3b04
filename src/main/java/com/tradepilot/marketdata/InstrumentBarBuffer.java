package com.tradepilot.marketdata;

import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.exception.InsufficientHistoryException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-capacity ring buffer of bars for one instrument.
 *
 * <p>A {@link ReadWriteLock} protects the deque: appends come from the instrument's
 * lane (single writer), reads from indicator computation and the REST surface.
 * Reads always return a copy, so a concurrent append never changes a history
 * that is already being used.
 *
 * <p>Each accepted bar gets the next sequence number. Bars whose timestamp is not
 * strictly after the newest cached bar are dropped: the feed redelivers at least
 * once, and a duplicate must not produce a new sequence.
 */
public class InstrumentBarBuffer {

    private static final Logger log = LoggerFactory.getLogger(InstrumentBarBuffer.class);

    @Getter
    private final String instrumentId;

    @Getter
    private final int capacity;

    private final Deque<PriceBar> bars;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private long lastSequence;

    public InstrumentBarBuffer(String instrumentId, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Bar buffer capacity must be positive: " + capacity);
        }
        this.instrumentId = instrumentId;
        this.capacity = capacity;
        this.bars = new ArrayDeque<>(capacity);
    }

    /**
     * Appends a bar, evicting the oldest when full.
     *
     * @return the stored bar with its assigned sequence, or empty if the bar was not newer
     *         than the last cached one
     */
    public Optional<PriceBar> append(PriceBar bar) {
        lock.writeLock().lock();
        try {
            PriceBar newest = bars.peekLast();
            if (newest != null && !bar.getTimestamp().isAfter(newest.getTimestamp())) {
                log.warn(
                        "Dropping out-of-order bar for {}: barTime={} lastBarTime={}",
                        instrumentId,
                        bar.getTimestamp(),
                        newest.getTimestamp());
                return Optional.empty();
            }

            PriceBar stored = bar.withSequence(++lastSequence);
            if (bars.size() == capacity) {
                bars.pollFirst();
            }
            bars.addLast(stored);
            return Optional.of(stored);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the last {@code n} bars, oldest first.
     *
     * @throws InsufficientHistoryException if fewer than {@code n} bars are cached
     */
    public List<PriceBar> history(int n) {
        lock.readLock().lock();
        try {
            if (bars.size() < n) {
                throw new InsufficientHistoryException(instrumentId, n, bars.size());
            }
            List<PriceBar> result = new ArrayList<>(n);
            Iterator<PriceBar> descending = bars.descendingIterator();
            for (int i = 0; i < n; i++) {
                result.add(descending.next());
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<PriceBar> latest() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(bars.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return bars.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
