package com.tradepilot.oms;

import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.Position;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory trade history: the most recent applied fills, newest first.
 *
 * <p>Only fills that changed a position are recorded, so duplicates never appear.
 * The journal is bounded by {@code tradepilot.journal.capacity} (default 500).
 */
@Component
public class TradeJournal {

    private static final Logger log = LoggerFactory.getLogger(TradeJournal.class);

    private final int capacity;
    private final ConcurrentLinkedDeque<TradeRecord> trades = new ConcurrentLinkedDeque<>();

    public TradeJournal(@Value("${tradepilot.journal.capacity:500}") int capacity) {
        this.capacity = capacity;
    }

    public void record(FillEvent fill, Position after) {
        TradeRecord trade = new TradeRecord(
                fill.getFillId(),
                fill.getIdempotencyKey(),
                fill.getInstrumentId(),
                fill.getSide(),
                fill.getSize(),
                fill.getPrice(),
                fill.getTimestamp(),
                after.getSide(),
                after.getSize(),
                after.getRealizedPnl());
        trades.addFirst(trade);
        while (trades.size() > capacity) {
            trades.pollLast();
        }
        log.debug("Trade journaled: fillId={} instrument={}", fill.getFillId(), fill.getInstrumentId());
    }

    /** Newest first. */
    public List<TradeRecord> getTrades() {
        return List.copyOf(trades);
    }

    public List<TradeRecord> getTrades(String instrumentId) {
        return trades.stream()
                .filter(trade -> trade.instrumentId().equals(instrumentId))
                .toList();
    }

    public int size() {
        return trades.size();
    }
}
