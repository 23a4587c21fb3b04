package com.tradepilot.unit.oms;

import static com.tradepilot.support.TestInstruments.BTC;
import static com.tradepilot.support.TestInstruments.ETH;
import static com.tradepilot.support.TestInstruments.fill;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.Position;
import com.tradepilot.oms.TradeJournal;
import com.tradepilot.oms.TradeRecord;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradeJournalTest {

    @Test
    @DisplayName("Trades are listed newest first with the position after each fill")
    void newestFirst() {
        TradeJournal journal = new TradeJournal(10);

        journal.record(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"), position(BTC, PositionSide.LONG, "1"));
        journal.record(fill("F2", "k2", BTC, OrderSide.SELL, "1", "110"), position(BTC, PositionSide.FLAT, "0"));

        assertThat(journal.getTrades()).extracting(TradeRecord::fillId).containsExactly("F2", "F1");
        assertThat(journal.getTrades().get(0).positionSideAfter()).isEqualTo(PositionSide.FLAT);
    }

    @Test
    @DisplayName("Oldest trades are dropped beyond capacity")
    void bounded() {
        TradeJournal journal = new TradeJournal(2);

        journal.record(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"), position(BTC, PositionSide.LONG, "1"));
        journal.record(fill("F2", "k2", BTC, OrderSide.BUY, "1", "100"), position(BTC, PositionSide.LONG, "2"));
        journal.record(fill("F3", "k3", BTC, OrderSide.BUY, "1", "100"), position(BTC, PositionSide.LONG, "3"));

        assertThat(journal.size()).isEqualTo(2);
        assertThat(journal.getTrades()).extracting(TradeRecord::fillId).containsExactly("F3", "F2");
    }

    @Test
    @DisplayName("Trades can be filtered by instrument")
    void filterByInstrument() {
        TradeJournal journal = new TradeJournal(10);

        journal.record(fill("F1", "k1", BTC, OrderSide.BUY, "1", "100"), position(BTC, PositionSide.LONG, "1"));
        journal.record(fill("F2", "k2", ETH, OrderSide.SELL, "1", "50"), position(ETH, PositionSide.SHORT, "1"));

        assertThat(journal.getTrades(ETH)).extracting(TradeRecord::fillId).containsExactly("F2");
    }

    private static Position position(String instrumentId, PositionSide side, String size) {
        return Position.builder()
                .instrumentId(instrumentId)
                .side(side)
                .size(new BigDecimal(size))
                .build();
    }
}
