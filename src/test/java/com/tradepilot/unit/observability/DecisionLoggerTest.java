package com.tradepilot.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.Order;
import com.tradepilot.event.DecisionEvent;
import com.tradepilot.event.OrderEvent;
import com.tradepilot.event.OrderEventType;
import com.tradepilot.event.RiskEvent;
import com.tradepilot.event.RiskEventType;
import com.tradepilot.event.RiskLevel;
import com.tradepilot.observability.DecisionLogger;
import com.tradepilot.observability.DecisionRecord;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DecisionLoggerTest {

    private DecisionLogger decisionLogger;

    @BeforeEach
    void setUp() {
        decisionLogger = new DecisionLogger();
    }

    private static Order order(OrderStatus status, String reason) {
        return Order.builder()
                .idempotencyKey("k1")
                .instrumentId("BTC-USDT")
                .side(OrderSide.BUY)
                .size(new BigDecimal("0.010"))
                .signalType(SignalType.ENTER_LONG)
                .status(status)
                .attempts(3)
                .rejectionReason(reason)
                .build();
    }

    @Test
    @DisplayName("Records are returned newest first")
    void newestFirst() {
        decisionLogger.onDecision(new DecisionEvent(this, "ENGINE", "first", null, null));
        decisionLogger.onDecision(new DecisionEvent(this, "SIGNAL", "second", "BTC-USDT", Map.of("outcome", "STALE")));

        List<DecisionRecord> recent = decisionLogger.getRecent(10);

        assertThat(recent).extracting(DecisionRecord::getMessage).containsExactly("second", "first");
        assertThat(recent.get(0).getContext()).containsEntry("outcome", "STALE");
    }

    @Test
    @DisplayName("Terminal order events are logged with key, status and reason")
    void orderEvents() {
        decisionLogger.onOrderEvent(
                new OrderEvent(this, order(OrderStatus.REJECTED, "no margin"), OrderEventType.REJECTED));

        DecisionRecord record = decisionLogger.getRecent(1).get(0);
        assertThat(record.getCategory()).isEqualTo("ORDER");
        assertThat(record.getMessage()).isEqualTo("Order REJECTED: BUY 0.010 BTC-USDT (ENTER_LONG)");
        assertThat(record.getContext())
                .containsEntry("idempotencyKey", "k1")
                .containsEntry("status", "REJECTED")
                .containsEntry("reason", "no margin");
    }

    @Test
    @DisplayName("ACKED and partial fills are not logged")
    void intermediateOrderEventsSkipped() {
        decisionLogger.onOrderEvent(new OrderEvent(this, order(OrderStatus.ACKED, null), OrderEventType.ACKED));
        decisionLogger.onOrderEvent(
                new OrderEvent(this, order(OrderStatus.PARTIALLY_FILLED, null), OrderEventType.PARTIALLY_FILLED));

        assertThat(decisionLogger.getRecent(10)).isEmpty();
    }

    @Test
    @DisplayName("Risk events take the instrument from their details")
    void riskEvents() {
        decisionLogger.onRiskEvent(new RiskEvent(
                this, RiskEventType.ORDER_DENIED, RiskLevel.WARNING, "cap", Map.of("instrumentId", "ETH-USDT")));

        DecisionRecord record = decisionLogger.getRecent(1).get(0);
        assertThat(record.getCategory()).isEqualTo("RISK");
        assertThat(record.getInstrumentId()).isEqualTo("ETH-USDT");
        assertThat(record.getMessage()).isEqualTo("WARNING ORDER_DENIED: cap");
    }

    @Test
    @DisplayName("Filtering by instrument and limit")
    void filterByInstrument() {
        for (int i = 0; i < 5; i++) {
            decisionLogger.onDecision(new DecisionEvent(this, "SIGNAL", "btc-" + i, "BTC-USDT", null));
            decisionLogger.onDecision(new DecisionEvent(this, "SIGNAL", "eth-" + i, "ETH-USDT", null));
        }

        assertThat(decisionLogger.getRecent("ETH-USDT", 2))
                .extracting(DecisionRecord::getMessage)
                .containsExactly("eth-4", "eth-3");
        assertThat(decisionLogger.getRecent(3)).hasSize(3);
    }

    @Test
    @DisplayName("Ring buffer keeps the most recent 1000 records")
    void bounded() {
        for (int i = 0; i < 1005; i++) {
            decisionLogger.onDecision(new DecisionEvent(this, "SIGNAL", "m" + i, "BTC-USDT", null));
        }

        List<DecisionRecord> all = decisionLogger.getRecent(5000);
        assertThat(all).hasSize(1000);
        assertThat(all.get(0).getMessage()).isEqualTo("m1004");
        assertThat(all.get(999).getMessage()).isEqualTo("m5");
    }
}
