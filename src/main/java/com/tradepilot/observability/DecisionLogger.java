package com.tradepilot.observability;

import com.tradepilot.event.DecisionEvent;
import com.tradepilot.event.OrderEvent;
import com.tradepilot.event.OrderEventType;
import com.tradepilot.event.RiskEvent;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Keeps the most recent engine decisions in memory for the operator.
 *
 * <p>Sources:
 * <ul>
 *   <li>{@link DecisionEvent}s published by the evaluator, the execution manager and the scheduler</li>
 *   <li>{@link OrderEvent}s for terminal and unconfirmed order states</li>
 *   <li>{@link RiskEvent}s</li>
 * </ul>
 *
 * <p>The ring buffer holds {@value #RING_BUFFER_SIZE} records, newest first.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    @EventListener
    @Order(20)
    public void onDecision(DecisionEvent event) {
        append(DecisionRecord.builder()
                .timestamp(event.getOccurredAt())
                .category(event.getCategory())
                .instrumentId(event.getInstrumentId())
                .message(event.getMessage())
                .context(event.getContext())
                .build());
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        OrderEventType type = event.getEventType();
        if (type == OrderEventType.PARTIALLY_FILLED || type == OrderEventType.ACKED) {
            return;
        }
        var order = event.getOrder();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("idempotencyKey", order.getIdempotencyKey());
        context.put("status", order.getStatus().name());
        context.put("attempts", order.getAttempts());
        if (order.getRejectionReason() != null) {
            context.put("reason", order.getRejectionReason());
        }
        append(DecisionRecord.builder()
                .timestamp(Instant.now())
                .category("ORDER")
                .instrumentId(order.getInstrumentId())
                .message(String.format(
                        "Order %s: %s %s %s (%s)",
                        type, order.getSide(), order.getSize().toPlainString(), order.getInstrumentId(), order.getSignalType()))
                .context(context)
                .build());
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        Object instrumentId = event.getDetails().get("instrumentId");
        append(DecisionRecord.builder()
                .timestamp(Instant.now())
                .category("RISK")
                .instrumentId(instrumentId != null ? instrumentId.toString() : null)
                .message(event.getLevel() + " " + event.getEventType() + ": " + event.getMessage())
                .context(event.getDetails())
                .build());
    }

    /** Most recent decisions, newest first. */
    public List<DecisionRecord> getRecent(int limit) {
        return ringBuffer.stream().limit(limit).toList();
    }

    public List<DecisionRecord> getRecent(String instrumentId, int limit) {
        return ringBuffer.stream()
                .filter(record -> instrumentId.equals(record.getInstrumentId()))
                .limit(limit)
                .toList();
    }

    private void append(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.pollLast();
        }
        logger.debug("Decision: [{}] {} {}", decisionRecord.getCategory(), decisionRecord.getInstrumentId(), decisionRecord.getMessage());
    }
}
