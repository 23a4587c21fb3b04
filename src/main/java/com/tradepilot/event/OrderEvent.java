package com.tradepilot.event;

import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@link com.tradepilot.oms.OrderExecutionManager} on every order
 * state change.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>TradingMetricsService: submitted/rejected/unknown counters</li>
 *   <li>DecisionLogger: operator-facing audit trail</li>
 * </ul>
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    /**
     * @param source         the component publishing this event
     * @param order          the order after the change
     * @param eventType      what kind of state change occurred
     * @param previousStatus the status before this change (null for SUBMITTED)
     */
    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
