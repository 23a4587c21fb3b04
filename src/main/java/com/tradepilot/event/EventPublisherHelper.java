package com.tradepilot.event;

import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.model.Order;
import com.tradepilot.domain.model.Position;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed
 * factory methods for the TradePilot event types.
 *
 * <p>Core components depend on this helper instead of the raw publisher so that unit
 * tests can mock a single collaborator and verify the published events by method.
 * Delivery is synchronous unless a listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousStatus));
    }

    public void publishOrderSubmitted(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.SUBMITTED));
    }

    // ---- Position ----

    public void publishPositionEvent(Object source, Position previous, Position position, PositionEventType eventType) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, previous, position, eventType));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }

    // ---- Decision ----

    public void publishDecision(Object source, String category, String message) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message, null, null));
    }

    public void publishDecision(
            Object source, String category, String message, String instrumentId, Map<String, Object> context) {
        applicationEventPublisher.publishEvent(new DecisionEvent(source, category, message, instrumentId, context));
    }
}
