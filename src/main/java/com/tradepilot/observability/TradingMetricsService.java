package com.tradepilot.observability;

import com.tradepilot.event.DecisionEvent;
import com.tradepilot.event.OrderEvent;
import com.tradepilot.event.OrderEventType;
import com.tradepilot.event.RiskEvent;
import com.tradepilot.event.RiskEventType;
import com.tradepilot.oms.OrderExecutionManager;
import com.tradepilot.risk.PositionRiskTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the execution engine, exposed through the actuator.
 *
 * <ul>
 *   <li><b>tradepilot.orders.submitted</b> (counter)</li>
 *   <li><b>tradepilot.orders.filled</b> (counter)</li>
 *   <li><b>tradepilot.orders.rejected</b> (counter)</li>
 *   <li><b>tradepilot.orders.unknown</b> (counter): orders escalated to UNKNOWN</li>
 *   <li><b>tradepilot.risk.denied</b> (counter)</li>
 *   <li><b>tradepilot.signals</b> (counter, tag outcome)</li>
 *   <li><b>tradepilot.cycle.errors</b> (counter, tag code)</li>
 *   <li><b>tradepilot.cycle.latency</b> (timer)</li>
 *   <li><b>tradepilot.exposure.total</b>, <b>tradepilot.pnl.realized</b>,
 *       <b>tradepilot.orders.unresolved</b> (gauges)</li>
 * </ul>
 *
 * <p>Counters are driven by event listeners at {@code @Order(20)}, after the core listeners.
 */
@Service
public class TradingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter ordersSubmittedCounter;
    private final Counter ordersFilledCounter;
    private final Counter ordersRejectedCounter;
    private final Counter ordersUnknownCounter;
    private final Counter riskDeniedCounter;
    private final Timer cycleTimer;

    public TradingMetricsService(
            MeterRegistry meterRegistry,
            PositionRiskTracker positionRiskTracker,
            OrderExecutionManager orderExecutionManager) {
        this.meterRegistry = meterRegistry;

        this.ordersSubmittedCounter = Counter.builder("tradepilot.orders.submitted")
                .description("Orders handed to the exchange")
                .register(meterRegistry);
        this.ordersFilledCounter = Counter.builder("tradepilot.orders.filled")
                .description("Orders fully filled")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("tradepilot.orders.rejected")
                .description("Orders rejected by the exchange")
                .register(meterRegistry);
        this.ordersUnknownCounter = Counter.builder("tradepilot.orders.unknown")
                .description("Orders escalated to UNKNOWN after exhausting retries")
                .register(meterRegistry);
        this.riskDeniedCounter = Counter.builder("tradepilot.risk.denied")
                .description("Orders denied by pre-trade risk checks")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("tradepilot.cycle.latency")
                .description("Duration of one trading cycle for one instrument")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(meterRegistry);

        meterRegistry.gauge("tradepilot.exposure.total", positionRiskTracker, tracker -> tracker.totalExposure()
                .doubleValue());
        meterRegistry.gauge("tradepilot.pnl.realized", positionRiskTracker, tracker -> tracker.realizedPnl()
                .doubleValue());
        meterRegistry.gauge("tradepilot.orders.unresolved", orderExecutionManager, manager -> manager.getUnknownOrders()
                .size());
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.SUBMITTED) {
            ordersSubmittedCounter.increment();
        } else if (event.getEventType() == OrderEventType.FILLED) {
            ordersFilledCounter.increment();
        } else if (event.getEventType() == OrderEventType.REJECTED) {
            ordersRejectedCounter.increment();
        } else if (event.getEventType() == OrderEventType.UNKNOWN) {
            ordersUnknownCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.ORDER_DENIED) {
            riskDeniedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onDecisionEvent(DecisionEvent event) {
        if ("SIGNAL".equals(event.getCategory()) && event.getContext().get("outcome") != null) {
            meterRegistry
                    .counter("tradepilot.signals", "outcome", String.valueOf(event.getContext().get("outcome")))
                    .increment();
        }
    }

    public void recordCycle(long elapsedNanos) {
        cycleTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordCycleError(String code) {
        meterRegistry.counter("tradepilot.cycle.errors", "code", code).increment();
    }
}
