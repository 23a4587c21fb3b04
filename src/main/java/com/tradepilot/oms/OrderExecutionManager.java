package com.tradepilot.oms;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.domain.model.Order;
import com.tradepilot.domain.model.Position;
import com.tradepilot.domain.model.Signal;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.event.OrderEventType;
import com.tradepilot.event.RiskEventType;
import com.tradepilot.event.RiskLevel;
import com.tradepilot.exception.ExchangeTimeoutException;
import com.tradepilot.exception.InvalidOrderStateException;
import com.tradepilot.exception.OrderInFlightException;
import com.tradepilot.exception.OrderRejectedException;
import com.tradepilot.exception.ResourceNotFoundException;
import com.tradepilot.exception.RiskRejectedException;
import com.tradepilot.exchange.ExchangeGateway;
import com.tradepilot.exchange.ExchangeResponse;
import com.tradepilot.indicator.IndicatorFactory;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.risk.RiskDecision;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns actionable signals into exchange orders and keeps those orders in step with
 * acknowledgements and fills.
 *
 * <p>Submission pipeline ({@link #submit}):
 * <ol>
 *   <li>Idempotency key from the signal; a key seen before returns its existing order</li>
 *   <li>In-flight check: at most one non-terminal order per instrument</li>
 *   <li>Risk gate via {@link PositionRiskTracker#authorize}; denial fails closed</li>
 *   <li>Order stored as PENDING, then placed through the {@link ExchangeGateway}</li>
 *   <li>Attempts that time out or fail in transport are retried by a resilience4j
 *       {@link Retry} with exponential backoff, always with the same key</li>
 *   <li>Exhausted retries leave the order UNKNOWN for operator reconciliation</li>
 * </ol>
 *
 * <p>Order status only moves forward ({@link OrderStatus#canTransitionTo}), so a fill
 * that arrives before the ack is never regressed by the late ack.
 *
 * <p><b>Thread safety:</b> submissions for one instrument are serialized by its lane;
 * fills arrive on the gateway's thread. Every mutation of an {@link Order} happens while
 * holding that order's monitor.
 */
@Service
public class OrderExecutionManager {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionManager.class);

    private static final int PRICE_SCALE = 8;

    private final ExchangeGateway exchangeGateway;
    private final PositionRiskTracker positionRiskTracker;
    private final IdempotencyKeyGenerator keyGenerator;
    private final TradeJournal tradeJournal;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Duration ackTimeout;
    private final RetryConfig retryConfig;

    private final Map<String, Order> ordersByKey = new ConcurrentHashMap<>();
    private final Map<String, String> activeKeyByInstrument = new ConcurrentHashMap<>();
    private final Set<String> seenFillIds = ConcurrentHashMap.newKeySet();

    private final AtomicInteger submissionsInProgress = new AtomicInteger();
    private final Object quiescenceMonitor = new Object();

    public OrderExecutionManager(
            ExchangeGateway exchangeGateway,
            PositionRiskTracker positionRiskTracker,
            IdempotencyKeyGenerator keyGenerator,
            TradeJournal tradeJournal,
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            RetryPolicy retryPolicy,
            @Value("${tradepilot.execution.ack-timeout-ms:1000}") long ackTimeoutMs) {
        this.exchangeGateway = exchangeGateway;
        this.positionRiskTracker = positionRiskTracker;
        this.keyGenerator = keyGenerator;
        this.tradeJournal = tradeJournal;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.ackTimeout = Duration.ofMillis(ackTimeoutMs);
        this.retryConfig = RetryConfig.<SubmissionResult>custom()
                .maxAttempts(retryPolicy.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        retryPolicy.getInitialBackoff(), retryPolicy.getMultiplier(), retryPolicy.getMaxBackoff()))
                .retryOnResult(SubmissionResult::isRetryable)
                .build();
    }

    @PostConstruct
    void subscribeToFills() {
        exchangeGateway.streamFills(this::onFill);
        log.info("Subscribed to exchange fills: ackTimeout={}ms retry={}", ackTimeout.toMillis(), retryPolicy);
    }

    // ==================== Submission ====================

    /**
     * Places the order for an actionable signal and blocks until the exchange acks it,
     * rejects it, or the retry policy is exhausted.
     *
     * @return the ACKED order (or a later state if fills already arrived), or the
     *     existing order if this signal was submitted before
     * @throws OrderInFlightException  another order for the instrument is not yet terminal
     * @throws RiskRejectedException   the risk gate denied the order; nothing was placed
     * @throws OrderRejectedException  the exchange rejected the order
     * @throws ExchangeTimeoutException no ack after every attempt; the order is now UNKNOWN
     */
    public Order submit(Signal signal, Instrument instrument) {
        String instrumentId = instrument.getId();
        String key = keyGenerator.generate(instrumentId, signal.sequence());

        Order existing = ordersByKey.get(key);
        if (existing != null) {
            log.info(
                    "Signal already submitted, returning existing order: instrument={} key={} status={}",
                    instrumentId,
                    key,
                    existing.getStatus());
            return existing;
        }

        Optional<Order> active = activeOrder(instrumentId);
        if (active.isPresent()) {
            log.info(
                    "Order in flight, dropping signal: instrument={} activeKey={} status={} signal={}",
                    instrumentId,
                    active.get().getIdempotencyKey(),
                    active.get().getStatus(),
                    signal.type());
            throw new OrderInFlightException(instrumentId, active.get().getIdempotencyKey());
        }

        OrderRequest request = buildRequest(signal, instrument);
        RiskDecision decision = positionRiskTracker.authorize(instrument, request);
        if (decision.isDenied()) {
            throw new RiskRejectedException(instrumentId, decision.getViolations());
        }

        Instant now = clock.instant();
        Order order = Order.builder()
                .idempotencyKey(key)
                .instrumentId(instrumentId)
                .side(request.getSide())
                .type(request.getType())
                .size(request.getSize())
                .status(OrderStatus.PENDING)
                .signalType(signal.type())
                .signalSequence(signal.sequence())
                .ruleName(signal.ruleName())
                .submittedAt(now)
                .updatedAt(now)
                .build();
        ordersByKey.put(key, order);
        activeKeyByInstrument.put(instrumentId, key);

        log.info(
                "Order submitted: instrument={} key={} {} {} signal={} seq={} rule={}",
                instrumentId,
                key,
                order.getSide(),
                order.getSize(),
                signal.type(),
                signal.sequence(),
                signal.ruleName());
        eventPublisherHelper.publishOrderSubmitted(this, order);

        submissionsInProgress.incrementAndGet();
        try {
            SubmissionResult result = placeWithRetry(order);
            return handleResult(order, result);
        } finally {
            if (submissionsInProgress.decrementAndGet() == 0) {
                synchronized (quiescenceMonitor) {
                    quiescenceMonitor.notifyAll();
                }
            }
        }
    }

    private OrderRequest buildRequest(Signal signal, Instrument instrument) {
        Position position = positionRiskTracker.getPosition(instrument.getId());
        OrderSide side;
        BigDecimal size;
        if (signal.type() == SignalType.ENTER_LONG) {
            side = OrderSide.BUY;
            size = instrument.entryOrderSize();
        } else if (signal.type() == SignalType.ENTER_SHORT) {
            side = OrderSide.SELL;
            size = instrument.entryOrderSize();
        } else if (signal.type() == SignalType.EXIT && position.isOpen()) {
            side = position.getSide().exitSide();
            size = position.getSize();
        } else {
            throw new InvalidOrderStateException(
                    "Signal " + signal.type() + " cannot be executed from " + position.getSide() + " for "
                            + instrument.getId());
        }

        return OrderRequest.builder()
                .instrumentId(instrument.getId())
                .side(side)
                .size(size)
                .referencePrice(referencePrice(signal, position))
                .signalType(signal.type())
                .signalSequence(signal.sequence())
                .ruleName(signal.ruleName())
                .build();
    }

    /** Last traded price from the snapshot, falling back to the position's mark. */
    private BigDecimal referencePrice(Signal signal, Position position) {
        double ltp = signal.snapshot() != null ? signal.snapshot().get(IndicatorFactory.ltpKey()) : Double.NaN;
        if (Double.isFinite(ltp)) {
            return BigDecimal.valueOf(ltp);
        }
        if (position.getMarkPrice() != null) {
            return position.getMarkPrice();
        }
        throw new InvalidOrderStateException("No reference price available for " + signal.instrumentId());
    }

    private SubmissionResult placeWithRetry(Order order) {
        Retry retry = Retry.of("exchange-" + order.getIdempotencyKey(), retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "Retrying submission: key={} attempt={} wait={}ms",
                        order.getIdempotencyKey(),
                        event.getNumberOfRetryAttempts() + 1,
                        event.getWaitInterval().toMillis()));

        AtomicInteger attempt = new AtomicInteger();
        return retry.executeSupplier(() -> attemptOnce(order, attempt.incrementAndGet()));
    }

    private SubmissionResult attemptOnce(Order order, int attempt) {
        synchronized (order) {
            order.setAttempts(attempt);
        }
        try {
            ExchangeResponse response = exchangeGateway
                    .placeOrder(
                            order.getInstrumentId(),
                            order.getSide(),
                            order.getSize(),
                            order.getType(),
                            order.getIdempotencyKey())
                    .get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response.isAccepted()) {
                return SubmissionResult.acked(response.getExchangeOrderId(), attempt);
            }
            return SubmissionResult.rejected(response.getRejectionReason(), attempt);
        } catch (TimeoutException e) {
            log.warn(
                    "No ack within {}ms: key={} attempt={}",
                    ackTimeout.toMillis(),
                    order.getIdempotencyKey(),
                    attempt);
            return SubmissionResult.timeout(attempt);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Exchange call failed: key={} attempt={} error={}", order.getIdempotencyKey(), attempt, cause.toString());
            return SubmissionResult.transportError(cause.toString(), attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SubmissionResult.transportError("Interrupted while awaiting ack", attempt);
        } catch (RuntimeException e) {
            log.warn("Exchange call failed: key={} attempt={} error={}", order.getIdempotencyKey(), attempt, e.toString());
            return SubmissionResult.transportError(e.toString(), attempt);
        }
    }

    private Order handleResult(Order order, SubmissionResult result) {
        String instrumentId = order.getInstrumentId();
        String key = order.getIdempotencyKey();

        switch (result.getStatus()) {
            case ACKED -> {
                synchronized (order) {
                    order.setExchangeOrderId(result.getExchangeOrderId());
                    if (!transition(order, OrderStatus.ACKED)) {
                        log.debug("Late ack ignored: key={} status={}", key, order.getStatus());
                    }
                }
                log.info(
                        "Order acked: instrument={} key={} exchangeOrderId={} attempts={}",
                        instrumentId,
                        key,
                        result.getExchangeOrderId(),
                        result.getAttempt());
                return order;
            }
            case REJECTED -> {
                synchronized (order) {
                    order.setRejectionReason(result.getDetail());
                    transition(order, OrderStatus.REJECTED);
                }
                positionRiskTracker.release(instrumentId);
                log.warn("Order rejected by exchange: instrument={} key={} reason={}", instrumentId, key, result.getDetail());
                eventPublisherHelper.publishDecision(
                        this,
                        "ORDER",
                        "Order rejected: " + result.getDetail(),
                        instrumentId,
                        Map.of("idempotencyKey", key, "attempts", result.getAttempt()));
                throw new OrderRejectedException(instrumentId, key, result.getDetail());
            }
            default -> {
                boolean escalated;
                synchronized (order) {
                    escalated = transition(order, OrderStatus.UNKNOWN);
                }
                if (!escalated) {
                    // fills arrived while retrying; the exchange evidently has the order
                    log.info("Order confirmed by fills during retry: key={} status={}", key, order.getStatus());
                    return order;
                }
                log.error(
                        "Order state unknown after {} attempts: instrument={} key={} lastResult={}",
                        result.getAttempt(),
                        instrumentId,
                        key,
                        result.getStatus());
                eventPublisherHelper.publishRiskEvent(
                        this,
                        RiskEventType.UNCONFIRMED_ORDER,
                        RiskLevel.CRITICAL,
                        "Order " + key + " for " + instrumentId + " unconfirmed after " + result.getAttempt()
                                + " attempts",
                        Map.of(
                                "instrumentId", instrumentId,
                                "idempotencyKey", key,
                                "attempts", result.getAttempt(),
                                "lastResult", result.getStatus().name()));
                throw new ExchangeTimeoutException(instrumentId, key, result.getAttempt());
            }
        }
    }

    // ==================== Fills ====================

    /**
     * Applies an exchange fill. Duplicates (by fill id) and fills for keys this manager
     * never issued are dropped. The applied size never exceeds the order's remaining size,
     * so a real fill arriving after an operator resolved the order as FILLED is absorbed.
     */
    public void onFill(FillEvent fill) {
        if (!seenFillIds.add(fill.getFillId())) {
            log.debug("Duplicate fill dropped: fillId={} key={}", fill.getFillId(), fill.getIdempotencyKey());
            return;
        }
        Order order = ordersByKey.get(fill.getIdempotencyKey());
        if (order == null) {
            log.warn(
                    "Fill for unknown order dropped: fillId={} key={} instrument={}",
                    fill.getFillId(),
                    fill.getIdempotencyKey(),
                    fill.getInstrumentId());
            return;
        }

        boolean terminal;
        synchronized (order) {
            BigDecimal applied = fill.getSize().min(order.getRemainingSize());
            if (applied.signum() <= 0) {
                // already fully accounted for, e.g. by an operator resolution
                log.warn(
                        "Fill beyond order size dropped: key={} fillId={} status={} size={} price={}",
                        order.getIdempotencyKey(),
                        fill.getFillId(),
                        order.getStatus(),
                        fill.getSize(),
                        fill.getPrice());
                return;
            }
            if (applied.compareTo(fill.getSize()) < 0) {
                log.warn(
                        "Fill clamped to remaining size: key={} fillId={} size={} applied={}",
                        order.getIdempotencyKey(),
                        fill.getFillId(),
                        fill.getSize(),
                        applied);
                fill = FillEvent.builder()
                        .fillId(fill.getFillId())
                        .idempotencyKey(fill.getIdempotencyKey())
                        .instrumentId(fill.getInstrumentId())
                        .side(fill.getSide())
                        .size(applied)
                        .price(fill.getPrice())
                        .timestamp(fill.getTimestamp())
                        .build();
            }

            BigDecimal previousFilled = order.getFilledSize();
            BigDecimal filled = previousFilled.add(applied);
            BigDecimal previousNotional = order.getAverageFillPrice() != null
                    ? order.getAverageFillPrice().multiply(previousFilled)
                    : BigDecimal.ZERO;
            BigDecimal averagePrice = previousNotional
                    .add(fill.getPrice().multiply(applied))
                    .divide(filled, PRICE_SCALE, RoundingMode.HALF_UP);

            order.setFilledSize(filled);
            order.setAverageFillPrice(averagePrice);

            OrderStatus target =
                    filled.compareTo(order.getSize()) >= 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
            if (!transition(order, target)) {
                // an operator closed the order as REJECTED or CANCELLED but the exchange executed it
                log.warn(
                        "Fill on order in status {}: key={} fillId={}; position updated",
                        order.getStatus(),
                        order.getIdempotencyKey(),
                        fill.getFillId());
            }

            FillEvent appliedFill = fill;
            positionRiskTracker.apply(appliedFill).ifPresent(position -> tradeJournal.record(appliedFill, position));
            terminal = order.getStatus().isTerminal();
        }

        if (terminal) {
            positionRiskTracker.release(order.getInstrumentId());
        }
    }

    // ==================== Reconciliation ====================

    /**
     * Operator reconciliation of an UNKNOWN order into a terminal state.
     *
     * <p>FILLED applies a synthetic fill for the unfilled remainder at {@code fillPrice};
     * REJECTED and CANCELLED release the order's risk reservation.
     *
     * @throws ResourceNotFoundException   no order with this key
     * @throws InvalidOrderStateException  the order is not UNKNOWN, the target is not
     *     terminal, or FILLED was requested without a price
     */
    public Order resolveUnknown(String idempotencyKey, OrderStatus resolution, BigDecimal fillPrice) {
        Order order = getOrder(idempotencyKey)
                .orElseThrow(() -> new ResourceNotFoundException("Order", idempotencyKey));
        if (!resolution.isTerminal()) {
            throw new InvalidOrderStateException("Resolution must be a terminal status, got " + resolution);
        }

        BigDecimal remaining;
        synchronized (order) {
            if (order.getStatus() != OrderStatus.UNKNOWN) {
                throw new InvalidOrderStateException(
                        "Order " + idempotencyKey + " is " + order.getStatus() + ", only UNKNOWN orders can be resolved");
            }
            remaining = order.getRemainingSize();
            if (resolution == OrderStatus.FILLED && remaining.signum() > 0 && fillPrice == null) {
                throw new InvalidOrderStateException("A fill price is required to resolve " + idempotencyKey + " as FILLED");
            }
            if (resolution != OrderStatus.FILLED) {
                transition(order, resolution);
            }
        }

        if (resolution == OrderStatus.FILLED && remaining.signum() > 0) {
            onFill(FillEvent.builder()
                    .fillId("resolve-" + idempotencyKey)
                    .idempotencyKey(idempotencyKey)
                    .instrumentId(order.getInstrumentId())
                    .side(order.getSide())
                    .size(remaining)
                    .price(fillPrice)
                    .timestamp(clock.instant())
                    .build());
        } else if (resolution == OrderStatus.FILLED) {
            synchronized (order) {
                transition(order, OrderStatus.FILLED);
            }
        } else {
            positionRiskTracker.release(order.getInstrumentId());
        }

        log.info("Order resolved by operator: key={} resolution={}", idempotencyKey, resolution);
        eventPublisherHelper.publishOrderEvent(this, order, OrderEventType.RESOLVED, OrderStatus.UNKNOWN);
        return order;
    }

    /**
     * Blocks until no submission is in progress or the timeout elapses.
     *
     * @return true if quiescent
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (quiescenceMonitor) {
            while (submissionsInProgress.get() > 0) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    log.warn("Submissions still in progress after {}: count={}", timeout, submissionsInProgress.get());
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(quiescenceMonitor, remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    // ==================== Queries ====================

    public Optional<Order> getOrder(String idempotencyKey) {
        return Optional.ofNullable(ordersByKey.get(idempotencyKey));
    }

    /** Every order, most recent first. */
    public List<Order> getOrders() {
        return ordersByKey.values().stream()
                .sorted(Comparator.comparing(Order::getSubmittedAt).reversed())
                .toList();
    }

    public List<Order> getOrders(OrderStatus status) {
        return getOrders().stream().filter(order -> order.getStatus() == status).toList();
    }

    public List<Order> getUnknownOrders() {
        return getOrders(OrderStatus.UNKNOWN);
    }

    /** The instrument's order that is not yet terminal, if any. */
    public Optional<Order> activeOrder(String instrumentId) {
        String key = activeKeyByInstrument.get(instrumentId);
        if (key == null) {
            return Optional.empty();
        }
        return getOrder(key).filter(order -> order.getStatus().isInFlight());
    }

    public int submissionsInProgress() {
        return submissionsInProgress.get();
    }

    // ==================== Internal ====================

    /** Moves the order forward and publishes the change. Caller holds the order's monitor. */
    private boolean transition(Order order, OrderStatus next) {
        OrderStatus previous = order.getStatus();
        if (!previous.canTransitionTo(next)) {
            return false;
        }
        order.setStatus(next);
        order.setUpdatedAt(clock.instant());
        eventPublisherHelper.publishOrderEvent(this, order, eventTypeFor(next), previous);
        return true;
    }

    private static OrderEventType eventTypeFor(OrderStatus status) {
        return switch (status) {
            case PENDING -> OrderEventType.SUBMITTED;
            case ACKED -> OrderEventType.ACKED;
            case PARTIALLY_FILLED -> OrderEventType.PARTIALLY_FILLED;
            case FILLED -> OrderEventType.FILLED;
            case REJECTED -> OrderEventType.REJECTED;
            case CANCELLED -> OrderEventType.CANCELLED;
            case UNKNOWN -> OrderEventType.UNKNOWN;
        };
    }
}
