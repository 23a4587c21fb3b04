package com.tradepilot.risk;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.domain.model.Position;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.event.PositionEventType;
import com.tradepilot.event.RiskEventType;
import com.tradepilot.event.RiskLevel;
import com.tradepilot.oms.OrderRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authoritative record of exposure per instrument and the pre-trade risk gate.
 *
 * <p>Every instrument has its own {@link ReentrantLock}; {@link #authorize}, {@link #apply}
 * and {@link #mark} for the same instrument never interleave. Positions are immutable
 * snapshots swapped into a {@link ConcurrentHashMap}, so readers (the Signal Evaluator,
 * the REST surface) never need the lock.
 *
 * <p>Checks performed by {@link #authorize} for orders that add exposure:
 * <ol>
 *   <li>Resulting position size against the instrument's max position size</li>
 *   <li>Resulting position notional against the instrument's max notional</li>
 *   <li>Number of instruments with open or in-flight exposure against max open positions</li>
 *   <li>Total notional (open positions at mark + in-flight reservations) against the global cap</li>
 * </ol>
 * Orders that only reduce or close the current position are always allowed.
 *
 * <p>An allowed entry reserves its notional until it is filled or released. The
 * account-wide check-and-reserve step runs under a short exposure lock so two
 * instruments authorizing at the same time cannot both slip under the cap.
 */
@Service
public class PositionRiskTracker {

    private static final Logger log = LoggerFactory.getLogger(PositionRiskTracker.class);

    static final int REJECTION_HISTORY_SIZE = 200;

    private static final int PRICE_SCALE = 8;

    private final RiskLimits riskLimits;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> instrumentLocks = new ConcurrentHashMap<>();
    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();
    private final Set<String> appliedFillIds = ConcurrentHashMap.newKeySet();
    private final ConcurrentLinkedDeque<RiskRejection> rejections = new ConcurrentLinkedDeque<>();
    private final Object exposureLock = new Object();

    public PositionRiskTracker(RiskLimits riskLimits, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.riskLimits = riskLimits;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==================== Authorization ====================

    /**
     * Decides whether the order may proceed. An allowed entry reserves its notional;
     * a denied one is recorded and published as a {@link com.tradepilot.event.RiskEvent}.
     */
    public RiskDecision authorize(Instrument instrument, OrderRequest request) {
        String instrumentId = instrument.getId();
        RiskDecision decision = withInstrumentLock(instrumentId, () -> evaluate(instrument, request));

        if (decision.isDenied()) {
            recordRejection(request, decision.getViolations());
        }
        return decision;
    }

    private RiskDecision evaluate(Instrument instrument, OrderRequest request) {
        String instrumentId = instrument.getId();
        Position current = getPosition(instrumentId);
        List<RiskViolation> violations = new ArrayList<>();

        if (request.getSize() == null || request.getSize().signum() <= 0) {
            violations.add(RiskViolation.of(RiskViolation.INVALID_ORDER_SIZE, "Order size must be positive"));
            return RiskDecision.deny(violations);
        }

        if (reducesExposure(current, request)) {
            log.debug("Reducing order allowed: instrument={} side={} size={}", instrumentId, request.getSide(), request.getSize());
            return RiskDecision.allow();
        }

        BigDecimal resultingSize = resultingSize(current, request);
        BigDecimal price = request.getReferencePrice();

        if (instrument.getMaxPositionSize() != null && resultingSize.compareTo(instrument.getMaxPositionSize()) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.POSITION_SIZE_EXCEEDED,
                    String.format(
                            "Position size %s would exceed max %s",
                            resultingSize.toPlainString(), instrument.getMaxPositionSize().toPlainString())));
        }

        BigDecimal resultingNotional = resultingSize.multiply(price);
        if (instrument.getMaxNotional() != null && resultingNotional.compareTo(instrument.getMaxNotional()) > 0) {
            violations.add(RiskViolation.of(
                    RiskViolation.INSTRUMENT_NOTIONAL_EXCEEDED,
                    String.format(
                            "Position notional %s would exceed instrument max %s",
                            resultingNotional.toPlainString(), instrument.getMaxNotional().toPlainString())));
        }

        synchronized (exposureLock) {
            boolean newExposure = !current.isOpen() && !reservations.containsKey(instrumentId);
            int exposedInstruments = exposedInstrumentCount();
            if (newExposure
                    && riskLimits.getMaxOpenPositions() != null
                    && exposedInstruments + 1 > riskLimits.getMaxOpenPositions()) {
                violations.add(RiskViolation.of(
                        RiskViolation.MAX_OPEN_POSITIONS_REACHED,
                        String.format(
                                "Open positions %d already at max %d",
                                exposedInstruments, riskLimits.getMaxOpenPositions())));
            }

            BigDecimal orderNotional = request.notional();
            BigDecimal exposure = totalExposureUnlocked();
            BigDecimal projected = exposure.add(orderNotional);
            if (riskLimits.getMaxTotalNotional() != null && projected.compareTo(riskLimits.getMaxTotalNotional()) > 0) {
                violations.add(RiskViolation.of(
                        RiskViolation.TOTAL_NOTIONAL_EXCEEDED,
                        String.format(
                                "Total notional %s + %s would exceed cap %s",
                                exposure.toPlainString(),
                                orderNotional.toPlainString(),
                                riskLimits.getMaxTotalNotional().toPlainString())));
            }

            if (!violations.isEmpty()) {
                return RiskDecision.deny(violations);
            }

            reservations.merge(
                    instrumentId,
                    new Reservation(request.getSize(), price),
                    (existing, added) -> new Reservation(existing.size().add(added.size()), added.price()));
        }

        log.debug(
                "Order authorized: instrument={} side={} size={} notional={}",
                instrumentId,
                request.getSide(),
                request.getSize(),
                request.notional());
        return RiskDecision.allow();
    }

    /**
     * Drops any remaining reservation for the instrument. Called when its in-flight
     * order ends without (further) fills: rejected, cancelled, or resolved by the operator.
     */
    public void release(String instrumentId) {
        withInstrumentLock(instrumentId, () -> {
            synchronized (exposureLock) {
                Reservation removed = reservations.remove(instrumentId);
                if (removed != null) {
                    log.debug("Reservation released: instrument={} size={}", instrumentId, removed.size());
                }
            }
            return null;
        });
    }

    // ==================== Fills ====================

    /**
     * Applies a fill to the instrument's position. Idempotent by fill id: a fill seen
     * before returns empty and leaves the position unchanged.
     *
     * @return the position after the fill, or empty if the fill was a duplicate
     */
    public Optional<Position> apply(FillEvent fill) {
        String instrumentId = fill.getInstrumentId();
        return withInstrumentLock(instrumentId, () -> {
            if (appliedFillIds.contains(fill.getFillId())) {
                log.debug("Duplicate fill ignored: fillId={} instrument={}", fill.getFillId(), instrumentId);
                return Optional.empty();
            }

            Position before = getPosition(instrumentId);
            Instant now = clock.instant();
            Position after = applyFill(before, fill, now);

            synchronized (exposureLock) {
                positions.put(instrumentId, after);
                consumeReservation(instrumentId, fill.getSize());
            }
            appliedFillIds.add(fill.getFillId());

            PositionEventType eventType = classify(before, after);
            log.info(
                    "Fill applied: instrument={} fillId={} {} {} @ {} -> side={} size={} avgEntry={} realizedPnl={}",
                    instrumentId,
                    fill.getFillId(),
                    fill.getSide(),
                    fill.getSize(),
                    fill.getPrice(),
                    after.getSide(),
                    after.getSize(),
                    after.getAverageEntryPrice(),
                    after.getRealizedPnl());
            eventPublisherHelper.publishPositionEvent(this, before, after, eventType);
            return Optional.of(after);
        });
    }

    /** Updates the mark price used for exposure and unrealized P&amp;L. */
    public void mark(String instrumentId, BigDecimal price) {
        withInstrumentLock(instrumentId, () -> {
            Position current = getPosition(instrumentId);
            positions.put(
                    instrumentId,
                    current.toBuilder().markPrice(price).updatedAt(clock.instant()).build());
            return null;
        });
    }

    // ==================== Queries ====================

    /** Current position snapshot; a FLAT placeholder for instruments never traded. */
    public Position getPosition(String instrumentId) {
        return positions.getOrDefault(instrumentId, Position.flat(instrumentId));
    }

    public PositionSide sideOf(String instrumentId) {
        return getPosition(instrumentId).getSide();
    }

    /** Every position ever opened, including those now flat. */
    public Collection<Position> getPositions() {
        return positions.values().stream()
                .filter(p -> p.isOpen() || p.getOpenedAt() != null)
                .toList();
    }

    public List<Position> getOpenPositions() {
        return positions.values().stream().filter(Position::isOpen).toList();
    }

    /** Open position notional at mark plus reserved notional of in-flight entries. */
    public BigDecimal totalExposure() {
        synchronized (exposureLock) {
            return totalExposureUnlocked();
        }
    }

    public BigDecimal realizedPnl() {
        return positions.values().stream().map(Position::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal unrealizedPnl() {
        return positions.values().stream().map(Position::unrealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Most recent denied authorizations, newest first. */
    public List<RiskRejection> getRecentRejections() {
        return List.copyOf(rejections);
    }

    // ==================== Internal ====================

    private boolean reducesExposure(Position current, OrderRequest request) {
        return current.isOpen()
                && request.getSide() == current.getSide().exitSide()
                && request.getSize().compareTo(current.getSize()) <= 0;
    }

    private BigDecimal resultingSize(Position current, OrderRequest request) {
        BigDecimal delta = request.getSide() == OrderSide.BUY ? request.getSize() : request.getSize().negate();
        BigDecimal pending = reservations.containsKey(current.getInstrumentId())
                ? reservations.get(current.getInstrumentId()).size()
                : BigDecimal.ZERO;
        return current.signedSize().add(delta).abs().add(pending);
    }

    private int exposedInstrumentCount() {
        Set<String> exposed = new HashSet<>(reservations.keySet());
        positions.values().stream().filter(Position::isOpen).forEach(p -> exposed.add(p.getInstrumentId()));
        return exposed.size();
    }

    private BigDecimal totalExposureUnlocked() {
        BigDecimal open = positions.values().stream().map(Position::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal reserved =
                reservations.values().stream().map(Reservation::notional).reduce(BigDecimal.ZERO, BigDecimal::add);
        return open.add(reserved);
    }

    private void consumeReservation(String instrumentId, BigDecimal filledSize) {
        reservations.computeIfPresent(instrumentId, (id, reservation) -> {
            BigDecimal remaining = reservation.size().subtract(filledSize);
            return remaining.signum() > 0 ? new Reservation(remaining, reservation.price()) : null;
        });
    }

    /**
     * Pure position arithmetic for one fill: opens, increases (weighted average entry),
     * reduces or closes (realizing P&amp;L on the closed size), or flips through zero.
     */
    static Position applyFill(Position before, FillEvent fill, Instant now) {
        BigDecimal fillSize = fill.getSize();
        BigDecimal price = fill.getPrice();
        BigDecimal signedBefore = before.signedSize();
        BigDecimal delta = fill.getSide() == OrderSide.BUY ? fillSize : fillSize.negate();
        BigDecimal signedAfter = signedBefore.add(delta);

        Position.PositionBuilder next = before.toBuilder().markPrice(price).updatedAt(now);

        if (signedBefore.signum() == 0) {
            return next.side(sideOf(signedAfter))
                    .size(signedAfter.abs())
                    .averageEntryPrice(price)
                    .openedAt(now)
                    .closedAt(null)
                    .build();
        }

        if (signedBefore.signum() == delta.signum()) {
            BigDecimal existingCost = before.getSize().multiply(before.getAverageEntryPrice());
            BigDecimal addedCost = fillSize.multiply(price);
            BigDecimal newSize = before.getSize().add(fillSize);
            BigDecimal average = existingCost.add(addedCost).divide(newSize, PRICE_SCALE, RoundingMode.HALF_UP);
            return next.size(newSize).averageEntryPrice(average).build();
        }

        BigDecimal closedSize = fillSize.min(before.getSize());
        BigDecimal direction = BigDecimal.valueOf(signedBefore.signum());
        BigDecimal realized =
                price.subtract(before.getAverageEntryPrice()).multiply(closedSize).multiply(direction);
        next.realizedPnl(before.getRealizedPnl().add(realized));

        if (signedAfter.signum() == 0) {
            return next.side(PositionSide.FLAT)
                    .size(BigDecimal.ZERO)
                    .averageEntryPrice(null)
                    .closedAt(now)
                    .build();
        }
        if (signedAfter.signum() == signedBefore.signum()) {
            return next.size(signedAfter.abs()).build();
        }
        return next.side(sideOf(signedAfter))
                .size(signedAfter.abs())
                .averageEntryPrice(price)
                .openedAt(now)
                .closedAt(null)
                .build();
    }

    private static PositionSide sideOf(BigDecimal signedSize) {
        return signedSize.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    private static PositionEventType classify(Position before, Position after) {
        if (!before.isOpen()) {
            return PositionEventType.OPENED;
        }
        if (!after.isOpen()) {
            return PositionEventType.CLOSED;
        }
        if (before.getSide() != after.getSide()) {
            return PositionEventType.FLIPPED;
        }
        return after.getSize().compareTo(before.getSize()) > 0 ? PositionEventType.INCREASED : PositionEventType.REDUCED;
    }

    private void recordRejection(OrderRequest request, List<RiskViolation> violations) {
        RiskRejection rejection = new RiskRejection(
                clock.instant(),
                request.getInstrumentId(),
                request.getSide(),
                request.getSize(),
                request.getReferencePrice(),
                violations);
        rejections.addFirst(rejection);
        while (rejections.size() > REJECTION_HISTORY_SIZE) {
            rejections.pollLast();
        }

        log.warn("Risk check denied order: instrument={} violations={}", request.getInstrumentId(), violations);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.ORDER_DENIED,
                RiskLevel.WARNING,
                "Order denied for " + request.getInstrumentId(),
                Map.of(
                        "instrumentId", request.getInstrumentId(),
                        "violations", violations.stream().map(RiskViolation::getCode).toList()));
    }

    private <T> T withInstrumentLock(String instrumentId, Supplier<T> action) {
        ReentrantLock lock = instrumentLocks.computeIfAbsent(instrumentId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /** Size and reference price of an authorized, not yet filled entry. */
    private record Reservation(BigDecimal size, BigDecimal price) {
        BigDecimal notional() {
            return size.multiply(price);
        }
    }
}
