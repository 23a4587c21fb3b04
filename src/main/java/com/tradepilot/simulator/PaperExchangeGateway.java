package com.tradepilot.simulator;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.exchange.ExchangeGateway;
import com.tradepilot.exchange.ExchangeResponse;
import com.tradepilot.marketdata.MarketDataCache;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * In-process exchange for paper trading.
 *
 * <p>MARKET orders fill in full at the last cached close plus slippage, shortly after
 * the ack. The idempotency key identifies the order: placing a key again returns the
 * original verdict and never fills twice.
 *
 * <p>Failure injection ({@link SimulatorConfig}):
 * <ul>
 *   <li>{@code rejectProbability}: the order is rejected</li>
 *   <li>{@code lostAckProbability}: the order is accepted and filled but the ack of
 *       this placement is never delivered</li>
 * </ul>
 */
@Service
@ConditionalOnProperty(name = "tradepilot.exchange.mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private static final BigDecimal BPS = new BigDecimal("10000");

    private final MarketDataCache marketDataCache;
    private final SimulatorConfig simulatorConfig;
    private final Clock clock;
    private final Random random;

    private final Map<String, ExchangeResponse> verdictsByKey = new ConcurrentHashMap<>();
    private final List<Consumer<FillEvent>> fillConsumers = new CopyOnWriteArrayList<>();
    private final AtomicLong orderCounter = new AtomicLong();
    private final AtomicLong fillCounter = new AtomicLong();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "paper-exchange");
        thread.setDaemon(true);
        return thread;
    });

    public PaperExchangeGateway(MarketDataCache marketDataCache, SimulatorConfig simulatorConfig, Clock clock) {
        this.marketDataCache = marketDataCache;
        this.simulatorConfig = simulatorConfig;
        this.clock = clock;
        this.random = new Random(simulatorConfig.getSeed());
    }

    @Override
    public CompletableFuture<ExchangeResponse> placeOrder(
            String instrumentId, OrderSide side, BigDecimal size, OrderType type, String idempotencyKey) {
        CompletableFuture<ExchangeResponse> future = new CompletableFuture<>();

        ExchangeResponse previous = verdictsByKey.get(idempotencyKey);
        if (previous != null) {
            log.info("Paper order replayed: key={} accepted={}", idempotencyKey, previous.isAccepted());
            acknowledge(future, previous);
            return future;
        }

        ExchangeResponse verdict = decide(instrumentId, type);
        ExchangeResponse existing = verdictsByKey.putIfAbsent(idempotencyKey, verdict);
        if (existing != null) {
            acknowledge(future, existing);
            return future;
        }

        log.info(
                "Paper order {}: key={} {} {} {} {}",
                verdict.isAccepted() ? "accepted" : "rejected",
                idempotencyKey,
                side,
                size,
                instrumentId,
                verdict.isAccepted() ? verdict.getExchangeOrderId() : verdict.getRejectionReason());

        if (verdict.isAccepted()) {
            scheduleFill(instrumentId, side, size, idempotencyKey);
        }
        if (verdict.isAccepted() && chance(simulatorConfig.getLostAckProbability())) {
            log.warn("Paper ack dropped: key={}", idempotencyKey);
            return future;
        }
        acknowledge(future, verdict);
        return future;
    }

    @Override
    public void streamFills(Consumer<FillEvent> consumer) {
        fillConsumers.add(consumer);
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }

    private ExchangeResponse decide(String instrumentId, OrderType type) {
        if (type != OrderType.MARKET) {
            return ExchangeResponse.rejected("Paper exchange supports MARKET orders only");
        }
        if (marketDataCache.latest(instrumentId).isEmpty()) {
            return ExchangeResponse.rejected("No price available for " + instrumentId);
        }
        if (chance(simulatorConfig.getRejectProbability())) {
            return ExchangeResponse.rejected("Simulated rejection");
        }
        return ExchangeResponse.accepted("PAPER-" + orderCounter.incrementAndGet());
    }

    private void acknowledge(CompletableFuture<ExchangeResponse> future, ExchangeResponse verdict) {
        scheduler.schedule(() -> future.complete(verdict), simulatorConfig.getAckLatencyMs(), TimeUnit.MILLISECONDS);
    }

    private void scheduleFill(String instrumentId, OrderSide side, BigDecimal size, String idempotencyKey) {
        long delay = simulatorConfig.getAckLatencyMs() + simulatorConfig.getFillDelayMs();
        scheduler.schedule(() -> deliverFill(instrumentId, side, size, idempotencyKey), delay, TimeUnit.MILLISECONDS);
    }

    private void deliverFill(String instrumentId, OrderSide side, BigDecimal size, String idempotencyKey) {
        Optional<PriceBar> latest = marketDataCache.latest(instrumentId);
        if (latest.isEmpty()) {
            log.warn("Paper fill skipped, no price: key={} instrument={}", idempotencyKey, instrumentId);
            return;
        }
        FillEvent fill = FillEvent.builder()
                .fillId("PF-" + fillCounter.incrementAndGet())
                .idempotencyKey(idempotencyKey)
                .instrumentId(instrumentId)
                .side(side)
                .size(size)
                .price(fillPrice(latest.get().getClose(), side))
                .timestamp(clock.instant())
                .build();
        for (Consumer<FillEvent> consumer : fillConsumers) {
            try {
                consumer.accept(fill);
            } catch (RuntimeException e) {
                log.error("Fill consumer failed: fillId={} key={}", fill.getFillId(), idempotencyKey, e);
            }
        }
    }

    BigDecimal fillPrice(double close, OrderSide side) {
        BigDecimal price = BigDecimal.valueOf(close);
        BigDecimal slippage = price.multiply(BigDecimal.valueOf(simulatorConfig.getSlippageBps()))
                .divide(BPS, 8, RoundingMode.HALF_UP);
        return side == OrderSide.BUY ? price.add(slippage) : price.subtract(slippage);
    }

    private boolean chance(double probability) {
        if (probability <= 0) {
            return false;
        }
        synchronized (random) {
            return random.nextDouble() < probability;
        }
    }
}
