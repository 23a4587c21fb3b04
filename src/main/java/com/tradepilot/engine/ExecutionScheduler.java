package com.tradepilot.engine;

import com.tradepilot.config.InstrumentRegistry;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.exception.EngineUnavailableException;
import com.tradepilot.indicator.IndicatorEngine;
import com.tradepilot.marketdata.MarketDataCache;
import com.tradepilot.marketdata.MarketDataFeed;
import com.tradepilot.oms.OrderExecutionManager;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives {@link TradingCycle}s: one {@link InstrumentLane} per configured instrument on
 * the shared {@code laneExecutor} pool.
 *
 * <p>Cycles are triggered by:
 * <ul>
 *   <li>the fixed-delay poll of the {@link MarketDataFeed}</li>
 *   <li>{@link #onBar} for bars pushed by a streaming source</li>
 *   <li>{@link #triggerEvaluation} from the REST surface</li>
 * </ul>
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #start()}: verify the cache can hold the indicator lookback, create the
 *       lanes and warm each instrument's cache from the feed</li>
 *   <li>{@link #pause()} / {@link #resume()}: operator switch; while paused bars are
 *       still cached and marked but nothing is evaluated</li>
 *   <li>{@link #stop()}: refuse new cycles, drop queued ones, wait for running cycles,
 *       then wait for in-flight submissions to settle</li>
 * </ol>
 */
@Service
public class ExecutionScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

    private final InstrumentRegistry instrumentRegistry;
    private final MarketDataFeed marketDataFeed;
    private final MarketDataCache marketDataCache;
    private final IndicatorEngine indicatorEngine;
    private final TradingCycle tradingCycle;
    private final OrderExecutionManager orderExecutionManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor laneExecutor;
    private final int warmupBars;
    private final int pollBars;
    private final Duration shutdownTimeout;

    private final Map<String, InstrumentLane> lanes = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused;

    public ExecutionScheduler(
            InstrumentRegistry instrumentRegistry,
            MarketDataFeed marketDataFeed,
            MarketDataCache marketDataCache,
            IndicatorEngine indicatorEngine,
            TradingCycle tradingCycle,
            OrderExecutionManager orderExecutionManager,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("laneExecutor") Executor laneExecutor,
            @Value("${tradepilot.scheduler.warmup-bars:100}") int warmupBars,
            @Value("${tradepilot.scheduler.poll-bars:5}") int pollBars,
            @Value("${tradepilot.scheduler.shutdown-timeout-seconds:30}") int shutdownTimeoutSeconds,
            @Value("${tradepilot.scheduler.start-paused:false}") boolean startPaused) {
        this.instrumentRegistry = instrumentRegistry;
        this.marketDataFeed = marketDataFeed;
        this.marketDataCache = marketDataCache;
        this.indicatorEngine = indicatorEngine;
        this.tradingCycle = tradingCycle;
        this.orderExecutionManager = orderExecutionManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.laneExecutor = laneExecutor;
        this.warmupBars = warmupBars;
        this.pollBars = pollBars;
        this.shutdownTimeout = Duration.ofSeconds(shutdownTimeoutSeconds);
        this.paused = new AtomicBoolean(startPaused);
    }

    // ==================== Lifecycle ====================

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        int lookback = indicatorEngine.lookback();
        if (marketDataCache.getCapacity() < lookback) {
            running.set(false);
            throw new IllegalStateException("tradepilot.market-data.capacity (" + marketDataCache.getCapacity()
                    + ") is below the indicator lookback (" + lookback + ")");
        }

        int barsToLoad = Math.min(Math.max(warmupBars, lookback), marketDataCache.getCapacity());
        for (Instrument instrument : instrumentRegistry.getAll()) {
            lanes.put(instrument.getId(), new InstrumentLane(instrument.getId(), laneExecutor));
            warmUp(instrument, barsToLoad);
        }

        log.info(
                "ExecutionScheduler started: instruments={} lookback={} warmupBars={} paused={}",
                lanes.keySet(),
                lookback,
                barsToLoad,
                paused.get());
        eventPublisherHelper.publishDecision(
                this, "ENGINE", "Execution engine started" + (paused.get() ? " (paused)" : ""));
    }

    private void warmUp(Instrument instrument, int barsToLoad) {
        try {
            List<PriceBar> bars = marketDataFeed.recentBars(instrument.getId(), barsToLoad);
            CycleResult result = tradingCycle.run(instrument, bars, false);
            log.info(
                    "Cache warmed: instrument={} bars={} cached={}",
                    instrument.getId(),
                    result.barsAppended(),
                    marketDataCache.size(instrument.getId()));
        } catch (RuntimeException e) {
            log.warn("Warm-up failed, instrument will fill from live bars: instrument={}", instrument.getId(), e);
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("ExecutionScheduler stopping: timeout={}", shutdownTimeout);
        long deadline = System.nanoTime() + shutdownTimeout.toNanos();

        int dropped = lanes.values().stream().mapToInt(InstrumentLane::close).sum();
        for (InstrumentLane lane : lanes.values()) {
            if (!lane.awaitIdle(remaining(deadline))) {
                log.warn("Lane still busy at shutdown: instrument={}", lane.getInstrumentId());
            }
        }
        boolean quiescent = orderExecutionManager.awaitQuiescence(remaining(deadline));
        log.info(
                "ExecutionScheduler stopped: droppedCycles={} quiescent={} unknownOrders={}",
                dropped,
                quiescent,
                orderExecutionManager.getUnknownOrders().size());
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // stop before the web server and other components shut down
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    // ==================== Triggers ====================

    /** Polls the feed for every instrument whose lane is idle. */
    @Scheduled(
            fixedDelayString = "${tradepilot.scheduler.poll-interval-ms:1000}",
            initialDelayString = "${tradepilot.scheduler.poll-interval-ms:1000}")
    public void poll() {
        if (!running.get()) {
            return;
        }
        for (Instrument instrument : instrumentRegistry.getAll()) {
            InstrumentLane lane = lanes.get(instrument.getId());
            if (lane == null || lane.isBusy() || lane.queuedTasks() > 0) {
                // previous cycle still running; the next poll picks up its bars
                continue;
            }
            lane.submit(() -> tradingCycle.run(
                    instrument, marketDataFeed.recentBars(instrument.getId(), pollBars), !paused.get()));
        }
    }

    /** Queues a cycle for a bar delivered by a push source. */
    public void onBar(String instrumentId, PriceBar bar) {
        Instrument instrument = instrumentRegistry.get(instrumentId);
        InstrumentLane lane = laneFor(instrumentId);
        lane.submit(() -> tradingCycle.run(instrument, List.of(bar), !paused.get()));
    }

    /**
     * Queues a cycle over the cached history, without fetching new bars.
     *
     * @return completes with the cycle's result once it has run on the lane
     * @throws EngineUnavailableException if the engine is stopped
     */
    public CompletableFuture<CycleResult> triggerEvaluation(String instrumentId) {
        Instrument instrument = instrumentRegistry.get(instrumentId);
        InstrumentLane lane = laneFor(instrumentId);
        CompletableFuture<CycleResult> future = new CompletableFuture<>();
        boolean accepted = lane.submit(() -> future.complete(tradingCycle.run(instrument, List.of(), !paused.get())));
        if (!accepted) {
            throw new EngineUnavailableException("Engine is shutting down");
        }
        return future;
    }

    private InstrumentLane laneFor(String instrumentId) {
        InstrumentLane lane = lanes.get(instrumentId);
        if (lane == null || !running.get()) {
            throw new EngineUnavailableException("Engine is not running");
        }
        return lane;
    }

    // ==================== Operator switch ====================

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Trading paused");
            eventPublisherHelper.publishDecision(this, "ENGINE", "Trading paused by operator");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Trading resumed");
            eventPublisherHelper.publishDecision(this, "ENGINE", "Trading resumed by operator");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public Map<String, InstrumentLane> getLanes() {
        return Map.copyOf(lanes);
    }
}
