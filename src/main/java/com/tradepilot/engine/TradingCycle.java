package com.tradepilot.engine;

import com.tradepilot.domain.model.IndicatorSnapshot;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.domain.model.Order;
import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.exception.BaseException;
import com.tradepilot.exception.ExchangeTimeoutException;
import com.tradepilot.exception.OrderRejectedException;
import com.tradepilot.indicator.IndicatorEngine;
import com.tradepilot.marketdata.MarketDataCache;
import com.tradepilot.observability.TradingMetricsService;
import com.tradepilot.oms.OrderExecutionManager;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.strategy.EvaluationOutcome;
import com.tradepilot.strategy.SignalEvaluation;
import com.tradepilot.strategy.SignalEvaluator;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One pass of the signal-to-order pipeline for a single instrument.
 *
 * <p>Steps:
 * <ol>
 *   <li>Append new bars to the {@link MarketDataCache}</li>
 *   <li>Mark the position at the latest close</li>
 *   <li>Read {@link IndicatorEngine#lookback()} bars and compute a snapshot</li>
 *   <li>Evaluate the snapshot</li>
 *   <li>Submit an actionable signal and start the cooldown once the order reached the
 *       exchange, whether it was acked, rejected or left unconfirmed</li>
 * </ol>
 *
 * <p>Must only be called from the instrument's {@link InstrumentLane}. Errors never
 * escape: domain errors are logged at WARN, anything else at ERROR, and the cycle
 * reports them in its {@link CycleResult}.
 */
@Component
public class TradingCycle {

    private static final Logger log = LoggerFactory.getLogger(TradingCycle.class);

    private final MarketDataCache marketDataCache;
    private final IndicatorEngine indicatorEngine;
    private final SignalEvaluator signalEvaluator;
    private final OrderExecutionManager orderExecutionManager;
    private final PositionRiskTracker positionRiskTracker;
    private final TradingMetricsService tradingMetricsService;
    private final Clock clock;

    public TradingCycle(
            MarketDataCache marketDataCache,
            IndicatorEngine indicatorEngine,
            SignalEvaluator signalEvaluator,
            OrderExecutionManager orderExecutionManager,
            PositionRiskTracker positionRiskTracker,
            TradingMetricsService tradingMetricsService,
            Clock clock) {
        this.marketDataCache = marketDataCache;
        this.indicatorEngine = indicatorEngine;
        this.signalEvaluator = signalEvaluator;
        this.orderExecutionManager = orderExecutionManager;
        this.positionRiskTracker = positionRiskTracker;
        this.tradingMetricsService = tradingMetricsService;
        this.clock = clock;
    }

    /**
     * Runs a cycle.
     *
     * @param newBars  bars from the feed, oldest first; already-seen bars are dropped by the cache
     * @param evaluate false to only cache and mark (trading paused)
     */
    public CycleResult run(Instrument instrument, List<PriceBar> newBars, boolean evaluate) {
        long start = System.nanoTime();
        String instrumentId = instrument.getId();
        int appended = 0;
        SignalEvaluation evaluation = null;

        try {
            for (PriceBar bar : newBars) {
                if (marketDataCache.append(instrumentId, bar).isPresent()) {
                    appended++;
                }
            }

            Optional<PriceBar> latest = marketDataCache.latest(instrumentId);
            if (latest.isEmpty()) {
                return CycleResult.skipped(instrumentId, appended);
            }
            positionRiskTracker.mark(instrumentId, BigDecimal.valueOf(latest.get().getClose()));

            if (!evaluate) {
                return CycleResult.skipped(instrumentId, appended);
            }

            if (latest.get().getSequence() <= signalEvaluator.lastEvaluatedSequence(instrumentId)) {
                log.debug("No new bar since last evaluation: instrument={}", instrumentId);
                evaluation = new SignalEvaluation(null, EvaluationOutcome.STALE, positionRiskTracker.sideOf(instrumentId));
                return new CycleResult(instrumentId, appended, evaluation, null, null);
            }

            List<PriceBar> history = marketDataCache.history(instrumentId, indicatorEngine.lookback());
            IndicatorSnapshot snapshot = indicatorEngine.compute(instrumentId, history);
            evaluation = signalEvaluator.evaluate(snapshot);

            Order order = null;
            if (evaluation.isActionable()) {
                try {
                    order = orderExecutionManager.submit(evaluation.signal(), instrument);
                } catch (OrderRejectedException | ExchangeTimeoutException e) {
                    // the order reached the exchange; do not resubmit on every bar
                    signalEvaluator.recordTrade(instrumentId, clock.instant());
                    throw e;
                }
                signalEvaluator.recordTrade(instrumentId, clock.instant());
            }
            return new CycleResult(instrumentId, appended, evaluation, order, null);

        } catch (BaseException e) {
            log.warn("Cycle skipped: instrument={} code={} reason={}", instrumentId, e.getErrorCode(), e.getMessage());
            tradingMetricsService.recordCycleError(e.getErrorCode().name());
            return CycleResult.failed(instrumentId, appended, evaluation, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Cycle failed: instrument={}", instrumentId, e);
            tradingMetricsService.recordCycleError("UNEXPECTED");
            return CycleResult.failed(instrumentId, appended, evaluation, e.toString());
        } finally {
            tradingMetricsService.recordCycle(System.nanoTime() - start);
        }
    }
}
