package com.tradepilot.api.controller;

import com.tradepilot.api.dto.response.EvaluationResponse;
import com.tradepilot.api.dto.response.StatusResponse;
import com.tradepilot.config.InstrumentRegistry;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.engine.CycleResult;
import com.tradepilot.engine.ExecutionScheduler;
import com.tradepilot.exception.EngineUnavailableException;
import com.tradepilot.marketdata.MarketDataCache;
import com.tradepilot.observability.DecisionLogger;
import com.tradepilot.observability.DecisionRecord;
import com.tradepilot.oms.OrderExecutionManager;
import com.tradepilot.oms.TradeJournal;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.strategy.SignalEvaluator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the execution engine.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/status -- engine state, exposure, P&amp;L and problem counts</li>
 *   <li>POST /api/start -- resume trading</li>
 *   <li>POST /api/stop -- pause trading (bars are still cached)</li>
 *   <li>POST /api/instruments/{instrumentId}/evaluate -- run a cycle now and return its result</li>
 *   <li>GET /api/decisions -- recent decision log</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private final ExecutionScheduler executionScheduler;
    private final InstrumentRegistry instrumentRegistry;
    private final MarketDataCache marketDataCache;
    private final PositionRiskTracker positionRiskTracker;
    private final OrderExecutionManager orderExecutionManager;
    private final TradeJournal tradeJournal;
    private final SignalEvaluator signalEvaluator;
    private final DecisionLogger decisionLogger;
    private final long evaluateTimeoutSeconds;

    public TradingController(
            ExecutionScheduler executionScheduler,
            InstrumentRegistry instrumentRegistry,
            MarketDataCache marketDataCache,
            PositionRiskTracker positionRiskTracker,
            OrderExecutionManager orderExecutionManager,
            TradeJournal tradeJournal,
            SignalEvaluator signalEvaluator,
            DecisionLogger decisionLogger,
            @Value("${tradepilot.api.evaluate-timeout-seconds:30}") long evaluateTimeoutSeconds) {
        this.executionScheduler = executionScheduler;
        this.instrumentRegistry = instrumentRegistry;
        this.marketDataCache = marketDataCache;
        this.positionRiskTracker = positionRiskTracker;
        this.orderExecutionManager = orderExecutionManager;
        this.tradeJournal = tradeJournal;
        this.signalEvaluator = signalEvaluator;
        this.decisionLogger = decisionLogger;
        this.evaluateTimeoutSeconds = evaluateTimeoutSeconds;
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus() {
        Map<String, Double> lastPrices = new LinkedHashMap<>();
        for (Instrument instrument : instrumentRegistry.getAll()) {
            marketDataCache
                    .latest(instrument.getId())
                    .ifPresent(bar -> lastPrices.put(instrument.getId(), bar.getClose()));
        }

        StatusResponse status = StatusResponse.builder()
                .running(executionScheduler.isRunning())
                .paused(executionScheduler.isPaused())
                .strategy(signalEvaluator.getRuleBook().getName())
                .instruments(instrumentRegistry.getAll().stream().map(Instrument::getId).toList())
                .lastPrices(lastPrices)
                .openPositions(positionRiskTracker.getOpenPositions().size())
                .totalExposure(positionRiskTracker.totalExposure())
                .realizedPnl(positionRiskTracker.realizedPnl())
                .unrealizedPnl(positionRiskTracker.unrealizedPnl())
                .unknownOrders(orderExecutionManager.getUnknownOrders().size())
                .riskRejections(positionRiskTracker.getRecentRejections().size())
                .trades(tradeJournal.size())
                .build();
        return ResponseEntity.ok(status);
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start() {
        log.info("Operator requested trading start");
        executionScheduler.resume();
        return ResponseEntity.ok(Map.of("paused", executionScheduler.isPaused()));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        log.info("Operator requested trading stop");
        executionScheduler.pause();
        return ResponseEntity.ok(Map.of("paused", executionScheduler.isPaused()));
    }

    /**
     * Runs a cycle for the instrument on its lane and waits for the result. While
     * trading is paused the cycle only refreshes the mark.
     */
    @PostMapping("/instruments/{instrumentId}/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@PathVariable String instrumentId) {
        log.info("Operator requested evaluation: instrument={}", instrumentId);
        CompletableFuture<CycleResult> future = executionScheduler.triggerEvaluation(instrumentId);
        try {
            CycleResult result = future.get(evaluateTimeoutSeconds, TimeUnit.SECONDS);
            return ResponseEntity.ok(EvaluationResponse.from(result));
        } catch (TimeoutException e) {
            throw new EngineUnavailableException(
                    "Evaluation of " + instrumentId + " did not complete within " + evaluateTimeoutSeconds + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("Interrupted while waiting for evaluation of " + instrumentId);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Evaluation of " + instrumentId + " failed", e.getCause());
        }
    }

    @GetMapping("/decisions")
    public ResponseEntity<List<DecisionRecord>> getDecisions(
            @RequestParam(required = false) String instrumentId, @RequestParam(defaultValue = "100") int limit) {
        List<DecisionRecord> decisions = instrumentId != null
                ? decisionLogger.getRecent(instrumentId, limit)
                : decisionLogger.getRecent(limit);
        return ResponseEntity.ok(decisions);
    }
}
