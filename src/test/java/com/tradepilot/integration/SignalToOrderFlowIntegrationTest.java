package com.tradepilot.integration;

import static com.tradepilot.support.TestBars.bar;
import static com.tradepilot.support.TestBars.bars;
import static com.tradepilot.support.TestInstruments.BTC;
import static com.tradepilot.support.TestInstruments.limited;
import static com.tradepilot.support.TestInstruments.unlimited;
import static org.assertj.core.api.Assertions.assertThat;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.FillEvent;
import com.tradepilot.domain.model.Instrument;
import com.tradepilot.domain.model.Order;
import com.tradepilot.domain.model.Position;
import com.tradepilot.engine.CycleResult;
import com.tradepilot.engine.TradingCycle;
import com.tradepilot.event.DecisionEvent;
import com.tradepilot.event.EventPublisherHelper;
import com.tradepilot.event.OrderEvent;
import com.tradepilot.event.RiskEvent;
import com.tradepilot.exchange.ExchangeGateway;
import com.tradepilot.exchange.ExchangeResponse;
import com.tradepilot.indicator.IndicatorConfig;
import com.tradepilot.indicator.IndicatorDefinition;
import com.tradepilot.indicator.IndicatorEngine;
import com.tradepilot.indicator.IndicatorType;
import com.tradepilot.marketdata.MarketDataCache;
import com.tradepilot.observability.DecisionLogger;
import com.tradepilot.observability.TradingMetricsService;
import com.tradepilot.oms.IdempotencyKeyGenerator;
import com.tradepilot.oms.OrderExecutionManager;
import com.tradepilot.oms.RetryPolicy;
import com.tradepilot.oms.TradeJournal;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.risk.RiskLimits;
import com.tradepilot.strategy.EvaluationOutcome;
import com.tradepilot.strategy.RuleCondition;
import com.tradepilot.strategy.SignalEvaluator;
import com.tradepilot.strategy.StrategyConfig;
import com.tradepilot.strategy.StrategyRule;
import com.tradepilot.strategy.StrategyRuleBook;
import com.tradepilot.support.TestSignals;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Wires the real cache, indicator engine, evaluator, risk tracker, execution manager and
 * trading cycle against a scripted exchange, and drives them bar by bar.
 *
 * <p>Closes 104, 103, 102, 101 put SMA(2) below SMA(4); a bar at 110 crosses it above
 * (ENTER_LONG) and a following bar at 90 crosses it back below (EXIT).
 */
class SignalToOrderFlowIntegrationTest {

    private static final double[] DOWNTREND = {104, 103, 102, 101};

    private ScriptedExchange exchange;
    private MarketDataCache marketDataCache;
    private PositionRiskTracker positionRiskTracker;
    private OrderExecutionManager orderExecutionManager;
    private TradeJournal tradeJournal;
    private DecisionLogger decisionLogger;
    private SimpleMeterRegistry meterRegistry;
    private TradingCycle tradingCycle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TestSignals.NOW, ZoneOffset.UTC);
        exchange = new ScriptedExchange();
        decisionLogger = new DecisionLogger();
        meterRegistry = new SimpleMeterRegistry();
        List<Object> published = new CopyOnWriteArrayList<>();
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(event -> {
            published.add(event);
            if (event instanceof DecisionEvent decision) {
                decisionLogger.onDecision(decision);
            } else if (event instanceof OrderEvent order) {
                decisionLogger.onOrderEvent(order);
            } else if (event instanceof RiskEvent risk) {
                decisionLogger.onRiskEvent(risk);
            }
        });

        marketDataCache = new MarketDataCache(50);
        IndicatorConfig indicatorConfig = new IndicatorConfig();
        indicatorConfig.setDefinitions(List.of(
                IndicatorDefinition.of(IndicatorType.LTP, Map.of()),
                IndicatorDefinition.of(IndicatorType.SMA, 2),
                IndicatorDefinition.of(IndicatorType.SMA, 4)));
        IndicatorEngine indicatorEngine = new IndicatorEngine(indicatorConfig);

        positionRiskTracker = new PositionRiskTracker(
                RiskLimits.builder().maxOpenPositions(1).build(), eventPublisherHelper, clock);

        StrategyRuleBook ruleBook = new StrategyRuleBook(
                "SMA_CROSS",
                List.of(
                        StrategyRule.builder()
                                .name("fast-below-slow")
                                .signal(SignalType.EXIT)
                                .appliesTo(EnumSet.of(PositionSide.LONG))
                                .conditions(List.of(RuleCondition.crossesBelow("SMA:2", "SMA:4")))
                                .build(),
                        StrategyRule.builder()
                                .name("fast-above-slow")
                                .signal(SignalType.ENTER_LONG)
                                .appliesTo(EnumSet.of(PositionSide.FLAT))
                                .conditions(List.of(RuleCondition.crossesAbove("SMA:2", "SMA:4")))
                                .build()));
        StrategyConfig strategyConfig = new StrategyConfig();
        strategyConfig.setCooldownSeconds(300);
        SignalEvaluator signalEvaluator =
                new SignalEvaluator(ruleBook, strategyConfig, positionRiskTracker, eventPublisherHelper, clock);

        tradeJournal = new TradeJournal(100);
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(3)
                .initialBackoff(Duration.ofMillis(1))
                .multiplier(2.0)
                .maxBackoff(Duration.ofMillis(5))
                .build();
        orderExecutionManager = new OrderExecutionManager(
                exchange,
                positionRiskTracker,
                new IdempotencyKeyGenerator(),
                tradeJournal,
                eventPublisherHelper,
                clock,
                retryPolicy,
                50);
        exchange.streamFills(orderExecutionManager::onFill);

        TradingMetricsService tradingMetricsService =
                new TradingMetricsService(meterRegistry, positionRiskTracker, orderExecutionManager);
        tradingCycle = new TradingCycle(
                marketDataCache,
                indicatorEngine,
                signalEvaluator,
                orderExecutionManager,
                positionRiskTracker,
                tradingMetricsService,
                clock);
    }

    @Test
    @DisplayName("Crossover enters long, the fill opens the position, the reverse crossover exits it")
    void enterAndExit() {
        Instrument btc = unlimited(BTC);

        CycleResult warmup = tradingCycle.run(btc, bars(0, DOWNTREND), true);
        assertThat(warmup.barsAppended()).isEqualTo(4);
        assertThat(warmup.outcome()).isEqualTo(EvaluationOutcome.HOLD);

        CycleResult entry = tradingCycle.run(btc, List.of(bar(4, 110)), true);
        assertThat(entry.outcome()).isEqualTo(EvaluationOutcome.ACTIONABLE);
        assertThat(entry.evaluation().signal().type()).isEqualTo(SignalType.ENTER_LONG);
        Order entryOrder = entry.order();
        assertThat(entryOrder.getStatus()).isEqualTo(OrderStatus.ACKED);
        assertThat(entryOrder.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(entryOrder.getSignalSequence()).isEqualTo(5);

        exchange.fill(entryOrder.getIdempotencyKey(), "110");
        Position open = positionRiskTracker.getPosition(BTC);
        assertThat(open.getSide()).isEqualTo(PositionSide.LONG);
        assertThat(open.getSize()).isEqualByComparingTo(btc.entryOrderSize());
        assertThat(orderExecutionManager.getOrder(entryOrder.getIdempotencyKey()).orElseThrow().getStatus())
                .isEqualTo(OrderStatus.FILLED);

        CycleResult exit = tradingCycle.run(btc, List.of(bar(5, 90)), true);
        assertThat(exit.outcome()).isEqualTo(EvaluationOutcome.ACTIONABLE);
        assertThat(exit.evaluation().signal().type()).isEqualTo(SignalType.EXIT);
        assertThat(exit.order().getSide()).isEqualTo(OrderSide.SELL);

        exchange.fill(exit.order().getIdempotencyKey(), "90");
        Position closed = positionRiskTracker.getPosition(BTC);
        assertThat(closed.getSide()).isEqualTo(PositionSide.FLAT);
        assertThat(closed.getRealizedPnl()).isEqualByComparingTo("-20");
        assertThat(tradeJournal.getTrades(BTC)).hasSize(2);
        assertThat(exchange.placements).hasSize(2);
        assertThat(decisionLogger.getRecent(BTC, 100))
                .anySatisfy(record -> assertThat(record.getCategory()).isEqualTo("SIGNAL"))
                .anySatisfy(record -> assertThat(record.getCategory()).isEqualTo("ORDER"));
    }

    @Test
    @DisplayName("A bar seen again does not trigger a second order")
    void replayedBarIsStale() {
        Instrument btc = unlimited(BTC);
        tradingCycle.run(btc, bars(0, DOWNTREND), true);
        tradingCycle.run(btc, List.of(bar(4, 110)), true);

        CycleResult replay = tradingCycle.run(btc, List.of(bar(4, 110)), true);

        assertThat(replay.barsAppended()).isZero();
        assertThat(replay.outcome()).isEqualTo(EvaluationOutcome.STALE);
        assertThat(exchange.placements).hasSize(1);
    }

    @Test
    @DisplayName("Two lost acks are retried with the same key and produce one order and one position")
    void lostAcksRetried() {
        Instrument btc = unlimited(BTC);
        tradingCycle.run(btc, bars(0, DOWNTREND), true);
        exchange.loseNextAcks(2);

        CycleResult entry = tradingCycle.run(btc, List.of(bar(4, 110)), true);

        assertThat(entry.isSuccessful()).isTrue();
        assertThat(entry.order().getAttempts()).isEqualTo(3);
        assertThat(exchange.placements).hasSize(3).containsOnly(entry.order().getIdempotencyKey());
        assertThat(exchange.distinctOrders()).isEqualTo(1);

        exchange.fill(entry.order().getIdempotencyKey(), "110");
        assertThat(positionRiskTracker.getPosition(BTC).getSize()).isEqualByComparingTo(btc.entryOrderSize());
        assertThat(orderExecutionManager.getOrders()).hasSize(1);
    }

    @Test
    @DisplayName("An entry over the instrument's notional cap is denied before reaching the exchange")
    void capDenied() {
        Instrument capped = limited(BTC, null, "50");
        tradingCycle.run(capped, bars(0, DOWNTREND), true);

        CycleResult entry = tradingCycle.run(capped, List.of(bar(4, 110)), true);

        assertThat(entry.isSuccessful()).isFalse();
        assertThat(entry.order()).isNull();
        assertThat(exchange.placements).isEmpty();
        assertThat(positionRiskTracker.getPosition(BTC).getSide()).isEqualTo(PositionSide.FLAT);
        assertThat(positionRiskTracker.getRecentRejections()).hasSize(1);
        assertThat(meterRegistry.get("tradepilot.cycle.errors").tag("code", "RISK_LIMIT_EXCEEDED").counter().count())
                .isEqualTo(1.0);
        assertThat(decisionLogger.getRecent(BTC, 100))
                .anySatisfy(record -> assertThat(record.getCategory()).isEqualTo("RISK"));
    }

    /** Acks every placement unless told to lose some; fills only when the test says so. */
    private static final class ScriptedExchange implements ExchangeGateway {

        private final List<String> placements = new CopyOnWriteArrayList<>();
        private final Map<String, Placement> orders = new ConcurrentHashMap<>();
        private final Deque<Boolean> lostAcks = new ArrayDeque<>();
        private final AtomicLong ids = new AtomicLong();
        private Consumer<FillEvent> fillConsumer;

        @Override
        public synchronized CompletableFuture<ExchangeResponse> placeOrder(
                String instrumentId, OrderSide side, BigDecimal size, OrderType type, String idempotencyKey) {
            placements.add(idempotencyKey);
            Placement placement = orders.computeIfAbsent(
                    idempotencyKey, key -> new Placement(instrumentId, side, size, "EX-" + ids.incrementAndGet()));
            if (Boolean.TRUE.equals(lostAcks.poll())) {
                return new CompletableFuture<>();
            }
            return CompletableFuture.completedFuture(ExchangeResponse.accepted(placement.exchangeOrderId()));
        }

        @Override
        public void streamFills(Consumer<FillEvent> consumer) {
            this.fillConsumer = consumer;
        }

        synchronized void loseNextAcks(int count) {
            for (int i = 0; i < count; i++) {
                lostAcks.add(Boolean.TRUE);
            }
        }

        int distinctOrders() {
            return orders.size();
        }

        void fill(String idempotencyKey, String price) {
            Placement placement = orders.get(idempotencyKey);
            fillConsumer.accept(FillEvent.builder()
                    .fillId("F-" + placement.exchangeOrderId())
                    .idempotencyKey(idempotencyKey)
                    .instrumentId(placement.instrumentId())
                    .side(placement.side())
                    .size(placement.size())
                    .price(new BigDecimal(price))
                    .timestamp(TestSignals.NOW)
                    .build());
        }

        private record Placement(String instrumentId, OrderSide side, BigDecimal size, String exchangeOrderId) {}
    }
}
