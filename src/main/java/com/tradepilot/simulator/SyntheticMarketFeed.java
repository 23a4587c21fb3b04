package com.tradepilot.simulator;

import com.tradepilot.config.InstrumentRegistry;
import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.marketdata.MarketDataFeed;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Market data for paper trading: a seeded geometric random walk per instrument, one
 * bar per {@code tradepilot.simulator.bar-interval-seconds} aligned to wall-clock time.
 *
 * <p>On first access an instrument gets {@code historyBars} bars ending at the current
 * interval; later calls extend the walk up to the current time. The same seed yields
 * the same price path.
 */
@Service
@ConditionalOnProperty(name = "tradepilot.exchange.mode", havingValue = "PAPER", matchIfMissing = true)
public class SyntheticMarketFeed implements MarketDataFeed {

    private static final Logger log = LoggerFactory.getLogger(SyntheticMarketFeed.class);

    private final SimulatorConfig simulatorConfig;
    private final InstrumentRegistry instrumentRegistry;
    private final Clock clock;
    private final Duration interval;

    private final Map<String, Walk> walks = new ConcurrentHashMap<>();

    public SyntheticMarketFeed(SimulatorConfig simulatorConfig, InstrumentRegistry instrumentRegistry, Clock clock) {
        this.simulatorConfig = simulatorConfig;
        this.instrumentRegistry = instrumentRegistry;
        this.clock = clock;
        this.interval = Duration.ofSeconds(simulatorConfig.getBarIntervalSeconds());
    }

    @Override
    public List<PriceBar> recentBars(String instrumentId, int limit) {
        Walk walk = walks.computeIfAbsent(instrumentId, this::newWalk);
        synchronized (walk) {
            walk.advanceTo(clock.instant());
            List<PriceBar> all = new ArrayList<>(walk.bars);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    private Walk newWalk(String instrumentId) {
        double start = simulatorConfig.getStartPrices().getOrDefault(instrumentId, simulatorConfig.getDefaultStartPrice());
        double tick = instrumentRegistry.find(instrumentId)
                .map(instrument -> instrument.getTickSize().doubleValue())
                .orElse(0.01);
        Instant now = alignDown(clock.instant());
        Walk walk = new Walk(
                new Random(simulatorConfig.getSeed() + instrumentId.hashCode()),
                start,
                tick,
                now.minus(interval.multipliedBy(simulatorConfig.getHistoryBars())),
                Math.max(simulatorConfig.getHistoryBars(), 1) * 2);
        log.info("Synthetic feed started: instrument={} startPrice={} interval={}", instrumentId, start, interval);
        return walk;
    }

    private Instant alignDown(Instant instant) {
        long step = interval.toMillis();
        return Instant.ofEpochMilli(instant.toEpochMilli() / step * step);
    }

    private final class Walk {

        private final Random random;
        private final double tick;
        private final int maxBars;
        private final Deque<PriceBar> bars = new ArrayDeque<>();
        private double lastClose;
        private Instant lastBarEnd;

        private Walk(Random random, double startPrice, double tick, Instant firstBarEnd, int maxBars) {
            this.random = random;
            this.lastClose = startPrice;
            this.tick = tick;
            this.lastBarEnd = firstBarEnd;
            this.maxBars = maxBars;
        }

        /** Generates every bar whose end time is at or before {@code now}. */
        private void advanceTo(Instant now) {
            Instant next = lastBarEnd.plus(interval);
            while (!next.isAfter(now)) {
                bars.addLast(nextBar(next));
                lastBarEnd = next;
                next = next.plus(interval);
                if (bars.size() > maxBars) {
                    bars.pollFirst();
                }
            }
        }

        private PriceBar nextBar(Instant end) {
            double volatility = simulatorConfig.getVolatility();
            double open = lastClose;
            double close = round(open * Math.exp(volatility * random.nextGaussian()));
            double high = round(Math.max(open, close) * (1 + Math.abs(random.nextGaussian()) * volatility / 2));
            double low = round(Math.min(open, close) * (1 - Math.abs(random.nextGaussian()) * volatility / 2));
            double volume = 100 + random.nextDouble() * 900;
            lastClose = close;
            return PriceBar.builder()
                    .timestamp(end)
                    .open(open)
                    .high(Math.max(high, Math.max(open, close)))
                    .low(Math.min(low, Math.min(open, close)))
                    .close(close)
                    .volume(volume)
                    .build();
        }

        private double round(double price) {
            return BigDecimal.valueOf(Math.round(price / tick))
                    .multiply(BigDecimal.valueOf(tick))
                    .doubleValue();
        }
    }
}
