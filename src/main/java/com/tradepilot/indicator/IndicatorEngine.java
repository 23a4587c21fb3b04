package com.tradepilot.indicator;

import com.tradepilot.domain.model.IndicatorSnapshot;
import com.tradepilot.domain.model.PriceBar;
import com.tradepilot.exception.InsufficientHistoryException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.Indicator;
import org.ta4j.core.num.Num;

/**
 * Computes the configured indicator set from a bar history.
 *
 * <p>{@link #compute} is a pure function of its input: every call builds a fresh ta4j
 * {@link BarSeries} from the given bars, so nothing is shared between instruments or
 * between calls and no strategy state lives here.
 *
 * <p>Numeric policy: values are doubles. Anything ta4j cannot compute (its NaN, an
 * infinite result, an arithmetic failure such as a division by a zero price) is reported
 * as {@link Double#NaN}; the Signal Evaluator treats that sentinel as HOLD.
 */
@Service
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private static final Duration DEFAULT_BAR_DURATION = Duration.ofMinutes(1);

    private final List<IndicatorDefinition> definitions;
    private final int lookback;
    private final Set<String> indicatorKeys;

    public IndicatorEngine(IndicatorConfig indicatorConfig) {
        this.definitions = List.copyOf(indicatorConfig.getDefinitions());
        if (definitions.isEmpty()) {
            throw new IllegalStateException("No indicators configured under tradepilot.indicators.definitions");
        }
        this.lookback = definitions.stream().mapToInt(IndicatorDefinition::lookback).max().orElse(1);
        this.indicatorKeys = Set.copyOf(IndicatorFactory.createIndicators(
                        new BaseBarSeriesBuilder().withName("keys").build(), definitions)
                .keySet());
        log.info("Indicator engine configured: lookback={} keys={}", lookback, indicatorKeys);
    }

    /**
     * Computes a snapshot from the history; its sequence and timestamp are those of the last bar.
     *
     * @param instrumentId the instrument the bars belong to
     * @param history      bars in chronological order with strictly increasing timestamps
     * @throws InsufficientHistoryException if the history is shorter than {@link #lookback()}
     */
    public IndicatorSnapshot compute(String instrumentId, List<PriceBar> history) {
        if (history.size() < lookback) {
            throw new InsufficientHistoryException(instrumentId, lookback, history.size());
        }

        BarSeries series = toSeries(instrumentId, history);
        Map<String, Indicator<Num>> indicators = IndicatorFactory.createIndicators(series, definitions);
        int endIndex = series.getEndIndex();

        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Indicator<Num>> entry : indicators.entrySet()) {
            values.put(entry.getKey(), valueAt(instrumentId, entry.getKey(), entry.getValue(), endIndex));
        }

        PriceBar last = history.get(history.size() - 1);
        return new IndicatorSnapshot(instrumentId, last.getSequence(), last.getTimestamp(), values);
    }

    /** Bars needed by the slowest configured indicator. */
    public int lookback() {
        return lookback;
    }

    /** Every key a snapshot produced by this engine contains. */
    public Set<String> indicatorKeys() {
        return indicatorKeys;
    }

    // ---- Internal ----

    private BarSeries toSeries(String instrumentId, List<PriceBar> history) {
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(instrumentId)
                .withMaxBarCount(history.size())
                .build();

        PriceBar previous = null;
        for (PriceBar bar : history) {
            Duration period = previous != null
                    ? Duration.between(previous.getTimestamp(), bar.getTimestamp())
                    : DEFAULT_BAR_DURATION;
            series.addBar(
                    period,
                    bar.getTimestamp().atZone(ZoneOffset.UTC),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume());
            previous = bar;
        }
        return series;
    }

    private double valueAt(String instrumentId, String key, Indicator<Num> indicator, int index) {
        try {
            Num value = indicator.getValue(index);
            if (value == null || value.isNaN()) {
                return Double.NaN;
            }
            double result = value.doubleValue();
            return Double.isFinite(result) ? result : Double.NaN;
        } catch (ArithmeticException e) {
            log.debug("Indicator {} not computable for {}: {}", key, instrumentId, e.getMessage());
            return Double.NaN;
        }
    }
}
