package com.tradepilot.indicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.ROCIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorDIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/**
 * Creates ta4j indicator instances from {@link IndicatorDefinition}s.
 *
 * <p>Multi-output indicators produce several keyed entries. The key format is
 * {@code TYPE:period} or {@code TYPE:period:field}; MACD is keyed by its short period
 * ({@code MACD:12:value}, {@code MACD:12:signal}) and LTP by zero ({@code LTP:0}).
 *
 * <p>Stateless: the returned indicators are bound to the given series only.
 */
public final class IndicatorFactory {

    private IndicatorFactory() {}

    public static Map<String, Indicator<Num>> createIndicators(
            BarSeries series, List<IndicatorDefinition> definitions) {
        Map<String, Indicator<Num>> indicators = new LinkedHashMap<>();
        ClosePriceIndicator closePrice = new ClosePriceIndicator(series);

        for (IndicatorDefinition def : definitions) {
            switch (def.getType()) {
                case SMA -> {
                    int period = def.getParamOrDefault("period", 20);
                    indicators.put(buildKey(IndicatorType.SMA, period, null), new SMAIndicator(closePrice, period));
                }
                case EMA -> {
                    int period = def.getParamOrDefault("period", 20);
                    indicators.put(buildKey(IndicatorType.EMA, period, null), new EMAIndicator(closePrice, period));
                }
                case RSI -> {
                    int period = def.getParamOrDefault("period", 14);
                    indicators.put(buildKey(IndicatorType.RSI, period, null), new RSIIndicator(closePrice, period));
                }
                case MACD -> {
                    int shortPeriod = def.getParamOrDefault("shortPeriod", 12);
                    int longPeriod = def.getParamOrDefault("longPeriod", 26);
                    int signalPeriod = def.getParamOrDefault("signalPeriod", 9);
                    MACDIndicator macd = new MACDIndicator(closePrice, shortPeriod, longPeriod);

                    indicators.put(buildKey(IndicatorType.MACD, shortPeriod, "value"), macd);
                    indicators.put(
                            buildKey(IndicatorType.MACD, shortPeriod, "signal"), new EMAIndicator(macd, signalPeriod));
                }
                case BOLLINGER -> {
                    int period = def.getParamOrDefault("period", 20);
                    double multiplier = def.getDoubleParamOrDefault("multiplier", 2.0);
                    SMAIndicator sma = new SMAIndicator(closePrice, period);
                    StandardDeviationIndicator stdDev = new StandardDeviationIndicator(closePrice, period);
                    Num k = series.numOf(multiplier);

                    BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(sma);
                    indicators.put(
                            buildKey(IndicatorType.BOLLINGER, period, "upper"),
                            new BollingerBandsUpperIndicator(middle, stdDev, k));
                    indicators.put(buildKey(IndicatorType.BOLLINGER, period, "middle"), middle);
                    indicators.put(
                            buildKey(IndicatorType.BOLLINGER, period, "lower"),
                            new BollingerBandsLowerIndicator(middle, stdDev, k));
                }
                case ATR -> {
                    int period = def.getParamOrDefault("period", 14);
                    indicators.put(buildKey(IndicatorType.ATR, period, null), new ATRIndicator(series, period));
                }
                case STOCHASTIC -> {
                    int period = def.getParamOrDefault("period", 14);
                    StochasticOscillatorKIndicator k = new StochasticOscillatorKIndicator(series, period);

                    indicators.put(buildKey(IndicatorType.STOCHASTIC, period, "k"), k);
                    indicators.put(
                            buildKey(IndicatorType.STOCHASTIC, period, "d"), new StochasticOscillatorDIndicator(k));
                }
                case ROC -> {
                    int period = def.getParamOrDefault("period", 10);
                    indicators.put(buildKey(IndicatorType.ROC, period, null), new ROCIndicator(closePrice, period));
                }
                case LTP -> indicators.put(buildKey(IndicatorType.LTP, 0, null), closePrice);
            }
        }
        return indicators;
    }

    /**
     * Builds the snapshot key for an indicator value.
     *
     * <p>Format: {@code TYPE:period} or {@code TYPE:period:field} for multi-output indicators.
     */
    public static String buildKey(IndicatorType type, int period, String field) {
        String key = type.name() + ":" + period;
        if (field != null) {
            key += ":" + field;
        }
        return key;
    }

    /** Key of the last-traded-price pseudo-indicator. */
    public static String ltpKey() {
        return buildKey(IndicatorType.LTP, 0, null);
    }
}
