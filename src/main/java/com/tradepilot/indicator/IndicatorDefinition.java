package com.tradepilot.indicator;

import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured indicator: its type plus a free-form parameter map
 * (period=14 for RSI, shortPeriod/longPeriod/signalPeriod for MACD, multiplier for Bollinger).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorDefinition {

    private IndicatorType type;
    private Map<String, Object> params = new HashMap<>();

    public static IndicatorDefinition of(IndicatorType type, Map<String, Object> params) {
        return new IndicatorDefinition(type, new HashMap<>(params));
    }

    public static IndicatorDefinition of(IndicatorType type, int period) {
        return of(type, Map.of("period", period));
    }

    public int getParamOrDefault(String key, int defaultValue) {
        Object value = params.get(key);
        return value != null ? Integer.parseInt(value.toString()) : defaultValue;
    }

    public double getDoubleParamOrDefault(String key, double defaultValue) {
        Object value = params.get(key);
        return value != null ? Double.parseDouble(value.toString()) : defaultValue;
    }

    /**
     * Number of bars this indicator needs before its latest value is meaningful.
     * Oscillators built on price changes need one extra bar for the first difference.
     */
    public int lookback() {
        return switch (type) {
            case SMA, EMA, BOLLINGER -> getParamOrDefault("period", 20);
            case RSI, ATR -> getParamOrDefault("period", 14) + 1;
            case ROC -> getParamOrDefault("period", 10) + 1;
            case MACD -> getParamOrDefault("longPeriod", 26) + getParamOrDefault("signalPeriod", 9);
            case STOCHASTIC -> getParamOrDefault("period", 14) + 2;
            case LTP -> 1;
        };
    }
}
