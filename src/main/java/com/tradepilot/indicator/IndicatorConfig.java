package com.tradepilot.indicator;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Indicator set computed for every instrument, bound from {@code tradepilot.indicators}.
 *
 * <p>The same definitions apply to all instruments; the slowest one determines the
 * lookback window the cache must hold.
 */
@Data
@ConfigurationProperties(prefix = "tradepilot.indicators")
public class IndicatorConfig {

    private List<IndicatorDefinition> definitions = new ArrayList<>();
}
