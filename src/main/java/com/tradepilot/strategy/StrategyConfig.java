package com.tradepilot.strategy;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Strategy settings bound from {@code tradepilot.strategy}.
 *
 * <ul>
 *   <li>{@code preset}: built-in rule set, used when {@code rules} is empty</li>
 *   <li>{@code rules}: custom rules in priority order; replace the preset entirely</li>
 *   <li>{@code cooldownSeconds}: minimum time between a submitted trade and the next entry</li>
 * </ul>
 */
@Data
@ConfigurationProperties(prefix = "tradepilot.strategy")
public class StrategyConfig {

    private StrategyPreset preset = StrategyPreset.TREND_RSI;

    private List<StrategyRule> rules = new ArrayList<>();

    private long cooldownSeconds = 300;
}
