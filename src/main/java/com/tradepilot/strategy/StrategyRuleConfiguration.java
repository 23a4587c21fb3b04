package com.tradepilot.strategy;

import com.tradepilot.indicator.IndicatorEngine;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the active {@link StrategyRuleBook} from {@link StrategyConfig} and checks that
 * every indicator key the rules read is produced by the {@link IndicatorEngine}. A rule
 * reading a missing key would see NaN on every tick and never fire, so startup fails instead.
 */
@Configuration
public class StrategyRuleConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StrategyRuleConfiguration.class);

    @Bean
    public StrategyRuleBook strategyRuleBook(StrategyConfig strategyConfig, IndicatorEngine indicatorEngine) {
        StrategyRuleBook ruleBook = strategyConfig.getRules().isEmpty()
                ? new StrategyRuleBook(strategyConfig.getPreset().name(), strategyConfig.getPreset().rules())
                : new StrategyRuleBook("CUSTOM", strategyConfig.getRules());

        Set<String> missing = new HashSet<>(ruleBook.inputKeys());
        missing.removeAll(indicatorEngine.indicatorKeys());
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Strategy " + ruleBook.getName() + " reads indicators that are not configured: " + missing);
        }

        log.info(
                "Strategy rule book loaded: name={} rules={} cooldownSeconds={}",
                ruleBook.getName(),
                ruleBook.getRules().size(),
                strategyConfig.getCooldownSeconds());
        return ruleBook;
    }
}
