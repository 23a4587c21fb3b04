package com.tradepilot.config;

import com.tradepilot.risk.RiskLimits;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the account-wide {@link RiskLimits} from {@code tradepilot.risk.*}.
 *
 * <p>Unset properties resolve to null, which disables the corresponding check.
 */
@Configuration
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    @Value("${tradepilot.risk.max-open-positions:#{null}}")
    private Integer maxOpenPositions;

    @Value("${tradepilot.risk.max-total-notional:#{null}}")
    private BigDecimal maxTotalNotional;

    @Bean
    public RiskLimits riskLimits() {
        RiskLimits limits = RiskLimits.builder()
                .maxOpenPositions(maxOpenPositions)
                .maxTotalNotional(maxTotalNotional)
                .build();
        log.info("Risk limits loaded: maxOpenPositions={} maxTotalNotional={}", maxOpenPositions, maxTotalNotional);
        return limits;
    }
}
