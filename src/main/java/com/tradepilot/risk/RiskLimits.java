package com.tradepilot.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Account-wide risk limits. Per-instrument limits (max position size, max notional)
 * live on {@link com.tradepilot.domain.model.Instrument}.
 *
 * <p>Null values mean the check is disabled. Loaded from {@code tradepilot.risk.*}
 * by {@link com.tradepilot.config.RiskConfig} and immutable during a run.
 */
@Data
@Builder
public class RiskLimits {

    /** Maximum number of instruments with an open position or an in-flight entry order. */
    private Integer maxOpenPositions;

    /** Cap on total notional exposure across instruments, including in-flight entries. */
    private BigDecimal maxTotalNotional;
}
