package com.tradepilot.api.dto.response;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Engine overview for {@code GET /api/status}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {

    private boolean running;
    private boolean paused;
    private String strategy;
    private List<String> instruments;

    /** Latest cached close per instrument. */
    private Map<String, Double> lastPrices;

    private int openPositions;
    private BigDecimal totalExposure;
    private BigDecimal realizedPnl;
    private BigDecimal unrealizedPnl;
    private int unknownOrders;
    private int riskRejections;
    private int trades;
}
