package com.tradepilot.api.dto.response;

import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.Position;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position view with the mark-to-market figures computed at read time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionResponse {

    private String instrumentId;
    private PositionSide side;
    private BigDecimal size;
    private BigDecimal averageEntryPrice;
    private BigDecimal markPrice;
    private BigDecimal notional;
    private BigDecimal unrealizedPnl;
    private BigDecimal realizedPnl;
    private Instant openedAt;
    private Instant closedAt;
    private Instant updatedAt;

    public static PositionResponse from(Position position) {
        return PositionResponse.builder()
                .instrumentId(position.getInstrumentId())
                .side(position.getSide())
                .size(position.getSize())
                .averageEntryPrice(position.getAverageEntryPrice())
                .markPrice(position.getMarkPrice())
                .notional(position.notional())
                .unrealizedPnl(position.unrealizedPnl())
                .realizedPnl(position.getRealizedPnl())
                .openedAt(position.getOpenedAt())
                .closedAt(position.getClosedAt())
                .updatedAt(position.getUpdatedAt())
                .build();
    }
}
