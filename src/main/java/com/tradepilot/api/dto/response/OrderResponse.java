package com.tradepilot.api.dto.response;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.Order;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time copy of an {@link Order}. Orders mutate under their own monitor, so the
 * copy is taken while holding it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private String idempotencyKey;
    private String exchangeOrderId;
    private String instrumentId;
    private OrderSide side;
    private OrderType type;
    private BigDecimal size;
    private OrderStatus status;
    private BigDecimal filledSize;
    private BigDecimal averageFillPrice;
    private SignalType signalType;
    private long signalSequence;
    private String ruleName;
    private int attempts;
    private String rejectionReason;
    private Instant submittedAt;
    private Instant updatedAt;

    public static OrderResponse from(Order order) {
        synchronized (order) {
            return OrderResponse.builder()
                    .idempotencyKey(order.getIdempotencyKey())
                    .exchangeOrderId(order.getExchangeOrderId())
                    .instrumentId(order.getInstrumentId())
                    .side(order.getSide())
                    .type(order.getType())
                    .size(order.getSize())
                    .status(order.getStatus())
                    .filledSize(order.getFilledSize())
                    .averageFillPrice(order.getAverageFillPrice())
                    .signalType(order.getSignalType())
                    .signalSequence(order.getSignalSequence())
                    .ruleName(order.getRuleName())
                    .attempts(order.getAttempts())
                    .rejectionReason(order.getRejectionReason())
                    .submittedAt(order.getSubmittedAt())
                    .updatedAt(order.getUpdatedAt())
                    .build();
        }
    }
}
