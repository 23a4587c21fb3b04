package com.tradepilot.domain.model;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.enums.SignalType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An order submitted (or being submitted) to the exchange for one logical signal.
 *
 * <p>There is exactly one Order per {@link #idempotencyKey} for the lifetime of the process.
 * Mutations happen only inside {@link com.tradepilot.oms.OrderExecutionManager}, which
 * enforces monotonic status transitions via {@link OrderStatus#canTransitionTo}.
 *
 * <p>An order may have multiple partial fills; averageFillPrice is the VWAP across them.
 */
@Data
@Builder
public class Order {

    /** Client-generated key, reused verbatim on every retry of this submission. */
    private String idempotencyKey;

    /** Exchange-assigned order ID. Null until ACKED. */
    private String exchangeOrderId;

    private String instrumentId;
    private OrderSide side;
    private OrderType type;
    private BigDecimal size;

    private OrderStatus status;

    @Builder.Default
    private BigDecimal filledSize = BigDecimal.ZERO;

    /** Volume-weighted average price across all fills. Null until the first fill. */
    private BigDecimal averageFillPrice;

    /** Signal that caused this order. */
    private SignalType signalType;

    private long signalSequence;
    private String ruleName;

    /** Number of exchange submission attempts made (1 = no retry). */
    private int attempts;

    private String rejectionReason;

    private Instant submittedAt;
    private Instant updatedAt;

    public BigDecimal getRemainingSize() {
        return size.subtract(filledSize).max(BigDecimal.ZERO);
    }
}
