package com.tradepilot.domain.model;

import com.tradepilot.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Exchange notification that all or part of an order executed.
 *
 * <p>Delivery is at-least-once: the same {@link #getFillId()} may arrive more than once
 * and must be applied at most once.
 */
@Getter
@ToString
@Builder
public class FillEvent {

    /** Exchange-unique identifier of this execution. */
    private final String fillId;

    /** Idempotency key of the order this fill belongs to. */
    private final String idempotencyKey;

    private final String instrumentId;
    private final OrderSide side;
    private final BigDecimal size;
    private final BigDecimal price;
    private final Instant timestamp;
}
