package com.tradepilot.api.dto.request;

import com.tradepilot.domain.enums.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Operator reconciliation of an UNKNOWN order.
 */
@Data
public class ResolveOrderRequest {

    /** FILLED, REJECTED or CANCELLED. */
    @NotNull
    private OrderStatus status;

    /** Execution price of the unfilled remainder; required when status is FILLED. */
    @Positive
    private BigDecimal fillPrice;
}
