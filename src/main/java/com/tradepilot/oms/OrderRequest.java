package com.tradepilot.oms;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.enums.SignalType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Order intent derived from an actionable signal, before it becomes an {@link com.tradepilot.domain.model.Order}.
 *
 * <p>Built by {@link OrderExecutionManager}: side and size follow from the signal and the
 * current position, the reference price is the snapshot's last traded price and is used
 * for notional checks in the risk gate.
 */
@Data
@Builder
public class OrderRequest {

    private String instrumentId;
    private OrderSide side;
    private BigDecimal size;

    @Builder.Default
    private OrderType type = OrderType.MARKET;

    /** Price used to value the order for risk checks. */
    private BigDecimal referencePrice;

    private SignalType signalType;
    private long signalSequence;
    private String ruleName;

    public BigDecimal notional() {
        return size.multiply(referencePrice);
    }
}
