package com.tradepilot.exchange;

import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.model.FillEvent;
import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Abstraction over the venue that accepts orders and reports fills. Every order the
 * engine places goes through this interface.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code PaperExchangeGateway}: in-process simulator, active for
 *       {@code tradepilot.exchange.mode=PAPER} (the default)</li>
 * </ul>
 *
 * <p>Implementations must treat the idempotency key as the identity of the order: a
 * second {@link #placeOrder} with a key already seen must not create a second order.
 */
public interface ExchangeGateway {

    /**
     * Submits an order. The returned future completes with the exchange's verdict, or
     * never completes if the acknowledgement is lost; callers apply their own timeout.
     *
     * @param idempotencyKey client key, identical across retries of one logical order
     */
    CompletableFuture<ExchangeResponse> placeOrder(
            String instrumentId, OrderSide side, BigDecimal size, OrderType type, String idempotencyKey);

    /**
     * Registers the consumer for fills. Delivery is at-least-once: the consumer may see
     * the same fill id more than once, and may see fills before the order's ack.
     */
    void streamFills(Consumer<FillEvent> consumer);
}
