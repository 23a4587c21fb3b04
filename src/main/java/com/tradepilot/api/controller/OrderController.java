package com.tradepilot.api.controller;

import com.tradepilot.api.dto.request.ResolveOrderRequest;
import com.tradepilot.api.dto.response.OrderResponse;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.model.Order;
import com.tradepilot.exception.ResourceNotFoundException;
import com.tradepilot.oms.OrderExecutionManager;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order endpoints: listing and reconciliation of orders left UNKNOWN.
 *
 * <ul>
 *   <li>GET /api/orders -- all orders, newest first; {@code ?status=} filters</li>
 *   <li>GET /api/orders/unknown -- orders awaiting operator reconciliation</li>
 *   <li>GET /api/orders/{idempotencyKey} -- one order</li>
 *   <li>POST /api/orders/{idempotencyKey}/resolve -- settle an UNKNOWN order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderExecutionManager orderExecutionManager;

    public OrderController(OrderExecutionManager orderExecutionManager) {
        this.orderExecutionManager = orderExecutionManager;
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> listOrders(@RequestParam(required = false) OrderStatus status) {
        List<Order> orders =
                status != null ? orderExecutionManager.getOrders(status) : orderExecutionManager.getOrders();
        return ResponseEntity.ok(orders.stream().map(OrderResponse::from).toList());
    }

    @GetMapping("/unknown")
    public ResponseEntity<List<OrderResponse>> listUnknownOrders() {
        return ResponseEntity.ok(orderExecutionManager.getUnknownOrders().stream()
                .map(OrderResponse::from)
                .toList());
    }

    @GetMapping("/{idempotencyKey}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String idempotencyKey) {
        Order order = orderExecutionManager
                .getOrder(idempotencyKey)
                .orElseThrow(() -> new ResourceNotFoundException("Order", idempotencyKey));
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @PostMapping("/{idempotencyKey}/resolve")
    public ResponseEntity<OrderResponse> resolve(
            @PathVariable String idempotencyKey, @Valid @RequestBody ResolveOrderRequest request) {
        log.info(
                "Operator resolving order: key={} status={} fillPrice={}",
                idempotencyKey,
                request.getStatus(),
                request.getFillPrice());
        Order order = orderExecutionManager.resolveUnknown(idempotencyKey, request.getStatus(), request.getFillPrice());
        return ResponseEntity.ok(OrderResponse.from(order));
    }
}
