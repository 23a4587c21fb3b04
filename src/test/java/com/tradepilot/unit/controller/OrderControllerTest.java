package com.tradepilot.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradepilot.api.controller.OrderController;
import com.tradepilot.config.ApiResponseAdvice;
import com.tradepilot.domain.enums.OrderSide;
import com.tradepilot.domain.enums.OrderStatus;
import com.tradepilot.domain.enums.OrderType;
import com.tradepilot.domain.enums.SignalType;
import com.tradepilot.domain.model.Order;
import com.tradepilot.exception.GlobalExceptionHandler;
import com.tradepilot.exception.InvalidOrderStateException;
import com.tradepilot.oms.OrderExecutionManager;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    private MockMvc mockMvc;

    @Mock
    private OrderExecutionManager orderExecutionManager;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new OrderController(orderExecutionManager))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Order order(String key, OrderStatus status) {
        return Order.builder()
                .idempotencyKey(key)
                .instrumentId("BTC-USDT")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .size(new BigDecimal("0.01"))
                .status(status)
                .signalType(SignalType.ENTER_LONG)
                .attempts(1)
                .build();
    }

    @Test
    @DisplayName("GET /api/orders lists orders inside the success envelope")
    void listOrders() throws Exception {
        when(orderExecutionManager.getOrders())
                .thenReturn(List.of(order("k2", OrderStatus.ACKED), order("k1", OrderStatus.FILLED)));

        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.data[0].idempotencyKey").value("k2"))
                .andExpect(jsonPath("$.data[1].status").value("FILLED"));
    }

    @Test
    @DisplayName("GET /api/orders?status= filters by status")
    void listOrdersByStatus() throws Exception {
        when(orderExecutionManager.getOrders(OrderStatus.REJECTED))
                .thenReturn(List.of(order("k3", OrderStatus.REJECTED)));

        mockMvc.perform(get("/api/orders").param("status", "REJECTED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].status").value("REJECTED"));
    }

    @Test
    @DisplayName("An unknown status value is a 400")
    void badStatusParam() throws Exception {
        mockMvc.perform(get("/api/orders").param("status", "BOGUS"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("GET /api/orders/unknown lists orders awaiting reconciliation")
    void listUnknown() throws Exception {
        when(orderExecutionManager.getUnknownOrders()).thenReturn(List.of(order("k9", OrderStatus.UNKNOWN)));

        mockMvc.perform(get("/api/orders/unknown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].idempotencyKey").value("k9"))
                .andExpect(jsonPath("$.data[0].status").value("UNKNOWN"));
    }

    @Test
    @DisplayName("GET /api/orders/{key} for a missing key is a 404")
    void orderNotFound() throws Exception {
        when(orderExecutionManager.getOrder("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/orders/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.path").value("/api/orders/nope"));
    }

    @Test
    @DisplayName("POST resolve settles an UNKNOWN order")
    void resolve() throws Exception {
        Order filled = order("k9", OrderStatus.FILLED);
        when(orderExecutionManager.resolveUnknown("k9", OrderStatus.FILLED, new BigDecimal("65000")))
                .thenReturn(filled);

        mockMvc.perform(post("/api/orders/k9/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"FILLED\",\"fillPrice\":65000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("FILLED"));
    }

    @Test
    @DisplayName("POST resolve without a status fails validation")
    void resolveValidation() throws Exception {
        mockMvc.perform(post("/api/orders/k9/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fillPrice\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.status").exists())
                .andExpect(jsonPath("$.details.fillPrice").exists());

        verify(orderExecutionManager, never()).resolveUnknown(any(), any(), any());
    }

    @Test
    @DisplayName("Resolving an order that is not UNKNOWN is a 409")
    void resolveInvalidState() throws Exception {
        when(orderExecutionManager.resolveUnknown(eq("k1"), eq(OrderStatus.CANCELLED), any()))
                .thenThrow(new InvalidOrderStateException("Order k1 is FILLED, not UNKNOWN"));

        mockMvc.perform(post("/api/orders/k1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"CANCELLED\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_ORDER_STATE"));
    }
}
