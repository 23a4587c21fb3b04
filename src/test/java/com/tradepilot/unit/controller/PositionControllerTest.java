package com.tradepilot.unit.controller;

import static com.tradepilot.support.TestInstruments.BTC;
import static com.tradepilot.support.TestInstruments.ETH;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradepilot.api.controller.PositionController;
import com.tradepilot.config.ApiResponseAdvice;
import com.tradepilot.domain.enums.PositionSide;
import com.tradepilot.domain.model.Position;
import com.tradepilot.exception.GlobalExceptionHandler;
import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.support.TestRegistry;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class PositionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PositionRiskTracker positionRiskTracker;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PositionController(positionRiskTracker, TestRegistry.of(BTC, ETH)))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Position longBtc() {
        return Position.builder()
                .instrumentId(BTC)
                .side(PositionSide.LONG)
                .size(new BigDecimal("0.01"))
                .averageEntryPrice(new BigDecimal("60000"))
                .markPrice(new BigDecimal("61000"))
                .build();
    }

    @Test
    @DisplayName("GET /api/positions?open=true returns open positions with derived figures")
    void openPositions() throws Exception {
        when(positionRiskTracker.getOpenPositions()).thenReturn(List.of(longBtc()));

        mockMvc.perform(get("/api/positions").param("open", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data[0].side").value("LONG"))
                .andExpect(jsonPath("$.data[0].notional").value(610.0))
                .andExpect(jsonPath("$.data[0].unrealizedPnl").value(10.0));

        verify(positionRiskTracker, never()).getPositions();
    }

    @Test
    @DisplayName("GET /api/positions includes closed positions by default")
    void allPositions() throws Exception {
        when(positionRiskTracker.getPositions()).thenReturn(List.of(longBtc(), Position.flat(ETH)));

        mockMvc.perform(get("/api/positions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].side").value("FLAT"));
    }

    @Test
    @DisplayName("GET /api/positions/{id} for a configured but untraded instrument is FLAT")
    void untraded() throws Exception {
        when(positionRiskTracker.getPosition(ETH)).thenReturn(Position.flat(ETH));

        mockMvc.perform(get("/api/positions/ETH-USDT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.side").value("FLAT"))
                .andExpect(jsonPath("$.data.size").value(0));
    }

    @Test
    @DisplayName("GET /api/positions/{id} for an unconfigured instrument is a 404")
    void unknownInstrument() throws Exception {
        mockMvc.perform(get("/api/positions/DOGE-USDT"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
