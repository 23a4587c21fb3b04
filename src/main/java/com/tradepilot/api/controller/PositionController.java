package com.tradepilot.api.controller;

import com.tradepilot.api.dto.response.PositionResponse;
import com.tradepilot.config.InstrumentRegistry;
import com.tradepilot.risk.PositionRiskTracker;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only position endpoints.
 *
 * <ul>
 *   <li>GET /api/positions -- positions ever opened, including closed ones; {@code ?open=true} for open only</li>
 *   <li>GET /api/positions/{instrumentId} -- one instrument's position (FLAT if never traded)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionRiskTracker positionRiskTracker;
    private final InstrumentRegistry instrumentRegistry;

    public PositionController(PositionRiskTracker positionRiskTracker, InstrumentRegistry instrumentRegistry) {
        this.positionRiskTracker = positionRiskTracker;
        this.instrumentRegistry = instrumentRegistry;
    }

    @GetMapping
    public ResponseEntity<List<PositionResponse>> listPositions(@RequestParam(defaultValue = "false") boolean open) {
        var positions = open ? positionRiskTracker.getOpenPositions() : positionRiskTracker.getPositions();
        return ResponseEntity.ok(positions.stream().map(PositionResponse::from).toList());
    }

    @GetMapping("/{instrumentId}")
    public ResponseEntity<PositionResponse> getPosition(@PathVariable String instrumentId) {
        instrumentRegistry.get(instrumentId);
        return ResponseEntity.ok(PositionResponse.from(positionRiskTracker.getPosition(instrumentId)));
    }
}
