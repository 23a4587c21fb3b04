package com.tradepilot.api.controller;

import com.tradepilot.risk.PositionRiskTracker;
import com.tradepilot.risk.RiskLimits;
import com.tradepilot.risk.RiskRejection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Risk reporting.
 *
 * <ul>
 *   <li>GET /api/risk/rejections -- recent denied authorizations, newest first</li>
 *   <li>GET /api/risk/exposure -- current exposure against the account-wide limits</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final PositionRiskTracker positionRiskTracker;
    private final RiskLimits riskLimits;

    public RiskController(PositionRiskTracker positionRiskTracker, RiskLimits riskLimits) {
        this.positionRiskTracker = positionRiskTracker;
        this.riskLimits = riskLimits;
    }

    @GetMapping("/rejections")
    public ResponseEntity<List<RiskRejection>> getRejections() {
        return ResponseEntity.ok(positionRiskTracker.getRecentRejections());
    }

    @GetMapping("/exposure")
    public ResponseEntity<Map<String, Object>> getExposure() {
        Map<String, Object> exposure = new LinkedHashMap<>();
        exposure.put("totalExposure", positionRiskTracker.totalExposure());
        exposure.put("maxTotalNotional", riskLimits.getMaxTotalNotional());
        exposure.put("openPositions", positionRiskTracker.getOpenPositions().size());
        exposure.put("maxOpenPositions", riskLimits.getMaxOpenPositions());
        return ResponseEntity.ok(exposure);
    }
}
