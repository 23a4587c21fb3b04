package com.tradepilot.api.controller;

import com.tradepilot.oms.TradeJournal;
import com.tradepilot.oms.TradeRecord;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** GET /api/trades -- trade history, newest first; {@code ?instrumentId=} filters. */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final TradeJournal tradeJournal;

    public TradeController(TradeJournal tradeJournal) {
        this.tradeJournal = tradeJournal;
    }

    @GetMapping
    public ResponseEntity<List<TradeRecord>> listTrades(@RequestParam(required = false) String instrumentId) {
        return ResponseEntity.ok(instrumentId != null ? tradeJournal.getTrades(instrumentId) : tradeJournal.getTrades());
    }
}
