package com.tony.matchPredictor.controller;

import com.tony.matchPredictor.model.ArbitrageOpportunity;
import com.tony.matchPredictor.model.BookmakerOddsQuote;
import com.tony.matchPredictor.model.dto.OddsComparison;
import com.tony.matchPredictor.service.ArbitrageScannerService;
import com.tony.matchPredictor.service.OddsQuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/arbitrage")
@RequiredArgsConstructor
public class ArbitrageController {
    private final ArbitrageScannerService scannerService;
    private final OddsQuoteService quoteService;

    @GetMapping
    public ResponseEntity<List<ArbitrageOpportunity>> getOpportunities(@RequestParam(required = false) Long fixtureId) {
        return ResponseEntity.ok(scannerService.findOpportunities(fixtureId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<ArbitrageOpportunity>> getHistory(@RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(scannerService.history(days));
    }

    @GetMapping("/compare/{fixtureId}")
    public ResponseEntity<OddsComparison> compareOdds(@PathVariable Long fixtureId,
                                                      @RequestParam(defaultValue = "1X2") String market) {
        return ResponseEntity.ok(scannerService.compareOdds(fixtureId, market));
    }

    // Alimenté par l'ingestion des cotes
    @PutMapping("/quotes")
    public ResponseEntity<BookmakerOddsQuote> upsertQuote(@RequestBody BookmakerOddsQuote quote) {
        return ResponseEntity.ok(quoteService.upsert(quote));
    }
}
