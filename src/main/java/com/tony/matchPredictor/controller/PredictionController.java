package com.tony.matchPredictor.controller;

import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.service.PredictionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {
    private final PredictionService predictionService;

    // Sans deviceId, l'appelant est servi par le modèle actif
    @GetMapping("/{fixtureId}")
    public ResponseEntity<MarketProbability> getMarketProbabilities(
            @PathVariable Long fixtureId,
            @RequestParam(required = false) String deviceId) {
        return ResponseEntity.ok(predictionService.getMarketProbabilities(fixtureId, deviceId));
    }
}
