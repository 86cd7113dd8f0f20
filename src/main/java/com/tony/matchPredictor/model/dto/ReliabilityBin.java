package com.tony.matchPredictor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Une tranche du diagramme de fiabilité : probabilité moyenne prédite vs fréquence observée.
 */
@Data
@AllArgsConstructor
public class ReliabilityBin {
    private double lowerBound;
    private double upperBound;
    private long count;
    private double meanPredicted;
    private double observedFrequency;
}
