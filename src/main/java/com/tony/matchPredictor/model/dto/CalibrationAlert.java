package com.tony.matchPredictor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

/**
 * Alerte non bloquante : le service continue, la décision de rollback reste opérationnelle.
 */
@Data
@AllArgsConstructor
public class CalibrationAlert {
    private Long modelVersionId;
    private String modelVersion;
    private double rollingAccuracy;
    private Double latestEce;
    private boolean accuracyBreached;
    private boolean eceBreached;
    private Instant raisedAt;

    public boolean isBreached() {
        return accuracyBreached || eceBreached;
    }
}
