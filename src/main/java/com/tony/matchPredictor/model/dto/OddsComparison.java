package com.tony.matchPredictor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Comparatif des cotes fraîches d'un marché, issue par issue.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OddsComparison {
    private Long fixtureId;
    private String marketCode;
    private List<OutcomeOdds> outcomes;

    // Marge bookmaker sur les meilleures cotes : (Σ 1/meilleure cote - 1) * 100 (négative = surebet)
    private BigDecimal bestOddsMarginPct;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OutcomeOdds {
        private String outcome;
        private BigDecimal bestOdds;
        private String bestBookmaker;
        private BigDecimal worstOdds;
        private BigDecimal averageOdds;
        private int bookmakerCount;
    }
}
