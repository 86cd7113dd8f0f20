package com.tony.matchPredictor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Surface de prédiction d'un match pour une version de modèle : code marché -> probabilité (0-1).
 * Immuable : une même instance est partagée par le cache entre tous les appelants.
 */
@Value
@Builder(toBuilder = true)
public class MarketProbability {
    Long fixtureId;
    Long modelVersionId;
    String modelVersion; // "nom:version"

    // Ordre du catalogue conservé
    @Builder.Default
    Map<String, Double> probabilities = new LinkedHashMap<>();

    // Lambdas (Espérance de buts)
    Double expectedHomeGoals;
    Double expectedAwayGoals;

    Double confidence; // 0 (1X2 uniforme) à 1 (issue certaine)

    Instant computedAt;
    Instant expiresAt;

    public double probabilityOf(String marketCode) {
        Double p = probabilities.get(marketCode);
        if (p == null) throw new IllegalArgumentException("Marché inconnu : " + marketCode);
        return p;
    }
}
