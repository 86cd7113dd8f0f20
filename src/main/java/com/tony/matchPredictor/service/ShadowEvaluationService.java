package com.tony.matchPredictor.service;

import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ShadowLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Divergence entre la sortie production et la sortie canary d'un même match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShadowEvaluationService {

    private final ServingMetrics metrics;

    /**
     * @param l1 somme des écarts absolus sur tous les codes marché
     * @param kl divergence KL(prod || canary), null si indéfinie
     */
    public record Divergence(double l1, Double kl) {
    }

    public Divergence compare(Map<String, Double> production, Map<String, Double> canary) {
        double l1 = 0.0;
        double kl = 0.0;
        boolean klDefined = true;

        // Même ensemble de codes des deux côtés (code absent du canary = probabilité 0)
        for (Map.Entry<String, Double> e : production.entrySet()) {
            double p = e.getValue();
            double q = canary.getOrDefault(e.getKey(), 0.0);
            l1 += Math.abs(p - q);

            if (q > 0) {
                if (p > 0) kl += p * Math.log(p / q);
            } else if (p > 0) {
                klDefined = false;
            }
        }
        for (Map.Entry<String, Double> e : canary.entrySet()) {
            if (!production.containsKey(e.getKey())) {
                l1 += Math.abs(e.getValue());
            }
        }
        return new Divergence(l1, klDefined ? kl : null);
    }

    public ShadowLogEntry evaluate(MarketProbability production, MarketProbability canary, Instant createdAt) {
        Divergence divergence = compare(production.getProbabilities(), canary.getProbabilities());
        if (divergence.kl() == null) {
            metrics.recordKlUndefined();
            log.warn("⚠️ KL indéfinie pour le match {} : {} attribue 0 à une issue possible pour {}",
                    production.getFixtureId(), canary.getModelVersion(), production.getModelVersion());
        }

        return ShadowLogEntry.builder()
                .fixtureId(production.getFixtureId())
                .productionVersion(production.getModelVersion())
                .canaryVersion(canary.getModelVersion())
                .productionProbabilities(new LinkedHashMap<>(production.getProbabilities()))
                .canaryProbabilities(new LinkedHashMap<>(canary.getProbabilities()))
                .l1Distance(divergence.l1())
                .klDivergence(divergence.kl())
                .createdAt(createdAt)
                .build();
    }
}
