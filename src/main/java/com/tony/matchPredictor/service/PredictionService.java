package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.Bucket;
import com.tony.matchPredictor.model.FixtureSignals;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.repository.FixtureSignalsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Point d'entrée du service de prédiction : cache -> modèle -> répartition A/B -> journal shadow.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final PredictionProperties properties;
    private final FixtureSignalsRepository signalsRepository;
    private final ModelRegistryService registryService;
    private final TrafficSplitterService trafficSplitter;
    private final ProbabilityModelService modelService;
    private final PredictionCache cache;
    private final ShadowLogPublisher shadowLogPublisher;
    private final ServingMetrics metrics;

    /**
     * Probabilités de tous les marchés pour un match, selon le bucket de l'appareil.
     * Production et canary sont calculés à chaque requête ; le journal shadow est asynchrone.
     */
    public MarketProbability getMarketProbabilities(Long fixtureId, String deviceId) {
        ABConfig config = registryService.getAbConfig();
        ModelVersion active = registryService.getActive(properties.getModelName());
        ModelVersion canary = registryService.resolveCanary(config, active).orElse(null);

        Bucket bucket = (deviceId == null || deviceId.isBlank())
                ? Bucket.A
                : trafficSplitter.assign(deviceId, config);

        // Deux appels purs et indépendants, joints seulement pour la comparaison
        MarketProbability production = cachedOrCompute(fixtureId, active);
        if (canary == null) {
            return production;
        }
        MarketProbability challenger = cachedOrCompute(fixtureId, canary);
        shadowLogPublisher.publish(production, challenger);

        log.debug("Match {} servi en bucket {} ({})", fixtureId, bucket,
                bucket == Bucket.B ? canary.label() : active.label());
        return bucket == Bucket.B ? challenger : production;
    }

    private MarketProbability cachedOrCompute(Long fixtureId, ModelVersion version) {
        PredictionCache.Key key = new PredictionCache.Key(fixtureId, version.getId());
        return cache.get(key)
                .map(hit -> {
                    metrics.recordCacheHit();
                    return hit;
                })
                .orElseGet(() -> {
                    metrics.recordCacheMiss();
                    FixtureSignals signals = signalsRepository.findById(fixtureId)
                            .orElseThrow(() -> new InsufficientInputException("Aucun signal pour le match " + fixtureId));
                    return cache.put(key, modelService.compute(signals, version));
                });
    }
}
