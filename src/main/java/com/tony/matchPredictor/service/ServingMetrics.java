package com.tony.matchPredictor.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Compteurs Micrometer du moteur de prédiction (exposés par l'actuator).
 */
@Service
public class ServingMetrics {

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter shadowEnqueued;
    private final Counter shadowDropped;
    private final Counter shadowErrors;
    private final Counter shadowAbandoned;
    private final Counter klUndefined;
    private final Counter staleQuotes;
    private final Counter arbitrageDetected;
    private final Counter calibrationGateBreached;

    public ServingMetrics(MeterRegistry meterRegistry) {
        this.cacheHits = Counter.builder("prediction.cache.hit")
                .description("Prédictions servies depuis le cache")
                .register(meterRegistry);
        this.cacheMisses = Counter.builder("prediction.cache.miss")
                .description("Prédictions recalculées (absentes ou expirées)")
                .register(meterRegistry);
        this.shadowEnqueued = Counter.builder("shadow.log.enqueued")
                .description("Comparaisons production/canary mises en file")
                .register(meterRegistry);
        this.shadowDropped = Counter.builder("shadow.log.dropped")
                .description("Comparaisons perdues (file pleine, la plus ancienne est évincée)")
                .register(meterRegistry);
        this.shadowErrors = Counter.builder("shadow.log.errors")
                .description("Échecs d'écriture du journal shadow")
                .register(meterRegistry);
        this.shadowAbandoned = Counter.builder("shadow.log.abandoned")
                .description("Écritures shadow abandonnées après toutes les tentatives")
                .register(meterRegistry);
        this.klUndefined = Counter.builder("shadow.kl.undefined")
                .description("Divergences KL indéfinies (canary à 0 où la production ne l'est pas)")
                .register(meterRegistry);
        this.staleQuotes = Counter.builder("arbitrage.quotes.stale")
                .description("Cotes écartées car trop anciennes")
                .register(meterRegistry);
        this.arbitrageDetected = Counter.builder("arbitrage.detected")
                .description("Opportunités d'arbitrage détectées")
                .register(meterRegistry);
        this.calibrationGateBreached = Counter.builder("calibration.gate.breached")
                .description("Alertes de calibration (précision ou ECE hors seuil)")
                .register(meterRegistry);
    }

    public void recordCacheHit() { cacheHits.increment(); }
    public void recordCacheMiss() { cacheMisses.increment(); }
    public void recordShadowEnqueued() { shadowEnqueued.increment(); }
    public void recordShadowDropped() { shadowDropped.increment(); }
    public void recordShadowError() { shadowErrors.increment(); }
    public void recordShadowAbandoned() { shadowAbandoned.increment(); }
    public void recordKlUndefined() { klUndefined.increment(); }
    public void recordStaleQuotes(int count) { staleQuotes.increment(count); }
    public void recordArbitrageDetected() { arbitrageDetected.increment(); }
    public void recordCalibrationGateBreached() { calibrationGateBreached.increment(); }

    public double shadowDroppedCount() { return shadowDropped.count(); }
    public double shadowErrorCount() { return shadowErrors.count(); }
    public double shadowAbandonedCount() { return shadowAbandoned.count(); }
    public double klUndefinedCount() { return klUndefined.count(); }
    public double staleQuoteCount() { return staleQuotes.count(); }
    public double calibrationGateBreachedCount() { return calibrationGateBreached.count(); }
}
