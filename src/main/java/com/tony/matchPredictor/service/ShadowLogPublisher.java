package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ShadowLogEntry;
import com.tony.matchPredictor.repository.ShadowLogRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Journalisation shadow hors du chemin de réponse.
 * <p>
 * File bornée : si elle est pleine, la comparaison la plus ancienne est évincée (compteur "dropped"),
 * la requête n'attend jamais. Un worker unique calcule la divergence et écrit en base,
 * avec un nombre borné de tentatives.
 */
@Slf4j
@Component
public class ShadowLogPublisher {

    record PendingComparison(MarketProbability production, MarketProbability canary, Instant requestedAt) {
    }

    private final BlockingQueue<PendingComparison> queue;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "shadow-log-writer");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean running = false;

    private final ShadowEvaluationService evaluationService;
    private final ShadowLogRepository shadowLogRepository;
    private final ServingMetrics metrics;
    private final Clock clock;
    private final int maxAttempts;
    private final long retryBackoffMs;

    public ShadowLogPublisher(PredictionProperties properties,
                              ShadowEvaluationService evaluationService,
                              ShadowLogRepository shadowLogRepository,
                              ServingMetrics metrics,
                              Clock clock) {
        this.queue = new ArrayBlockingQueue<>(properties.getShadow().getQueueCapacity());
        this.maxAttempts = Math.max(1, properties.getShadow().getMaxAttempts());
        this.retryBackoffMs = properties.getShadow().getRetryBackoffMs();
        this.evaluationService = evaluationService;
        this.shadowLogRepository = shadowLogRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        running = true;
        worker.submit(this::runWorker);
        log.info("ShadowLogPublisher démarré (capacité {})", queue.remainingCapacity());
    }

    @PreDestroy
    public void stop() {
        running = false;
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Worker shadow toujours actif à l'arrêt");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        // On écrit ce qui reste plutôt que de le perdre silencieusement
        int remaining = drainPending();
        log.info("ShadowLogPublisher arrêté ({} comparaisons écrites à l'arrêt)", remaining);
    }

    /**
     * Non bloquant : ne lève jamais vers l'appelant.
     */
    public void publish(MarketProbability production, MarketProbability canary) {
        PendingComparison item = new PendingComparison(production, canary, clock.instant());
        while (!queue.offer(item)) {
            PendingComparison evicted = queue.poll();
            if (evicted != null) {
                metrics.recordShadowDropped();
                log.warn("⚠️ File shadow pleine : comparaison du match {} abandonnée", evicted.production().getFixtureId());
            }
        }
        metrics.recordShadowEnqueued();
    }

    public int pendingCount() {
        return queue.size();
    }

    /**
     * Traite immédiatement, sur le thread appelant, toutes les comparaisons en attente.
     *
     * @return nombre de comparaisons traitées
     */
    public int drainPending() {
        int processed = 0;
        PendingComparison item;
        while ((item = queue.poll()) != null) {
            process(item);
            processed++;
        }
        return processed;
    }

    private void runWorker() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                PendingComparison item = queue.poll(500, TimeUnit.MILLISECONDS);
                if (item != null) {
                    process(item);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("❌ Erreur inattendue du worker shadow", e);
            }
        }
    }

    void process(PendingComparison item) {
        ShadowLogEntry entry = evaluationService.evaluate(item.production(), item.canary(), item.requestedAt());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                shadowLogRepository.save(entry);
                return;
            } catch (RuntimeException e) {
                metrics.recordShadowError();
                log.warn("⚠️ Écriture shadow échouée (match {}, tentative {}/{}) : {}",
                        entry.getFixtureId(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !pause()) {
                    break;
                }
            }
        }

        metrics.recordShadowAbandoned();
        log.error("❌ Comparaison shadow abandonnée pour le match {} ({} vs {})",
                entry.getFixtureId(), entry.getProductionVersion(), entry.getCanaryVersion());
    }

    private boolean pause() {
        if (retryBackoffMs <= 0) return true;
        try {
            Thread.sleep(retryBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
