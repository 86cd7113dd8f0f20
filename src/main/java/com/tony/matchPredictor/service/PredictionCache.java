package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.model.MarketProbability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mémoïsation des prédictions avec TTL fixe.
 * Une entrée est valide tant que now < expiresAt ; l'éviction est paresseuse, la purge planifiée n'est qu'un filet mémoire.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PredictionCache {

    /** Clé = match + version : une promotion n'a jamais à invalider le cache. */
    public record Key(Long fixtureId, Long modelVersionId) {
    }

    private record Entry(MarketProbability value, Instant expiresAt) {
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();

    private final PredictionProperties properties;
    private final Clock clock;

    public Optional<MarketProbability> get(Key key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            // Ne retire que cette entrée : un put concurrent plus récent est conservé
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public MarketProbability put(Key key, MarketProbability value) {
        Instant expiresAt = clock.instant().plus(properties.getCache().getTtl());
        // Copie figée : l'objet de l'appelant n'est pas modifié
        MarketProbability stored = value.toBuilder()
                .probabilities(Collections.unmodifiableMap(new LinkedHashMap<>(value.getProbabilities())))
                .expiresAt(expiresAt)
                .build();
        entries.put(key, new Entry(stored, expiresAt));
        return stored;
    }

    public int size() {
        return entries.size();
    }

    @Scheduled(fixedDelayString = "${prediction.cache.sweep-interval-ms:30000}")
    public void sweepExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("Cache : {} entrées expirées purgées", purged);
        }
    }
}
