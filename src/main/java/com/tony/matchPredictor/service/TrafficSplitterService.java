package com.tony.matchPredictor.service;

import com.tony.matchPredictor.model.ABAssignment;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.Bucket;
import com.tony.matchPredictor.repository.ABAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Optional;

/**
 * Répartition A/B déterministe et collante par appareil.
 * <p>
 * Slot = SHA-256(deviceId) sur 4 octets, modulo 100. Bucket B si slot < pourcentage canary :
 * passer de p1 à p2 ne bascule que les slots de [p1, p2[.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrafficSplitterService {

    private static final int SLOTS = 100;

    private final ABAssignmentRepository assignmentRepository;
    private final Clock clock;

    /**
     * Bucket de l'appareil : lu en base s'il existe, sinon calculé puis inséré (insert-if-absent).
     */
    public Bucket assign(String deviceId, ABConfig config) {
        Optional<ABAssignment> existing = assignmentRepository.findById(deviceId);
        if (existing.isPresent()) {
            return existing.get().getBucket();
        }

        Bucket bucket = computeBucket(deviceId, config.getCanaryPercentage());
        try {
            assignmentRepository.saveAndFlush(new ABAssignment(deviceId, bucket, config.getCanaryPercentage(), clock.instant()));
            log.debug("Appareil {} affecté au bucket {}", deviceId, bucket);
            return bucket;
        } catch (DataIntegrityViolationException e) {
            // Insertion concurrente : la première écriture fait foi
            log.debug("Affectation concurrente pour {}, relecture", deviceId);
            return assignmentRepository.findById(deviceId)
                    .map(ABAssignment::getBucket)
                    .orElseThrow(() -> e);
        }
    }

    public Bucket computeBucket(String deviceId, int canaryPercentage) {
        return hashSlot(deviceId) < canaryPercentage ? Bucket.B : Bucket.A;
    }

    /** Slot stable dans [0, 99], identique d'un redémarrage à l'autre. */
    public int hashSlot(String deviceId) {
        byte[] digest = sha256(deviceId.getBytes(StandardCharsets.UTF_8));
        long value = ((digest[0] & 0xFFL) << 24)
                | ((digest[1] & 0xFFL) << 16)
                | ((digest[2] & 0xFFL) << 8)
                | (digest[3] & 0xFFL);
        return (int) (value % SLOTS);
    }

    public void clearAssignment(String deviceId) {
        if (assignmentRepository.existsById(deviceId)) {
            assignmentRepository.deleteById(deviceId);
            log.info("🧹 Affectation A/B effacée pour {}", deviceId);
        }
    }

    public void clearAllAssignments() {
        long count = assignmentRepository.count();
        assignmentRepository.deleteAllInBatch();
        log.info("🧹 {} affectations A/B effacées", count);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponible", e);
        }
    }
}
