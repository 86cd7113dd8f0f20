package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Affectation collante d'un appareil à un bucket.
 * Toujours insérée (jamais fusionnée) : un doublon concurrent lève une violation de clé primaire.
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "ab_assignment")
public class ABAssignment implements Persistable<String> {
    @Id
    @Column(name = "device_id", nullable = false, updatable = false)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    private Bucket bucket;

    // Pourcentage canary en vigueur lors de l'affectation (audit)
    private Integer canaryPercentage;

    @Column(nullable = false)
    private Instant assignedAt;

    @Transient
    private boolean fresh = true;

    public ABAssignment(String deviceId, Bucket bucket, Integer canaryPercentage, Instant assignedAt) {
        this.deviceId = deviceId;
        this.bucket = bucket;
        this.canaryPercentage = canaryPercentage;
        this.assignedAt = assignedAt;
    }

    @Override
    public String getId() {
        return deviceId;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.fresh = false;
    }
}
