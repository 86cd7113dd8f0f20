package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Politique globale de routage canary. Une seule ligne (id = 1).
 */
@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "ab_config")
public class ABConfig {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    // Part du trafic (0-100) routée vers le bucket B
    @Column(nullable = false)
    private Integer canaryPercentage = 0;

    // Null => tout le trafic est servi par le modèle actif
    private Long canaryVersionId;

    private Instant updatedAt;

    @Version
    private Long lockVersion;

    public ABConfig(int canaryPercentage, Long canaryVersionId) {
        this.canaryPercentage = canaryPercentage;
        this.canaryVersionId = canaryVersionId;
    }

    public boolean hasCanary() {
        return canaryVersionId != null;
    }
}
