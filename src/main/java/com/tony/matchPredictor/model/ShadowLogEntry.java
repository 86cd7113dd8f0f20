package com.tony.matchPredictor.model;

import com.tony.matchPredictor.converter.ProbabilityMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Map;

/**
 * Comparaison production / canary pour une requête servie.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "shadow_log", indexes = @Index(columnList = "fixture_id"))
public class ShadowLogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fixture_id", nullable = false)
    private Long fixtureId;

    @Column(nullable = false)
    private String productionVersion;

    @Column(nullable = false)
    private String canaryVersion;

    @Convert(converter = ProbabilityMapConverter.class)
    @Column(length = 20000)
    private Map<String, Double> productionProbabilities;

    @Convert(converter = ProbabilityMapConverter.class)
    @Column(length = 20000)
    private Map<String, Double> canaryProbabilities;

    private Double l1Distance;

    // Null = divergence indéfinie (canary à 0 là où la production ne l'est pas)
    private Double klDivergence;

    @Column(nullable = false)
    private Instant createdAt;
}
