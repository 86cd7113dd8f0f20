package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Prédiction 1X2 confrontée au résultat final. Un seul événement par (match, version).
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "calibration_event", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"fixture_id", "model_version_id"})
})
public class CalibrationEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fixture_id", nullable = false)
    private Long fixtureId;

    @Column(name = "model_version_id", nullable = false)
    private Long modelVersionId;

    @Column(nullable = false)
    private Double pHome;
    @Column(nullable = false)
    private Double pDraw;
    @Column(nullable = false)
    private Double pAway;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    private MatchOutcome outcome;

    @Column(nullable = false)
    private Instant createdAt;

    public double probabilityOf(MatchOutcome o) {
        return switch (o) {
            case H -> pHome;
            case D -> pDraw;
            case A -> pAway;
        };
    }

    /** Issue ayant la plus forte probabilité prédite (égalité : H, puis D). */
    public MatchOutcome predictedOutcome() {
        if (pHome >= pDraw && pHome >= pAway) return MatchOutcome.H;
        if (pDraw >= pAway) return MatchOutcome.D;
        return MatchOutcome.A;
    }

    /** (p_home - 1[H])² + (p_draw - 1[D])² + (p_away - 1[A])² */
    public double brierScore() {
        double sum = 0.0;
        for (MatchOutcome o : MatchOutcome.values()) {
            double hit = (o == outcome) ? 1.0 : 0.0;
            double gap = probabilityOf(o) - hit;
            sum += gap * gap;
        }
        return sum;
    }
}
