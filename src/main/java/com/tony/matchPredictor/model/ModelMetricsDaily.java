package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Agrégat journalier d'une version, entièrement dérivé des CalibrationEvent du jour (recalculable).
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "model_metrics_daily", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"model_version_id", "metric_day"})
})
public class ModelMetricsDaily {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_version_id", nullable = false)
    private Long modelVersionId;

    @Column(name = "metric_day", nullable = false)
    private LocalDate day;

    private int servedCount;
    private int correctCount;
    private double brierSum;

    // Null tant qu'aucun événement n'est disponible dans la fenêtre
    private Double ece;

    private Instant computedAt;

    @Transient
    public double getAccuracy() {
        return servedCount == 0 ? 0.0 : (double) correctCount / servedCount;
    }

    @Transient
    public double getMeanBrier() {
        return servedCount == 0 ? 0.0 : brierSum / servedCount;
    }
}
