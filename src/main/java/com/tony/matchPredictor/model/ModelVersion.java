package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "model_version", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"model_name", "version_label"})
})
public class ModelVersion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false)
    private String modelName; // Ex: "dixon-coles"

    @Column(name = "version_label", nullable = false)
    private String versionLabel; // Ex: "1.4.0"

    private LocalDate trainedOn;

    // --- Métadonnées d'entraînement (hors ligne) ---
    private Double accuracy;
    private Double logLoss;
    private Double brierScore;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = false;

    // --- PARAMÈTRES ALGORITHMIQUES DE LA VERSION ---

    // Paramètre Dixon-Coles (interdépendance des buts faibles, ex: -0.13)
    @Column(nullable = false)
    @Builder.Default
    private Double rho = -0.13;

    // Multiplicateur d'avantage domicile appliqué au lambda domicile
    @Column(nullable = false)
    @Builder.Default
    private Double homeAdvantage = 1.10;

    // Poids de l'écart Elo sur les lambdas (0 = Elo ignoré)
    @Column(nullable = false)
    @Builder.Default
    private Double eloWeight = 0.25;

    // Poids du biais arbitral agrégé (positif = favorise le domicile)
    @Column(nullable = false)
    @Builder.Default
    private Double refereeBiasWeight = 0.05;

    private Instant activatedAt; // Dernière promotion, sert au rollback
    private Instant createdAt;

    @Version
    private Long lockVersion;

    /** Libellé lisible "nom:version", utilisé dans les logs et les journaux shadow. */
    public String label() {
        return modelName + ":" + versionLabel;
    }
}
