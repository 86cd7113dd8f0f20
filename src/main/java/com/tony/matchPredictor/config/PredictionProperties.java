package com.tony.matchPredictor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "prediction")
@Validated
@Data
public class PredictionProperties {
    // --- Modèle servi ---
    private String modelName = "dixon-coles";

    // Troncature de la grille des scores (0..maxGoals buts par équipe)
    @Min(1)
    private int maxGoals = 10;

    // Masse de probabilité perdue par la troncature au-delà de laquelle on log un clamp
    private double truncationBudget = 1e-3;

    @Valid
    private Cache cache = new Cache();
    @Valid
    private Shadow shadow = new Shadow();
    @Valid
    private Calibration calibration = new Calibration();
    @Valid
    private Arbitrage arbitrage = new Arbitrage();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(60);
        // Purge périodique des entrées expirées (lue par @Scheduled)
        private long sweepIntervalMs = 30_000;
    }

    @Data
    public static class Shadow {
        @Min(1)
        private int queueCapacity = 1000;
        @Min(1)
        private int maxAttempts = 3;
        private long retryBackoffMs = 50;
    }

    @Data
    public static class Calibration {
        private double accuracyFloor = 0.45;
        private double eceCeil = 0.10;
        // Fenêtre glissante (jours) pour la précision du gate
        @Min(1)
        private int windowDays = 7;
        // Fenêtre (jours) utilisée pour l'ECE d'une journée : 1 = la journée seule
        @Min(1)
        private int eceWindowDays = 1;
        // Nombre de tranches de fiabilité (ECE)
        @Min(1)
        private int bins = 10;
        private String cron = "0 */15 * * * *";
    }

    @Data
    public static class Arbitrage {
        private Duration freshness = Duration.ofMinutes(5);
        private Duration lookback = Duration.ofHours(1);
        private BigDecimal totalStake = BigDecimal.valueOf(100);
        private BigDecimal minProfitPct = BigDecimal.ZERO;
        private long scanIntervalMs = 30_000;
    }
}
