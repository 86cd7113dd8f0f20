package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Entrées du modèle pour un match, produites par l'ingestion externe.
 * Figées une fois le coup d'envoi donné.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "fixture_signals")
public class FixtureSignals {
    @Id
    @Column(name = "fixture_id")
    private Long fixtureId;

    // xG moyens par match (pour / contre) de chaque équipe
    private Double homeXgFor;
    private Double homeXgAgainst;
    private Double awayXgFor;
    private Double awayXgAgainst;

    private Double homeElo;
    private Double awayElo;

    // Biais agrégé de l'arbitre désigné, dans [-1, 1] (positif = favorise le domicile)
    private Double refereeBias;

    // Météo (optionnelle)
    private Double windSpeedKmh;
    private Boolean raining;

    private Instant kickoffAt;

    @PreUpdate
    void rejectChangesAfterKickoff() {
        if (kickoffAt != null && Instant.now().isAfter(kickoffAt)) {
            throw new IllegalStateException("Signaux figés : le match " + fixtureId + " a déjà commencé");
        }
    }
}
