package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Dernière cote connue d'un bookmaker pour une issue. Une cote plus récente remplace la précédente.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "bookmaker_odds_quote", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"fixture_id", "bookmaker", "market_code", "outcome"})
})
public class BookmakerOddsQuote {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fixture_id", nullable = false)
    private Long fixtureId;

    @Column(nullable = false)
    private String bookmaker;

    // Groupe de marché du catalogue, ex: "1X2", "OU_2_5", "BTTS"
    @Column(name = "market_code", nullable = false)
    private String marketCode;

    // Issue dans le marché, ex: "H", "OVER", "YES"
    @Column(nullable = false)
    private String outcome;

    // Cote décimale (> 1.0)
    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal odds;

    @Column(nullable = false)
    private Instant quotedAt;
}
