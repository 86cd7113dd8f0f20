package com.tony.matchPredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Surebet détecté : la somme des inverses des meilleures cotes d'un marché est < 1.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "arbitrage_opportunity", indexes = @Index(columnList = "detected_at"))
public class ArbitrageOpportunity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fixture_id", nullable = false)
    private Long fixtureId;

    @Column(name = "market_code", nullable = false)
    private String marketCode;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "arbitrage_leg", joinColumns = @JoinColumn(name = "opportunity_id"))
    @OrderColumn(name = "leg_index")
    @Builder.Default
    private List<ArbitrageLeg> legs = new ArrayList<>();

    @Column(precision = 38, scale = 10)
    private BigDecimal impliedProbabilitySum;

    @Column(precision = 19, scale = 4)
    private BigDecimal profitPercentage;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalStake;

    @Column(precision = 19, scale = 2)
    private BigDecimal guaranteedPayout;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;
}
