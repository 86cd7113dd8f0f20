package com.tony.matchPredictor.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Une jambe du pari : meilleure cote d'une issue et mise associée.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ArbitrageLeg {
    private String outcome;
    private String bookmaker;

    @Column(precision = 10, scale = 3)
    private BigDecimal odds;

    @Column(precision = 19, scale = 2)
    private BigDecimal stake;

    @Column(precision = 19, scale = 2)
    private BigDecimal payout;
}
