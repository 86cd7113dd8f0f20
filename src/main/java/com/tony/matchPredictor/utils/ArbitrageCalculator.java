package com.tony.matchPredictor.utils;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Arithmétique des surebets en décimal fixe (jamais de double pour les mises).
 */
@Slf4j
public final class ArbitrageCalculator {

    // Haute précision pour les calculs intermédiaires, arrondi uniquement à l'affichage / stockage
    public static final MathContext MC = new MathContext(34, RoundingMode.HALF_EVEN);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ArbitrageCalculator() {
    }

    /**
     * Σ 1/cote_i sur les meilleures cotes de chaque issue.
     */
    public static BigDecimal impliedProbabilitySum(List<BigDecimal> bestOdds) {
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal odds : bestOdds) {
            if (odds == null || odds.compareTo(BigDecimal.ONE) <= 0) {
                throw new IllegalArgumentException("Cote invalide (doit être > 1.0) : " + odds);
            }
            sum = sum.add(BigDecimal.ONE.divide(odds, MC), MC);
        }
        return sum;
    }

    public static boolean isArbitrage(BigDecimal impliedProbabilitySum) {
        return impliedProbabilitySum.signum() > 0 && impliedProbabilitySum.compareTo(BigDecimal.ONE) < 0;
    }

    /**
     * Profit % = (1 / somme - 1) * 100
     */
    public static BigDecimal profitPercentage(BigDecimal impliedProbabilitySum) {
        return BigDecimal.ONE.divide(impliedProbabilitySum, MC)
                .subtract(BigDecimal.ONE, MC)
                .multiply(HUNDRED, MC);
    }

    /**
     * Mise de chaque issue : S * (1/cote_i) / somme. Le gain est alors S / somme quelle que soit l'issue.
     */
    public static List<BigDecimal> stakes(List<BigDecimal> bestOdds, BigDecimal totalStake, BigDecimal impliedProbabilitySum) {
        List<BigDecimal> result = new ArrayList<>(bestOdds.size());
        for (BigDecimal odds : bestOdds) {
            BigDecimal stake = totalStake.multiply(BigDecimal.ONE.divide(odds, MC), MC)
                    .divide(impliedProbabilitySum, MC);
            result.add(stake);
        }
        log.debug("Répartition des mises {} pour les cotes {} (total {})", result, bestOdds, totalStake);
        return result;
    }

    public static BigDecimal guaranteedPayout(BigDecimal totalStake, BigDecimal impliedProbabilitySum) {
        return totalStake.divide(impliedProbabilitySum, MC);
    }

    /**
     * Marge bookmaker : (somme - 1) * 100, négative en cas de surebet.
     */
    public static BigDecimal marginPercentage(BigDecimal impliedProbabilitySum) {
        return impliedProbabilitySum.subtract(BigDecimal.ONE, MC).multiply(HUNDRED, MC);
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_EVEN);
    }
}
