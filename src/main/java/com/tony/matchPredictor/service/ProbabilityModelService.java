package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.model.FixtureSignals;
import com.tony.matchPredictor.model.MarketDefinition;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.ScorelineDistribution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.PoissonDistribution;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Modèle Dixon-Coles : signaux du match -> grille des scores -> probabilités de tout le catalogue.
 * Sans état : même signaux + même version = mêmes probabilités, au bit près.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProbabilityModelService {

    private static final double MIN_LAMBDA = 0.05;
    private static final double MAX_LAMBDA = 8.0;
    private static final double STRONG_WIND_KMH = 30.0;
    private static final double STRONG_WIND_FACTOR = 0.90;
    private static final double GRID_TOLERANCE = 1e-6;

    private final PredictionProperties properties;
    private final MarketCatalog catalog;
    private final Clock clock;

    public MarketProbability compute(FixtureSignals signals, ModelVersion version) {
        ScorelineDistribution distribution = computeDistribution(signals, version);
        double[][] grid = distribution.grid();

        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (MarketDefinition market : catalog.all()) {
            probabilities.put(market.code(), sumOver(grid, market.predicate()));
        }

        Instant now = clock.instant();
        return MarketProbability.builder()
                .fixtureId(signals.getFixtureId())
                .modelVersionId(version.getId())
                .modelVersion(version.label())
                .probabilities(probabilities)
                .expectedHomeGoals(distribution.lambdaHome())
                .expectedAwayGoals(distribution.lambdaAway())
                .confidence(confidence(probabilities))
                .computedAt(now)
                .expiresAt(now.plus(properties.getCache().getTtl()))
                .build();
    }

    /**
     * Grille normalisée des scores 0..maxGoals x 0..maxGoals.
     */
    public ScorelineDistribution computeDistribution(FixtureSignals signals, ModelVersion version) {
        validate(signals);

        // 1. Lambdas de base : attaque de l'un croisée avec la défense de l'autre (xG)
        double lambdaHome = (signals.getHomeXgFor() + signals.getAwayXgAgainst()) / 2.0 * version.getHomeAdvantage();
        double lambdaAway = (signals.getAwayXgFor() + signals.getHomeXgAgainst()) / 2.0;

        // 2. Écart Elo : espérance de victoire -> décalage multiplicatif
        double eloDiff = signals.getHomeElo() - signals.getAwayElo();
        double expectedHome = 1.0 / (1.0 + Math.pow(10, -eloDiff / 400.0));
        double eloShift = Math.exp(version.getEloWeight() * (2.0 * expectedHome - 1.0));
        lambdaHome *= eloShift;
        lambdaAway /= eloShift;

        // 3. Biais arbitral
        if (signals.getRefereeBias() != null) {
            double refereeFactor = 1.0 + version.getRefereeBiasWeight() * signals.getRefereeBias();
            lambdaHome *= refereeFactor;
            lambdaAway /= refereeFactor;
        }

        // 4. Météo : vent fort = jeu haché, moins de buts
        if (signals.getWindSpeedKmh() != null && signals.getWindSpeedKmh() > STRONG_WIND_KMH) {
            lambdaHome *= STRONG_WIND_FACTOR;
            lambdaAway *= STRONG_WIND_FACTOR;
        }

        lambdaHome = clamp(lambdaHome, MIN_LAMBDA, MAX_LAMBDA);
        lambdaAway = clamp(lambdaAway, MIN_LAMBDA, MAX_LAMBDA);

        int maxGoals = properties.getMaxGoals();
        double[] homePmf = pmf(lambdaHome, maxGoals);
        double[] awayPmf = pmf(lambdaAway, maxGoals);
        double rho = version.getRho();

        double[][] grid = new double[maxGoals + 1][maxGoals + 1];
        double rawSum = 0.0;
        for (int h = 0; h <= maxGoals; h++) {
            for (int a = 0; a <= maxGoals; a++) {
                double p = homePmf[h] * awayPmf[a] * tau(h, a, lambdaHome, lambdaAway, rho);
                grid[h][a] = Math.max(0.0, p);
                rawSum += grid[h][a];
            }
        }

        double truncatedMass = 1.0 - rawSum;
        if (truncatedMass > properties.getTruncationBudget()) {
            log.warn("⚠️ Troncature au-delà du budget pour le match {} ({} masse perdue, λ={}/{}) : grille renormalisée",
                    signals.getFixtureId(), truncatedMass, lambdaHome, lambdaAway);
        }

        double total = 0.0;
        for (int h = 0; h <= maxGoals; h++) {
            for (int a = 0; a <= maxGoals; a++) {
                grid[h][a] /= rawSum;
                total += grid[h][a];
            }
        }
        if (!(Math.abs(total - 1.0) <= GRID_TOLERANCE)) {
            throw new IllegalStateException("Grille des scores non normalisée (somme = " + total + ")");
        }

        return new ScorelineDistribution(grid, lambdaHome, lambdaAway, truncatedMass);
    }

    /**
     * Correction Tau de Dixon-Coles pour les scores faibles (0-0, 1-0, 0-1, 1-1).
     */
    static double tau(int x, int y, double lambda, double mu, double rho) {
        if (x == 0 && y == 0) return 1 - (lambda * mu * rho);
        if (x == 0 && y == 1) return 1 + (lambda * rho);
        if (x == 1 && y == 0) return 1 + (mu * rho);
        if (x == 1 && y == 1) return 1 - rho;
        return 1.0;
    }

    private void validate(FixtureSignals s) {
        if (s == null) {
            throw new InsufficientInputException("Aucun signal disponible pour ce match");
        }
        if (s.getHomeXgFor() == null || s.getHomeXgAgainst() == null
                || s.getAwayXgFor() == null || s.getAwayXgAgainst() == null
                || s.getHomeElo() == null || s.getAwayElo() == null) {
            throw new InsufficientInputException("Signaux incomplets pour le match " + s.getFixtureId());
        }
        // Comparaisons écrites en positif : NaN échoue et est rejeté
        if (!(isPositive(s.getHomeXgFor()) && isPositive(s.getHomeXgAgainst())
                && isPositive(s.getAwayXgFor()) && isPositive(s.getAwayXgAgainst()))) {
            throw new InvalidSignalException("xG doit être fini et > 0 (match " + s.getFixtureId() + ")");
        }
        if (!(isPositive(s.getHomeElo()) && isPositive(s.getAwayElo()))) {
            throw new InvalidSignalException("Elo doit être fini et > 0 (match " + s.getFixtureId() + ")");
        }
        if (s.getRefereeBias() != null && !(s.getRefereeBias() >= -1.0 && s.getRefereeBias() <= 1.0)) {
            throw new InvalidSignalException("Biais arbitral hors [-1, 1] : " + s.getRefereeBias());
        }
        if (s.getWindSpeedKmh() != null && !(Double.isFinite(s.getWindSpeedKmh()) && s.getWindSpeedKmh() >= 0)) {
            throw new InvalidSignalException("Vitesse du vent invalide : " + s.getWindSpeedKmh());
        }
    }

    private static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }

    private static double[] pmf(double lambda, int maxGoals) {
        // Pas de générateur aléatoire : on ne fait qu'évaluer la loi
        PoissonDistribution poisson = new PoissonDistribution(null, lambda,
                PoissonDistribution.DEFAULT_EPSILON, PoissonDistribution.DEFAULT_MAX_ITERATIONS);
        double[] values = new double[maxGoals + 1];
        for (int k = 0; k <= maxGoals; k++) {
            values[k] = poisson.probability(k);
        }
        return values;
    }

    // Ordre de sommation stable : buts domicile croissants, puis buts extérieur croissants
    private static double sumOver(double[][] grid, MarketDefinition.ScorePredicate predicate) {
        double sum = 0.0;
        for (int h = 0; h < grid.length; h++) {
            for (int a = 0; a < grid[h].length; a++) {
                if (predicate.test(h, a)) sum += grid[h][a];
            }
        }
        return clamp(sum, 0.0, 1.0);
    }

    // 1 - entropie(1X2)/ln(3) : 0 si les trois issues sont équiprobables
    private static double confidence(Map<String, Double> probabilities) {
        double entropy = 0.0;
        for (String code : new String[]{"1X2_H", "1X2_D", "1X2_A"}) {
            double p = probabilities.get(code);
            if (p > 0) entropy -= p * Math.log(p);
        }
        return clamp(1.0 - entropy / Math.log(3), 0.0, 1.0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
