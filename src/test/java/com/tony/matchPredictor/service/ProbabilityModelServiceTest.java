package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.exception.InvalidSignalException;
import com.tony.matchPredictor.model.FixtureSignals;
import com.tony.matchPredictor.model.MarketDefinition;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.model.ScorelineDistribution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ProbabilityModelServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-14T15:00:00Z");

    private ProbabilityModelService modelService;
    private MarketCatalog catalog;
    private ModelVersion version;

    @BeforeEach
    void setUp() {
        catalog = new MarketCatalog();
        modelService = new ProbabilityModelService(new PredictionProperties(), catalog, Clock.fixed(NOW, ZoneOffset.UTC));
        version = ModelVersion.builder().id(1L).modelName("dixon-coles").versionLabel("1.0.0").build();
    }

    @Test
    @DisplayName("La grille des scores somme à 1 et chaque marché est dans [0, 1]")
    void gridSumsToOneAndMarketsAreProbabilities() {
        List<FixtureSignals> cases = List.of(
                signals(1.5, 1.2, 1.1, 1.4, 1500.0, 1500.0),
                signals(2.8, 0.6, 0.4, 2.5, 1900.0, 1300.0),
                signals(0.2, 0.3, 0.25, 0.2, 1400.0, 1450.0),
                signals(4.5, 3.9, 4.2, 4.0, 1600.0, 1600.0));

        for (FixtureSignals s : cases) {
            ScorelineDistribution distribution = modelService.computeDistribution(s, version);
            assertThat(distribution.total()).isCloseTo(1.0, within(1e-6));

            MarketProbability result = modelService.compute(s, version);
            assertThat(result.getProbabilities().values()).allSatisfy(p -> assertThat(p).isBetween(0.0, 1.0));
        }
    }

    @Test
    @DisplayName("Chaque groupe exclusif (1X2, O/U, BTTS, score exact...) somme à 1")
    void exclusiveGroupsSumToOne() {
        MarketProbability result = modelService.compute(signals(1.7, 1.1, 1.3, 1.5, 1620.0, 1540.0), version);

        for (Map.Entry<String, List<MarketDefinition>> group : catalog.groups().entrySet()) {
            double sum = group.getValue().stream()
                    .mapToDouble(def -> result.probabilityOf(def.code()))
                    .sum();
            assertThat(sum).as("groupe %s", group.getKey()).isCloseTo(1.0, within(1e-6));
        }
    }

    @Test
    @DisplayName("Mêmes signaux + même version => probabilités identiques au bit près")
    void computationIsDeterministic() {
        FixtureSignals s = signals(1.9, 1.0, 1.2, 1.6, 1710.0, 1580.0);

        MarketProbability first = modelService.compute(s, version);
        MarketProbability second = modelService.compute(s, version);

        assertThat(second.getProbabilities()).isEqualTo(first.getProbabilities());
        assertThat(second.getExpectedHomeGoals()).isEqualTo(first.getExpectedHomeGoals());
    }

    @Test
    @DisplayName("Devrait donner l'avantage à l'équipe à domicile à signaux égaux")
    void shouldFavorHomeTeamWhenSignalsAreEqual() {
        MarketProbability result = modelService.compute(signals(1.4, 1.4, 1.4, 1.4, 1500.0, 1500.0), version);

        assertThat(result.probabilityOf("1X2_H")).isGreaterThan(result.probabilityOf("1X2_A"));
        assertThat(result.getExpectedHomeGoals()).isGreaterThan(result.getExpectedAwayGoals());
    }

    @Test
    @DisplayName("Un gros écart Elo renforce le favori")
    void eloGapStrengthensFavourite() {
        MarketProbability even = modelService.compute(signals(1.4, 1.3, 1.3, 1.4, 1500.0, 1500.0), version);
        MarketProbability favourite = modelService.compute(signals(1.4, 1.3, 1.3, 1.4, 1900.0, 1500.0), version);

        assertThat(favourite.probabilityOf("1X2_H")).isGreaterThan(even.probabilityOf("1X2_H"));
        assertThat(favourite.getConfidence()).isGreaterThan(even.getConfidence());
    }

    @Test
    @DisplayName("Le vent fort réduit l'espérance de buts")
    void strongWindReducesExpectedGoals() {
        FixtureSignals calm = signals(1.6, 1.2, 1.3, 1.5, 1550.0, 1500.0);
        FixtureSignals windy = signals(1.6, 1.2, 1.3, 1.5, 1550.0, 1500.0);
        windy.setWindSpeedKmh(45.0);

        MarketProbability calmResult = modelService.compute(calm, version);
        MarketProbability windyResult = modelService.compute(windy, version);

        assertThat(windyResult.getExpectedHomeGoals()).isCloseTo(calmResult.getExpectedHomeGoals() * 0.90, within(1e-12));
        assertThat(windyResult.probabilityOf("OU_2_5_UNDER")).isGreaterThan(calmResult.probabilityOf("OU_2_5_UNDER"));
    }

    @Test
    @DisplayName("Des xG extrêmes sont bornés et la grille reste normalisée")
    void extremeInputsAreClampedNotRaised() {
        ScorelineDistribution distribution = modelService.computeDistribution(signals(25.0, 0.1, 0.1, 25.0, 2200.0, 1000.0), version);

        assertThat(distribution.lambdaHome()).isEqualTo(8.0);
        assertThat(distribution.truncatedMass()).isGreaterThan(1e-3);
        assertThat(distribution.total()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Correction Dixon-Coles appliquée aux scores faibles uniquement")
    void tauOnlyTouchesLowScores() {
        assertThat(ProbabilityModelService.tau(0, 0, 1.5, 1.2, -0.13)).isCloseTo(1 + 1.5 * 1.2 * 0.13, within(1e-12));
        assertThat(ProbabilityModelService.tau(1, 1, 1.5, 1.2, -0.13)).isCloseTo(1.13, within(1e-12));
        assertThat(ProbabilityModelService.tau(2, 1, 1.5, 1.2, -0.13)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("La prédiction expire 60 secondes après son calcul")
    void expiresAfterCacheTtl() {
        MarketProbability result = modelService.compute(signals(1.5, 1.2, 1.1, 1.4, 1500.0, 1500.0), version);

        assertThat(result.getComputedAt()).isEqualTo(NOW);
        assertThat(result.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofSeconds(60)));
        assertThat(result.getModelVersion()).isEqualTo("dixon-coles:1.0.0");
    }

    @Test
    @DisplayName("Un xG nul ou négatif est rejeté")
    void rejectsNonPositiveXg() {
        assertThatThrownBy(() -> modelService.compute(signals(0.0, 1.2, 1.1, 1.4, 1500.0, 1500.0), version))
                .isInstanceOf(InvalidSignalException.class);
        assertThatThrownBy(() -> modelService.compute(signals(1.5, 1.2, -0.3, 1.4, 1500.0, 1500.0), version))
                .isInstanceOf(InvalidSignalException.class);
    }

    @Test
    @DisplayName("NaN ou infini sur n'importe quel signal numérique : InvalidSignal, rien n'est servi")
    void rejectsNonFiniteSignals() {
        double[] nonFinite = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY};
        for (double bad : nonFinite) {
            assertThatThrownBy(() -> modelService.compute(signals(bad, 1.2, 1.1, 1.4, 1500.0, 1500.0), version))
                    .isInstanceOf(InvalidSignalException.class);
            assertThatThrownBy(() -> modelService.compute(signals(1.5, bad, 1.1, 1.4, 1500.0, 1500.0), version))
                    .isInstanceOf(InvalidSignalException.class);
            assertThatThrownBy(() -> modelService.compute(signals(1.5, 1.2, bad, 1.4, 1500.0, 1500.0), version))
                    .isInstanceOf(InvalidSignalException.class);
            assertThatThrownBy(() -> modelService.compute(signals(1.5, 1.2, 1.1, bad, 1500.0, 1500.0), version))
                    .isInstanceOf(InvalidSignalException.class);
            assertThatThrownBy(() -> modelService.compute(signals(1.5, 1.2, 1.1, 1.4, bad, 1500.0), version))
                    .isInstanceOf(InvalidSignalException.class);
            assertThatThrownBy(() -> modelService.compute(signals(1.5, 1.2, 1.1, 1.4, 1500.0, bad), version))
                    .isInstanceOf(InvalidSignalException.class);

            FixtureSignals badReferee = signals(1.5, 1.2, 1.1, 1.4, 1500.0, 1500.0);
            badReferee.setRefereeBias(bad);
            assertThatThrownBy(() -> modelService.compute(badReferee, version)).isInstanceOf(InvalidSignalException.class);

            FixtureSignals badWind = signals(1.5, 1.2, 1.1, 1.4, 1500.0, 1500.0);
            badWind.setWindSpeedKmh(bad);
            assertThatThrownBy(() -> modelService.compute(badWind, version)).isInstanceOf(InvalidSignalException.class);
        }
    }

    @Test
    @DisplayName("Biais arbitral hors [-1, 1] rejeté")
    void rejectsRefereeBiasOutOfRange() {
        FixtureSignals s = signals(1.5, 1.2, 1.1, 1.4, 1500.0, 1500.0);
        s.setRefereeBias(1.5);

        assertThatThrownBy(() -> modelService.compute(s, version)).isInstanceOf(InvalidSignalException.class);
    }

    @Test
    @DisplayName("Signaux absents ou incomplets : échec, aucune valeur par défaut")
    void missingSignalsFail() {
        assertThatThrownBy(() -> modelService.compute(null, version)).isInstanceOf(InsufficientInputException.class);

        FixtureSignals noElo = signals(1.5, 1.2, 1.1, 1.4, null, 1500.0);
        assertThatThrownBy(() -> modelService.compute(noElo, version)).isInstanceOf(InsufficientInputException.class);
    }

    @Test
    @DisplayName("Le catalogue expose les issues de chaque groupe dans l'ordre")
    void catalogExposesGroupOutcomes() {
        assertThat(catalog.outcomesFor("1X2")).containsExactly("H", "D", "A");
        assertThat(catalog.outcomesFor("OU_2_5")).containsExactly("OVER", "UNDER");
        assertThat(catalog.outcomesFor("INCONNU")).isEmpty();
        assertThat(catalog.find("CS_OTHER")).isPresent();
    }

    private static FixtureSignals signals(double homeXgFor, double homeXgAgainst, double awayXgFor, double awayXgAgainst,
                                          Double homeElo, Double awayElo) {
        return FixtureSignals.builder()
                .fixtureId(42L)
                .homeXgFor(homeXgFor)
                .homeXgAgainst(homeXgAgainst)
                .awayXgFor(awayXgFor)
                .awayXgAgainst(awayXgAgainst)
                .homeElo(homeElo)
                .awayElo(awayElo)
                .refereeBias(0.0)
                .build();
    }
}
