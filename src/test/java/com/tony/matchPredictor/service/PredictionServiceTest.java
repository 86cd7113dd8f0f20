package com.tony.matchPredictor.service;

import com.tony.matchPredictor.config.PredictionProperties;
import com.tony.matchPredictor.exception.InsufficientInputException;
import com.tony.matchPredictor.model.ABConfig;
import com.tony.matchPredictor.model.Bucket;
import com.tony.matchPredictor.model.FixtureSignals;
import com.tony.matchPredictor.model.MarketProbability;
import com.tony.matchPredictor.model.ModelVersion;
import com.tony.matchPredictor.repository.FixtureSignalsRepository;
import com.tony.matchPredictor.utils.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictionServiceTest {

    @Mock
    private FixtureSignalsRepository signalsRepository;
    @Mock
    private ModelRegistryService registryService;
    @Mock
    private TrafficSplitterService trafficSplitter;
    @Mock
    private ShadowLogPublisher shadowLogPublisher;

    private MutableClock clock;
    private PredictionService predictionService;

    private final ModelVersion active = ModelVersion.builder()
            .id(1L).modelName("dixon-coles").versionLabel("1.0.0").active(true).build();
    private final ModelVersion canary = ModelVersion.builder()
            .id(2L).modelName("dixon-coles").versionLabel("1.1.0").rho(-0.05).homeAdvantage(1.20).build();

    @BeforeEach
    void setUp() {
        PredictionProperties properties = new PredictionProperties();
        clock = new MutableClock(Instant.parse("2026-03-14T15:00:00Z"));
        ServingMetrics metrics = new ServingMetrics(new SimpleMeterRegistry());
        ProbabilityModelService modelService = new ProbabilityModelService(properties, new MarketCatalog(), clock);
        PredictionCache cache = new PredictionCache(properties, clock);

        predictionService = new PredictionService(properties, signalsRepository, registryService, trafficSplitter,
                modelService, cache, shadowLogPublisher, metrics);

        lenient().when(registryService.getActive("dixon-coles")).thenReturn(active);
        lenient().when(signalsRepository.findById(42L)).thenReturn(Optional.of(signals()));
    }

    @Test
    @DisplayName("Deux appels dans le TTL renvoient le même résultat sans recalcul")
    void repeatedCallsWithinTtlAreIdempotent() {
        when(registryService.getAbConfig()).thenReturn(new ABConfig(0, null));

        MarketProbability first = predictionService.getMarketProbabilities(42L, null);
        clock.advance(Duration.ofSeconds(30));
        MarketProbability second = predictionService.getMarketProbabilities(42L, null);

        assertThat(second).isSameAs(first);
        verify(signalsRepository, times(1)).findById(42L);
    }

    @Test
    @DisplayName("Après expiration, la prédiction est recalculée")
    void recomputesAfterExpiry() {
        when(registryService.getAbConfig()).thenReturn(new ABConfig(0, null));

        MarketProbability first = predictionService.getMarketProbabilities(42L, null);
        clock.advance(Duration.ofSeconds(61));
        MarketProbability second = predictionService.getMarketProbabilities(42L, null);

        assertThat(second).isNotSameAs(first);
        assertThat(second.getProbabilities()).isEqualTo(first.getProbabilities());
        verify(signalsRepository, times(2)).findById(42L);
    }

    @Test
    @DisplayName("Sans canary : sortie production, aucun journal shadow")
    void noCanaryNoShadowLog() {
        ABConfig config = new ABConfig(50, null);
        when(registryService.getAbConfig()).thenReturn(config);
        when(trafficSplitter.assign("dev-1", config)).thenReturn(Bucket.B);

        MarketProbability result = predictionService.getMarketProbabilities(42L, "dev-1");

        assertThat(result.getModelVersionId()).isEqualTo(1L);
        verify(shadowLogPublisher, never()).publish(any(), any());
    }

    @Test
    @DisplayName("Bucket B : sortie canary renvoyée, les deux sorties sont journalisées")
    void bucketBReceivesCanary() {
        ABConfig config = new ABConfig(20, 2L);
        when(registryService.getAbConfig()).thenReturn(config);
        when(registryService.resolveCanary(config, active)).thenReturn(Optional.of(canary));
        when(trafficSplitter.assign("dev-b", config)).thenReturn(Bucket.B);

        MarketProbability result = predictionService.getMarketProbabilities(42L, "dev-b");

        assertThat(result.getModelVersion()).isEqualTo("dixon-coles:1.1.0");
        verify(shadowLogPublisher).publish(
                argThat(p -> p.getModelVersionId().equals(1L)),
                eq(result));
    }

    @Test
    @DisplayName("Bucket A : sortie production renvoyée, comparaison journalisée quand même")
    void bucketAReceivesProductionButShadowIsLogged() {
        ABConfig config = new ABConfig(20, 2L);
        when(registryService.getAbConfig()).thenReturn(config);
        when(registryService.resolveCanary(config, active)).thenReturn(Optional.of(canary));
        when(trafficSplitter.assign("dev-a", config)).thenReturn(Bucket.A);

        MarketProbability result = predictionService.getMarketProbabilities(42L, "dev-a");

        assertThat(result.getModelVersion()).isEqualTo("dixon-coles:1.0.0");
        verify(shadowLogPublisher).publish(eq(result),
                argThat(p -> p.getModelVersionId().equals(2L)));
    }

    @Test
    @DisplayName("Signaux absents : InsufficientInput, pas de valeur par défaut")
    void missingSignalsFailTheRequest() {
        when(registryService.getAbConfig()).thenReturn(new ABConfig(0, null));
        when(signalsRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> predictionService.getMarketProbabilities(99L, null))
                .isInstanceOf(InsufficientInputException.class);
    }

    private static FixtureSignals signals() {
        return FixtureSignals.builder()
                .fixtureId(42L)
                .homeXgFor(1.6).homeXgAgainst(1.1)
                .awayXgFor(1.2).awayXgAgainst(1.5)
                .homeElo(1620.0).awayElo(1550.0)
                .refereeBias(0.1)
                .build();
    }
}
